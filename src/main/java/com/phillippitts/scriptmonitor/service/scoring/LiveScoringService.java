package com.phillippitts.scriptmonitor.service.scoring;

import com.phillippitts.scriptmonitor.config.properties.AlignmentProperties;
import com.phillippitts.scriptmonitor.domain.AlignmentReport;
import com.phillippitts.scriptmonitor.service.alignment.ScriptAlignmentEngine;
import com.phillippitts.scriptmonitor.service.hypothesis.HypothesisLog;
import com.phillippitts.scriptmonitor.service.metrics.MonitorMetrics;
import com.phillippitts.scriptmonitor.service.reference.ReferenceScriptService;
import com.phillippitts.scriptmonitor.service.reference.event.ReferenceLoadedEvent;
import com.phillippitts.scriptmonitor.service.scoring.event.ScoreUpdatedEvent;
import com.phillippitts.scriptmonitor.service.scoring.event.ScoringCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically re-scores the accumulated transcript against the reference script.
 *
 * <p>Each tick either:
 * <ul>
 *   <li>does nothing, when the session is complete or no fragment has arrived</li>
 *   <li>publishes a passthrough update, when no reference is loaded</li>
 *   <li>aligns and scores, stores the report and publishes a {@link ScoreUpdatedEvent}</li>
 * </ul>
 *
 * <p>The session completes on the first report without PENDING tokens. After that no further
 * comparison runs until {@link #reset()} or a new reference is loaded.
 *
 * <p>Every reset starts a new session generation. A pass that began in an earlier generation is
 * discarded: it neither stores its report nor latches completion.
 */
@Service
public class LiveScoringService {

    private static final Logger LOG = LogManager.getLogger(LiveScoringService.class);

    private final ScriptAlignmentEngine engine;
    private final HypothesisLog hypothesisLog;
    private final ReferenceScriptService referenceService;
    private final AlignmentProperties alignmentProps;
    private final MonitorMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicReference<AlignmentReport> latest = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();
    private final ReentrantLock sessionLock = new ReentrantLock();

    public LiveScoringService(ScriptAlignmentEngine engine,
                              HypothesisLog hypothesisLog,
                              ReferenceScriptService referenceService,
                              AlignmentProperties alignmentProps,
                              MonitorMetrics metrics,
                              ApplicationEventPublisher publisher) {
        this.engine = engine;
        this.hypothesisLog = hypothesisLog;
        this.referenceService = referenceService;
        this.alignmentProps = alignmentProps;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    @Scheduled(fixedDelayString = "${monitor.alignment.update-interval-ms:500}")
    public void tick() {
        scoreNow();
    }

    /**
     * Runs one scoring pass.
     *
     * @return the published update, or empty if the pass was skipped
     */
    public Optional<ScoreUpdatedEvent> scoreNow() {
        long session = generation.get();
        if (completed.get()) {
            return Optional.empty();
        }
        if (hypothesisLog.size() == 0) {
            return Optional.empty();
        }
        String hypothesis = hypothesisLog.snapshot();

        if (!referenceService.isLoaded()) {
            ScoreUpdatedEvent passthrough =
                    new ScoreUpdatedEvent(AlignmentReport.empty(), hypothesis, true, Instant.now());
            publisher.publishEvent(passthrough);
            return Optional.of(passthrough);
        }

        long start = System.nanoTime();
        AlignmentReport report = engine.alignAndScore(
                referenceService.current(), hypothesis, alignmentProps.getSimilarityThreshold());
        long elapsed = System.nanoTime() - start;

        boolean justCompleted;
        sessionLock.lock();
        try {
            if (generation.get() != session) {
                LOG.debug("Session reset during scoring; discarding stale report");
                return Optional.empty();
            }
            metrics.recordScoring(engine.getAlignerName(), elapsed, report);
            latest.set(report);
            justCompleted = report.isCompleted() && completed.compareAndSet(false, true);
        } finally {
            sessionLock.unlock();
        }

        ScoreUpdatedEvent update = new ScoreUpdatedEvent(report, hypothesis, false, Instant.now());
        publisher.publishEvent(update);
        if (justCompleted) {
            LOG.debug("Transcript reached the end of the script ({} tokens)", report.metrics().refProcessed());
            publisher.publishEvent(new ScoringCompletedEvent(report, Instant.now()));
        }
        return Optional.of(update);
    }

    /**
     * Clears the transcript, the latest report and the completion flag.
     */
    public void reset() {
        sessionLock.lock();
        try {
            generation.incrementAndGet();
            hypothesisLog.clear();
            latest.set(null);
            completed.set(false);
            metrics.resetScore();
        } finally {
            sessionLock.unlock();
        }
        LOG.info("Scoring session reset");
    }

    @EventListener
    void onReferenceLoaded(ReferenceLoadedEvent e) {
        LOG.debug("Reference replaced (source={}, {} chars); resetting session", e.source(), e.length());
        reset();
    }

    public Optional<AlignmentReport> latestReport() {
        return Optional.ofNullable(latest.get());
    }

    public boolean isCompleted() {
        return completed.get();
    }
}
