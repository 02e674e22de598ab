package com.phillippitts.scriptmonitor.service.metrics;

import com.phillippitts.scriptmonitor.domain.AlignmentReport;
import com.phillippitts.scriptmonitor.domain.PartialMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for the monitor.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Frames received and rejected by the monitor server</li>
 *   <li>Fragments forwarded to the subtitle sink, by outcome</li>
 *   <li>Scoring latency per aligner</li>
 *   <li>Gauges for WER, CER and pending tokens of the latest report</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class MonitorMetrics {

    private static final String METRIC_PREFIX = "scriptmonitor";

    private final MeterRegistry registry;
    private final AtomicReference<AlignmentReport> latest = new AtomicReference<>(AlignmentReport.empty());

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".score.wer", latest, ref -> ref.get().metrics().wer())
                .description("Partial word error rate of the latest report")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".score.cer", latest, ref -> ref.get().metrics().cer())
                .description("Partial character error rate of the latest report")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".score.pending", latest, ref -> ref.get().pendingCount())
                .description("Reference tokens not yet reached by the transcript")
                .register(registry);
    }

    /**
     * Counts a decoded request frame.
     *
     * @param hasFragment whether the frame carried a non-blank fragment
     */
    public void incrementFramesReceived(boolean hasFragment) {
        Counter.builder(METRIC_PREFIX + ".frames.received")
                .description("Request frames decoded by the monitor server")
                .tag("fragment", hasFragment ? "yes" : "no")
                .register(registry)
                .increment();
    }

    /**
     * @param reason short failure reason (decode, io)
     */
    public void incrementFramesRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".frames.rejected")
                .description("Connections ended by an undecodable frame or socket error")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome forwarding outcome (ok, failed)
     */
    public void incrementForwarded(String outcome) {
        Counter.builder(METRIC_PREFIX + ".subtitle.forwarded")
                .description("Fragments forwarded to the subtitle sink")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records one scoring pass.
     *
     * @param alignerName   aligner used (sequential, optimal)
     * @param durationNanos duration in nanoseconds
     * @param report        the resulting report, exposed through gauges
     */
    public void recordScoring(String alignerName, long durationNanos, AlignmentReport report) {
        Timer.builder(METRIC_PREFIX + ".scoring.latency")
                .description("Time taken to align and score the transcript")
                .tag("aligner", alignerName)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        latest.set(report);
    }

    public void resetScore() {
        latest.set(AlignmentReport.empty());
    }

    PartialMetrics latestMetrics() {
        return latest.get().metrics();
    }
}
