package com.phillippitts.scriptmonitor.presentation.controller;

import com.phillippitts.scriptmonitor.config.properties.AlignmentProperties;
import com.phillippitts.scriptmonitor.domain.AlignmentReport;
import com.phillippitts.scriptmonitor.presentation.render.TokenRenderer;
import com.phillippitts.scriptmonitor.service.alignment.ScriptAlignmentEngine;
import com.phillippitts.scriptmonitor.service.hypothesis.HypothesisLog;
import com.phillippitts.scriptmonitor.service.reference.ReferenceScriptService;
import com.phillippitts.scriptmonitor.service.scoring.LiveScoringService;
import com.phillippitts.scriptmonitor.service.subtitle.SubtitleForwarder;
import com.phillippitts.scriptmonitor.service.transport.MonitorServer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * REST surface of the monitor: live score, ad-hoc scoring, script loading and session control.
 */
@RestController
@RequestMapping("/api/monitor")
class MonitorController {

    private static final Logger LOG = LogManager.getLogger(MonitorController.class);
    private static final MediaType TEXT_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final LiveScoringService scoringService;
    private final ScriptAlignmentEngine engine;
    private final ReferenceScriptService referenceService;
    private final HypothesisLog hypothesisLog;
    private final SubtitleForwarder forwarder;
    private final MonitorServer server;
    private final AlignmentProperties alignmentProps;
    private final TokenRenderer renderer;

    MonitorController(LiveScoringService scoringService,
                      ScriptAlignmentEngine engine,
                      ReferenceScriptService referenceService,
                      HypothesisLog hypothesisLog,
                      SubtitleForwarder forwarder,
                      MonitorServer server,
                      AlignmentProperties alignmentProps,
                      TokenRenderer renderer) {
        this.scoringService = scoringService;
        this.engine = engine;
        this.referenceService = referenceService;
        this.hypothesisLog = hypothesisLog;
        this.forwarder = forwarder;
        this.server = server;
        this.alignmentProps = alignmentProps;
        this.renderer = renderer;
    }

    /**
     * Latest live report, or 204 before the first scoring pass.
     */
    @GetMapping("/score")
    ResponseEntity<AlignmentReport> latestScore() {
        return scoringService.latestReport()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Latest live report as two text lines: the metrics, then the reached tokens. {@code ansi}
     * colors each token by verdict for terminal display; {@code plain} marks errors inline.
     */
    @GetMapping("/score/rendered")
    ResponseEntity<String> renderedScore(@RequestParam(name = "format", defaultValue = "ansi") String format) {
        boolean ansi = switch (format.toLowerCase(Locale.ROOT)) {
            case "ansi" -> true;
            case "plain" -> false;
            default -> throw new IllegalArgumentException("format must be 'ansi' or 'plain'");
        };
        return scoringService.latestReport()
                .map(report -> ResponseEntity.ok()
                        .contentType(TEXT_UTF8)
                        .body(renderer.formatMetrics(report.metrics()) + "\n"
                                + (ansi ? renderer.renderAnsi(report.tokens()) : renderer.renderPlain(report.tokens()))
                                + "\n"))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    /**
     * Scores the given texts without touching the live session.
     */
    @PostMapping("/score")
    ResponseEntity<AlignmentReport> score(@Valid @RequestBody ScoreRequest request) {
        double threshold = request.threshold() != null
                ? request.threshold()
                : alignmentProps.getSimilarityThreshold();
        return ResponseEntity.ok(engine.alignAndScore(request.reference(), request.hypothesis(), threshold));
    }

    @PutMapping(path = "/reference", consumes = MediaType.TEXT_PLAIN_VALUE)
    ResponseEntity<Map<String, Object>> loadReference(@RequestBody String script) {
        String loaded = referenceService.loadFromText(script);
        return ResponseEntity.ok(Map.of("length", loaded.length()));
    }

    @PostMapping("/reset")
    ResponseEntity<Void> reset() {
        scoringService.reset();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/subtitle/reconnect")
    ResponseEntity<Map<String, Object>> reconnectSubtitle() {
        boolean connected = forwarder.reconnect();
        LOG.info("Subtitle reconnect requested: connected={}", connected);
        return ResponseEntity.ok(Map.of(
                "enabled", forwarder.isEnabled(),
                "connected", connected
        ));
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("referenceLoaded", referenceService.isLoaded());
        body.put("referenceLength", referenceService.current().length());
        body.put("fragments", hypothesisLog.size());
        body.put("completed", scoringService.isCompleted());
        body.put("aligner", engine.getAlignerName());
        body.put("serverPort", server.getLocalPort());
        body.put("activeConnections", server.getActiveConnections());
        body.put("subtitleEnabled", forwarder.isEnabled());
        body.put("subtitleConnected", forwarder.isConnected());
        return ResponseEntity.ok(body);
    }
}
