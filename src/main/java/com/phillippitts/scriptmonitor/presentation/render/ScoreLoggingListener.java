package com.phillippitts.scriptmonitor.presentation.render;

import com.phillippitts.scriptmonitor.service.scoring.event.ScoreUpdatedEvent;
import com.phillippitts.scriptmonitor.service.scoring.event.ScoringCompletedEvent;
import com.phillippitts.scriptmonitor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes each score update to the log. Updates repeat every interval, so they go to DEBUG; the
 * completed session is logged once at INFO.
 */
@Component
class ScoreLoggingListener {

    private static final Logger LOG = LogManager.getLogger(ScoreLoggingListener.class);
    private static final int PREVIEW_CHARS = 120;

    private final TokenRenderer renderer;

    ScoreLoggingListener(TokenRenderer renderer) {
        this.renderer = renderer;
    }

    @EventListener
    void onScoreUpdated(ScoreUpdatedEvent e) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        if (e.passthrough()) {
            LOG.debug("Transcript (no reference): {}", LogSanitizer.preview(e.hypothesis(), PREVIEW_CHARS));
            return;
        }
        LOG.debug("{} | pending={} | {}",
                renderer.formatMetrics(e.report().metrics()),
                e.report().pendingCount(),
                LogSanitizer.preview(renderer.renderPlain(e.report().tokens()), PREVIEW_CHARS));
    }

    @EventListener
    void onScoringCompleted(ScoringCompletedEvent e) {
        LOG.info("Script comparison complete. {}", renderer.formatMetrics(e.finalReport().metrics()));
    }
}
