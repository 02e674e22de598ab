package com.phillippitts.scriptmonitor.service.events;

import com.phillippitts.scriptmonitor.service.subtitle.event.SubtitleForwardFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing error events. Privacy-safe and throttled to avoid log spam
 * while a sink stays unreachable.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onSubtitleForwardFailed(SubtitleForwardFailedEvent e) {
        String key = "subtitle-" + e.endpoint() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Subtitle server {} unreachable (reason={}). Scoring continues; "
                    + "use POST /api/monitor/subtitle/reconnect once it is back.", e.endpoint(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
