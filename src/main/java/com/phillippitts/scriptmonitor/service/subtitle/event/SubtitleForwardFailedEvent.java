package com.phillippitts.scriptmonitor.service.subtitle.event;

import java.time.Instant;

/**
 * Published when a fragment could not be delivered to the subtitle server.
 *
 * Payload contains the endpoint and a short reason. Avoids transcript text.
 */
public record SubtitleForwardFailedEvent(String endpoint, String reason, Instant at) { }
