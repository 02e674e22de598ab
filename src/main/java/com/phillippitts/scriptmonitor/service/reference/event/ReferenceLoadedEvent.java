package com.phillippitts.scriptmonitor.service.reference.event;

import java.time.Instant;

/**
 * Published after a new reference script replaces the current one.
 *
 * @param source    file path, or "text" for scripts supplied directly
 * @param length    characters in the collapsed script
 * @param timestamp when the script was loaded
 */
public record ReferenceLoadedEvent(String source, int length, Instant timestamp) {
}
