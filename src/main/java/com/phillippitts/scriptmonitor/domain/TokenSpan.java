package com.phillippitts.scriptmonitor.domain;

import java.util.Objects;

/**
 * Half-open range {@code [start, end)} of one whitespace-delimited reference token inside the
 * normalized, whitespace-stripped reference string.
 *
 * <p>A token that normalizes to nothing (pure punctuation) has {@code start == end}.
 *
 * @param start        inclusive start offset
 * @param end          exclusive end offset
 * @param originalText the token as it appears in the script, used for display
 */
public record TokenSpan(int start, int end, String originalText) {

    public TokenSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        Objects.requireNonNull(originalText, "originalText must not be null");
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }
}
