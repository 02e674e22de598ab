package com.phillippitts.scriptmonitor.domain;

import java.util.Objects;

/**
 * A reference token (or hypothesis-only token) with its alignment verdict.
 *
 * @param text      display text of the token
 * @param alignType verdict for the token
 */
public record AlignedToken(String text, AlignType alignType) {

    public AlignedToken {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(alignType, "alignType must not be null");
    }

    public boolean isPending() {
        return alignType == AlignType.PENDING;
    }
}
