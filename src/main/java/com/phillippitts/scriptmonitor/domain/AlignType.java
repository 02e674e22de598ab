package com.phillippitts.scriptmonitor.domain;

/**
 * Verdict assigned to one reference token (or, for {@link #INS}, one hypothesis-only token).
 */
public enum AlignType {
    /** Token was spoken and matched the script. */
    HIT,
    /** Token was reached but misrecognized. */
    SUB,
    /** Token was skipped inside already-processed content. */
    DEL,
    /** Token exists only in the hypothesis. Never produced by the sequential aligner. */
    INS,
    /** Token has not been reached by the speaker yet. */
    PENDING
}
