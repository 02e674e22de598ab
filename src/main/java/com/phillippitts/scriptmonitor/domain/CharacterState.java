package com.phillippitts.scriptmonitor.domain;

/**
 * Alignment state of a single character of the normalized, whitespace-stripped reference.
 *
 * <p>A "character" is a UTF-16 code unit: aligners walk {@code String.charAt}, so a character
 * outside the BMP (an emoji, for instance) occupies two states. Token spans and CER both count
 * {@code String.length()} the same way, so the three stay consistent.
 */
public enum CharacterState {
    HIT,
    SUB,
    DEL,
    PENDING
}
