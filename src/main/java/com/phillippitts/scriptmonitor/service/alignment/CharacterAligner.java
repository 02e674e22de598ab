package com.phillippitts.scriptmonitor.service.alignment;

/**
 * Strategy interface for aligning a growing hypothesis against a reference at character level.
 *
 * <p>Both inputs are already normalized and whitespace-stripped. Implementations assign one
 * {@link com.phillippitts.scriptmonitor.domain.CharacterState} per reference character, leaving
 * content the hypothesis has not reached as {@code PENDING}, so downstream token classification
 * and metrics can tell omissions apart from script that simply has not been read yet.
 *
 * <p><b>Available Strategies:</b>
 * <ul>
 *   <li>{@link com.phillippitts.scriptmonitor.service.alignment.impl.SequentialAligner} -
 *       single-pass bounded-lookahead match; robust against repeated phrases (default)</li>
 *   <li>{@link com.phillippitts.scriptmonitor.service.alignment.impl.OptimalAligner} -
 *       minimum-edit-distance alignment with trailing deletions reported as pending</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Implementations must be stateless and thread-safe; the engine is
 * re-run over the full hypothesis on every scoring tick.
 *
 * @see ScriptAlignmentEngine
 * @since 1.0
 */
public interface CharacterAligner {

    /**
     * Aligns the hypothesis against the reference.
     *
     * @param reference  normalized, whitespace-stripped reference (never null)
     * @param hypothesis normalized, whitespace-stripped hypothesis (never null)
     * @return per-character states, exactly {@code reference.length()} of them
     */
    CharacterAlignment align(String reference, String hypothesis);

    /**
     * Short strategy name for logs and metrics tags.
     */
    String name();
}
