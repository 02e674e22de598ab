package com.phillippitts.scriptmonitor.domain;

/**
 * Error rates over the processed prefix of the reference only.
 *
 * <p>Counts are token-level; {@code cer} is character-level. The not-yet-spoken remainder of the
 * script is excluded from every figure, so {@code refProcessed = hits + substitutions + deletions}.
 *
 * @param wer           (substitutions + deletions) / refProcessed, or 0 when nothing was processed
 * @param cer           character edit distance over the processed reference prefix, normalized by its length
 * @param hits          tokens classified {@link AlignType#HIT}
 * @param substitutions tokens classified {@link AlignType#SUB}
 * @param deletions     tokens classified {@link AlignType#DEL}
 * @param insertions    always 0 for the character aligners
 * @param refProcessed  reference tokens the hypothesis has reached
 */
public record PartialMetrics(
        double wer,
        double cer,
        int hits,
        int substitutions,
        int deletions,
        int insertions,
        int refProcessed
) {

    private static final PartialMetrics ZERO = new PartialMetrics(0.0, 0.0, 0, 0, 0, 0, 0);

    public PartialMetrics {
        if (wer < 0.0 || cer < 0.0) {
            throw new IllegalArgumentException("Error rates must not be negative");
        }
        if (hits < 0 || substitutions < 0 || deletions < 0 || insertions < 0 || refProcessed < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
    }

    public static PartialMetrics zero() {
        return ZERO;
    }
}
