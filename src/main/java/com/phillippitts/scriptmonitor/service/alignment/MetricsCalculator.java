package com.phillippitts.scriptmonitor.service.alignment;

import com.phillippitts.scriptmonitor.domain.AlignedToken;
import com.phillippitts.scriptmonitor.domain.PartialMetrics;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Computes partial WER and CER over the part of the script the hypothesis has reached.
 *
 * <p>WER counts classified tokens; pending tokens are excluded from both numerator and
 * denominator. Insertions are never reported by the character aligners, so WER is
 * {@code (substitutions + deletions) / refProcessed}.
 *
 * <p>CER is the Levenshtein distance between the processed reference prefix
 * ({@code reference[0..lastProcessedIndex]}) and the whole normalized hypothesis, divided by the
 * prefix length. Degenerate inputs resolve to 0.0.
 */
public class MetricsCalculator {

    private static final Logger LOG = LogManager.getLogger(MetricsCalculator.class);

    private final LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();

    /**
     * @param tokens               classified reference tokens
     * @param alignment            character alignment the tokens were derived from
     * @param normalizedReference  normalized, whitespace-stripped reference
     * @param normalizedHypothesis normalized, whitespace-stripped hypothesis
     * @return partial metrics; zero counts and rates when nothing was processed
     */
    public PartialMetrics compute(List<AlignedToken> tokens,
                                  CharacterAlignment alignment,
                                  String normalizedReference,
                                  String normalizedHypothesis) {
        int hits = 0;
        int subs = 0;
        int dels = 0;
        for (AlignedToken token : tokens) {
            switch (token.alignType()) {
                case HIT -> hits++;
                case SUB -> subs++;
                case DEL -> dels++;
                default -> {
                    // PENDING tokens are outside the processed prefix; INS is never produced here
                }
            }
        }
        int refProcessed = hits + subs + dels;
        double wer = refProcessed > 0 ? (double) (subs + dels) / refProcessed : 0.0;
        double cer = characterErrorRate(alignment.lastProcessedIndex(), normalizedReference, normalizedHypothesis);
        return new PartialMetrics(wer, cer, hits, subs, dels, 0, refProcessed);
    }

    double characterErrorRate(int lastProcessedIndex, String reference, String hypothesis) {
        if (lastProcessedIndex < 0 || reference == null || hypothesis == null) {
            return 0.0;
        }
        try {
            String partialRef = reference.substring(0, lastProcessedIndex + 1);
            if (partialRef.isEmpty()) {
                return 0.0;
            }
            return (double) levenshtein.apply(partialRef, hypothesis) / partialRef.length();
        } catch (RuntimeException e) {
            LOG.debug("CER computation failed (lastProcessedIndex={}, refLength={}): {}",
                    lastProcessedIndex, reference.length(), e.toString());
            return 0.0;
        }
    }
}
