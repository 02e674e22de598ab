package com.phillippitts.scriptmonitor.service.alignment;

import com.phillippitts.scriptmonitor.domain.AlignType;
import com.phillippitts.scriptmonitor.domain.AlignedToken;
import com.phillippitts.scriptmonitor.domain.TokenSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds the character states inside each token span into a single token verdict.
 *
 * <p>Rules, in priority order:
 * <ol>
 *   <li>Zero-width span (pure punctuation) → {@link AlignType#HIT}</li>
 *   <li>Span starts after the last processed character → {@link AlignType#PENDING}</li>
 *   <li>Span straddles the processed boundary → judged on its processed characters only:
 *       HIT if {@code hits / processed >= threshold}, else SUB</li>
 *   <li>Span entirely pending → PENDING</li>
 *   <li>Span fully processed → HIT if {@code hits / length >= threshold}; else SUB if
 *       {@code hits + subs > dels}; else {@link AlignType#DEL}</li>
 * </ol>
 *
 * <p>The threshold makes a token with mostly matching characters count as a hit even if one or
 * two characters were misrecognized.
 */
public class TokenClassifier {

    public static final double DEFAULT_THRESHOLD = 0.6;

    /**
     * Classifies every span, preserving order.
     *
     * @param spans     token spans over the normalized reference
     * @param alignment character states from the aligner
     * @param threshold minimum hit ratio for a HIT verdict
     * @return one token per span
     */
    public List<AlignedToken> classify(List<TokenSpan> spans, CharacterAlignment alignment, double threshold) {
        List<AlignedToken> tokens = new ArrayList<>(spans.size());
        for (TokenSpan span : spans) {
            tokens.add(new AlignedToken(span.originalText(), classify(span, alignment, threshold)));
        }
        return tokens;
    }

    AlignType classify(TokenSpan span, CharacterAlignment alignment, double threshold) {
        if (span.isEmpty()) {
            return AlignType.HIT;
        }
        if (span.start() > alignment.lastProcessedIndex()) {
            return AlignType.PENDING;
        }

        int hits = 0;
        int subs = 0;
        int dels = 0;
        int pendings = 0;
        int end = Math.min(span.end(), alignment.length());
        for (int i = span.start(); i < end; i++) {
            switch (alignment.stateAt(i)) {
                case HIT -> hits++;
                case SUB -> subs++;
                case DEL -> dels++;
                case PENDING -> pendings++;
            }
        }
        int length = end - span.start();
        int processed = hits + subs + dels;

        if (pendings > 0 && pendings < length) {
            if (processed == 0) {
                return AlignType.PENDING;
            }
            return ratio(hits, processed) >= threshold ? AlignType.HIT : AlignType.SUB;
        }
        if (pendings == length) {
            return AlignType.PENDING;
        }
        if (ratio(hits, processed) >= threshold) {
            return AlignType.HIT;
        }
        return hits + subs > dels ? AlignType.SUB : AlignType.DEL;
    }

    private static double ratio(int hits, int total) {
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
