package com.phillippitts.scriptmonitor.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of one scoring pass: classified reference tokens in script order plus partial metrics.
 *
 * @param tokens  one entry per whitespace-delimited reference token
 * @param metrics partial error rates over the processed prefix
 */
public record AlignmentReport(List<AlignedToken> tokens, PartialMetrics metrics) {

    public AlignmentReport {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public static AlignmentReport empty() {
        return new AlignmentReport(List.of(), PartialMetrics.zero());
    }

    /**
     * True once every reference token has been reached. An empty report is never complete.
     */
    public boolean isCompleted() {
        return !tokens.isEmpty() && tokens.stream().noneMatch(AlignedToken::isPending);
    }

    public long pendingCount() {
        return tokens.stream().filter(AlignedToken::isPending).count();
    }
}
