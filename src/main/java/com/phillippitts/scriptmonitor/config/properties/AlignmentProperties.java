package com.phillippitts.scriptmonitor.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "monitor.alignment")
public class AlignmentProperties {

    public enum Strategy { SEQUENTIAL, OPTIMAL }

    /** Character aligner used by the scoring engine. */
    @NotNull
    private final Strategy strategy;

    /** Minimum character hit ratio for a token to count as a hit (0..1). */
    @Min(0)
    @Max(1)
    private final double similarityThreshold;

    /** Resynchronization window of the sequential aligner. */
    @Min(1)
    private final int maxLookahead;

    /** Period of the live scoring pass, in milliseconds. */
    @Min(50)
    private final long updateIntervalMs;

    @ConstructorBinding
    public AlignmentProperties(Strategy strategy, Double similarityThreshold, Integer maxLookahead,
                               Long updateIntervalMs) {
        this.strategy = strategy == null ? Strategy.SEQUENTIAL : strategy;
        double t = similarityThreshold == null ? 0.6 : similarityThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("monitor.alignment.similarity-threshold must be in [0,1]");
        }
        this.similarityThreshold = t;
        int look = maxLookahead == null ? 3 : maxLookahead;
        if (look < 1) {
            throw new IllegalArgumentException("monitor.alignment.max-lookahead must be >= 1");
        }
        this.maxLookahead = look;
        this.updateIntervalMs = updateIntervalMs == null ? 500L : updateIntervalMs;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public int getMaxLookahead() {
        return maxLookahead;
    }

    public long getUpdateIntervalMs() {
        return updateIntervalMs;
    }
}
