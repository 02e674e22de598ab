package com.phillippitts.scriptmonitor.service.alignment;

import com.phillippitts.scriptmonitor.domain.AlignType;
import com.phillippitts.scriptmonitor.domain.AlignedToken;
import com.phillippitts.scriptmonitor.domain.AlignmentReport;
import com.phillippitts.scriptmonitor.domain.PartialMetrics;
import com.phillippitts.scriptmonitor.domain.TokenSpan;
import com.phillippitts.scriptmonitor.service.normalize.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the alignment and partial-scoring engine.
 *
 * <p>Pipeline per call: normalize both texts → align characters → classify reference tokens →
 * compute partial metrics. Each call is recomputed from the full hypothesis; no alignment state
 * survives between calls. The only thing remembered is the token span layout of the most recent
 * reference, which depends on the reference alone.
 *
 * <p>Total over its input domain: any strings (null is read as empty) and any non-negative
 * threshold produce a report without throwing.
 *
 * <p>Thread-safe.
 */
public class ScriptAlignmentEngine {

    private final TextNormalizer normalizer;
    private final CharacterAligner aligner;
    private final TokenRangeMapper rangeMapper;
    private final TokenClassifier classifier;
    private final MetricsCalculator metricsCalculator;

    private final AtomicReference<SpanCacheEntry> spanCache = new AtomicReference<>();

    public ScriptAlignmentEngine(TextNormalizer normalizer,
                                 CharacterAligner aligner,
                                 TokenRangeMapper rangeMapper,
                                 TokenClassifier classifier,
                                 MetricsCalculator metricsCalculator) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.aligner = Objects.requireNonNull(aligner, "aligner must not be null");
        this.rangeMapper = Objects.requireNonNull(rangeMapper, "rangeMapper must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.metricsCalculator = Objects.requireNonNull(metricsCalculator, "metricsCalculator must not be null");
    }

    /**
     * Scores the hypothesis with the default similarity threshold.
     */
    public AlignmentReport alignAndScore(String reference, String hypothesis) {
        return alignAndScore(reference, hypothesis, TokenClassifier.DEFAULT_THRESHOLD);
    }

    /**
     * Aligns a live hypothesis against the reference script and scores the processed prefix.
     *
     * @param reference  reference script (may be null or empty)
     * @param hypothesis accumulated transcript so far (may be null or empty)
     * @param threshold  minimum character hit ratio for a token to count as a hit
     * @return classified tokens, one per whitespace-delimited reference token, plus metrics
     * @throws IllegalArgumentException if threshold is negative or NaN
     */
    public AlignmentReport alignAndScore(String reference, String hypothesis, double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        if (reference == null || reference.isEmpty()) {
            return AlignmentReport.empty();
        }

        List<TokenSpan> spans = spansFor(reference);
        String normRef = normalizer.normalizeNoSpace(reference);
        String normHyp = normalizer.normalizeNoSpace(hypothesis);

        if (normHyp.isEmpty()) {
            return new AlignmentReport(allPending(spans), PartialMetrics.zero());
        }

        CharacterAlignment alignment = aligner.align(normRef, normHyp);
        List<AlignedToken> tokens = classifier.classify(spans, alignment, threshold);
        PartialMetrics metrics = metricsCalculator.compute(tokens, alignment, normRef, normHyp);
        return new AlignmentReport(tokens, metrics);
    }

    /**
     * Character-level alignment of normalized texts, without token classification.
     */
    public CharacterAlignment alignCharacters(String reference, String hypothesis) {
        return aligner.align(normalizer.normalizeNoSpace(reference), normalizer.normalizeNoSpace(hypothesis));
    }

    public String getAlignerName() {
        return aligner.name();
    }

    List<TokenSpan> spansFor(String reference) {
        SpanCacheEntry cached = spanCache.get();
        if (cached != null && cached.reference().equals(reference)) {
            return cached.spans();
        }
        List<TokenSpan> spans = rangeMapper.map(reference);
        spanCache.set(new SpanCacheEntry(reference, spans));
        return spans;
    }

    private static List<AlignedToken> allPending(List<TokenSpan> spans) {
        List<AlignedToken> tokens = new ArrayList<>(spans.size());
        for (TokenSpan span : spans) {
            tokens.add(new AlignedToken(span.originalText(), AlignType.PENDING));
        }
        return tokens;
    }

    private record SpanCacheEntry(String reference, List<TokenSpan> spans) {
    }
}
