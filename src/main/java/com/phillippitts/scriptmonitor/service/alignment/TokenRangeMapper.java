package com.phillippitts.scriptmonitor.service.alignment;

import com.phillippitts.scriptmonitor.domain.TokenSpan;
import com.phillippitts.scriptmonitor.service.normalize.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps whitespace-delimited reference tokens onto offsets in the normalized, whitespace-stripped
 * reference string.
 *
 * <p>Each token is normalized on its own; the spans are laid end to end in token order, so they
 * are contiguous and together cover exactly {@code normalizeNoSpace(reference)}. A token that
 * normalizes to nothing gets a zero-width span.
 */
public class TokenRangeMapper {

    private final TextNormalizer normalizer;

    public TokenRangeMapper(TextNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    /**
     * Computes token spans for a reference script.
     *
     * @param reference raw reference text (may be null)
     * @return one span per whitespace-delimited token, empty for null or blank input
     */
    public List<TokenSpan> map(String reference) {
        List<String> tokens = normalizer.tokenize(reference);
        List<TokenSpan> spans = new ArrayList<>(tokens.size());
        int offset = 0;
        for (String token : tokens) {
            int length = normalizer.normalizeNoSpace(token).length();
            spans.add(new TokenSpan(offset, offset + length, token));
            offset += length;
        }
        return List.copyOf(spans);
    }
}
