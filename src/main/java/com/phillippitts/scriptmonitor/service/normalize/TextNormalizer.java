package com.phillippitts.scriptmonitor.service.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Canonicalizes script and transcript text before alignment:
 * <ol>
 *   <li>Korean numeral words to digits ({@link KoreanNumeralConverter})</li>
 *   <li>Punctuation removal</li>
 *   <li>Whitespace collapse ({@link #normalize}) or removal ({@link #normalizeNoSpace})</li>
 * </ol>
 *
 * <p>Both operations are idempotent and side-effect free. Instances are stateless and thread-safe.
 */
public class TextNormalizer {

    // . , ? ! ; : " ' - … · ( ) [ ] 「 」 『 』 《 》 < >
    private static final Pattern PUNCTUATION = Pattern.compile(
            "[.,?!;:\"'\\-…·()\\[\\]「」『』《》<>]"
    );

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Normalizes text, keeping single spaces between words.
     *
     * @param text raw text (may be null)
     * @return normalized text, "" for null
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = stripPunctuation(KoreanNumeralConverter.convertNumerals(text));
        return WHITESPACE_RUN.matcher(result).replaceAll(" ").strip();
    }

    /**
     * Normalizes text and drops all whitespace. This is the form the character aligners work on.
     *
     * @param text raw text (may be null)
     * @return normalized text without whitespace, "" for null
     */
    public String normalizeNoSpace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = stripPunctuation(KoreanNumeralConverter.convertNumerals(text));
        return WHITESPACE_RUN.matcher(result).replaceAll("");
    }

    /**
     * Splits raw text into whitespace-delimited tokens, without normalizing them.
     *
     * @param text raw text (may be null)
     * @return immutable token list, empty for null or blank input
     */
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String part : WHITESPACE_RUN.split(text)) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return List.copyOf(tokens);
    }

    private static String stripPunctuation(String text) {
        return PUNCTUATION.matcher(text).replaceAll("");
    }
}
