package com.phillippitts.scriptmonitor.service.normalize;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts spoken Korean numerals (Sino-Korean and native counting forms) into decimal digits,
 * e.g. {@code 천구백오십이 -> 1952}, {@code 삼십오 -> 35}.
 *
 * <p>Conversion is fail-soft: a run containing any character that is not part of a numeral word
 * is returned untouched, so ordinary words that happen to share syllables with numerals
 * ({@code 나이}, {@code 하세요}) are not mangled. Numerals are assumed to be read in descending
 * magnitude; out-of-order input is not validated.
 *
 * <p>만, 억 and 조 multiply only the segment read since the previous large unit, so
 * {@code 이억삼천만} is 230000000 and not 2 × 10^8 × 3000 × 10^4.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class KoreanNumeralConverter {

    private static final Map<String, Integer> DIGITS = Map.ofEntries(
            Map.entry("영", 0), Map.entry("공", 0), Map.entry("빵", 0),
            Map.entry("일", 1), Map.entry("하나", 1), Map.entry("한", 1),
            Map.entry("이", 2), Map.entry("둘", 2), Map.entry("두", 2),
            Map.entry("삼", 3), Map.entry("셋", 3), Map.entry("세", 3),
            Map.entry("사", 4), Map.entry("넷", 4), Map.entry("네", 4),
            Map.entry("오", 5), Map.entry("다섯", 5),
            Map.entry("육", 6), Map.entry("여섯", 6),
            Map.entry("칠", 7), Map.entry("일곱", 7),
            Map.entry("팔", 8), Map.entry("여덟", 8),
            Map.entry("구", 9), Map.entry("아홉", 9)
    );

    private static final Map<String, Long> UNITS = Map.of(
            "십", 10L,
            "백", 100L,
            "천", 1_000L,
            "만", 10_000L,
            "억", 100_000_000L,
            "조", 1_000_000_000_000L
    );

    /** Units from 만 upward close the running segment. */
    private static final long LARGE_UNIT_THRESHOLD = 10_000L;

    /** Maximal runs of syllables that occur in any numeral word. */
    private static final Pattern NUMERAL_RUN = Pattern.compile("[" + numeralSyllables() + "]+");

    private KoreanNumeralConverter() {
        // Utility class - prevent instantiation
    }

    /**
     * Replaces every numeral run in {@code text} with its decimal form. Runs that do not parse
     * are left as they are.
     *
     * @param text input text (may be null)
     * @return text with numerals converted, or the input itself when null/empty
     */
    public static String convertNumerals(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        Matcher m = NUMERAL_RUN.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(koreanToNumber(m.group())));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Converts a single numeral run to its decimal string.
     *
     * <p>Scans left to right, trying a two-syllable match before a one-syllable match. A digit word
     * sets the pending digit. A small unit (십/백/천) adds {@code pending * unit} to the current
     * segment, with a missing digit read as 1. A large unit (만/억/조) closes the segment into the
     * total as {@code (segment + pending) * unit}.
     *
     * @param run candidate numeral text
     * @return decimal string, or {@code run} unchanged if it contains a non-numeral syllable,
     *         evaluates to zero, or overflows
     */
    public static String koreanToNumber(String run) {
        if (run == null || run.isEmpty()) {
            return run;
        }
        long total = 0;
        long segment = 0;
        long pending = 0;
        boolean hasPending = false;
        int i = 0;
        try {
            while (i < run.length()) {
                String word = null;
                if (i + 2 <= run.length()) {
                    String two = run.substring(i, i + 2);
                    if (DIGITS.containsKey(two) || UNITS.containsKey(two)) {
                        word = two;
                    }
                }
                if (word == null) {
                    String one = run.substring(i, i + 1);
                    if (DIGITS.containsKey(one) || UNITS.containsKey(one)) {
                        word = one;
                    }
                }
                if (word == null) {
                    return run;
                }
                i += word.length();

                Integer digit = DIGITS.get(word);
                if (digit != null) {
                    pending = digit;
                    hasPending = true;
                    continue;
                }

                long unit = UNITS.get(word);
                if (unit < LARGE_UNIT_THRESHOLD) {
                    long multiplier = hasPending ? pending : 1;
                    segment = Math.addExact(segment, Math.multiplyExact(multiplier, unit));
                } else {
                    long base = Math.addExact(segment, hasPending ? pending : 0);
                    if (base == 0) {
                        base = 1;
                    }
                    total = Math.addExact(total, Math.multiplyExact(base, unit));
                    segment = 0;
                }
                pending = 0;
                hasPending = false;
            }
            long value = Math.addExact(Math.addExact(total, segment), pending);
            return value == 0 ? run : Long.toString(value);
        } catch (ArithmeticException overflow) {
            return run;
        }
    }

    private static String numeralSyllables() {
        Set<Character> chars = new LinkedHashSet<>();
        for (String word : DIGITS.keySet()) {
            word.chars().forEach(c -> chars.add((char) c));
        }
        for (String word : UNITS.keySet()) {
            word.chars().forEach(c -> chars.add((char) c));
        }
        StringBuilder sb = new StringBuilder();
        for (char c : chars) {
            sb.append(c);
        }
        return sb.toString();
    }
}
