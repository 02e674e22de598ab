package com.phillippitts.scriptmonitor.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateReturnsEmptyForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("대본 내용", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("대본 내용", -1)).isEmpty();
    }

    @Test
    void truncateKeepsShortStrings() {
        assertThat(LogSanitizer.truncate("안녕", 10)).isEqualTo("안녕");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void truncateCutsLongStrings() {
        assertThat(LogSanitizer.truncate("오늘 날씨가 매우 좋습니다", 6)).isEqualTo("오늘 날씨가");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).hasSize(100);
    }

    @Test
    void previewFlattensLineBreaks() {
        assertThat(LogSanitizer.preview("첫 줄\n둘째 줄\r\n", 50)).isEqualTo("첫 줄 둘째 줄  ");
    }

    @Test
    void previewAppendsFullLengthWhenTruncated() {
        assertThat(LogSanitizer.preview("오늘 날씨가 매우 좋습니다", 6)).isEqualTo("오늘 날씨가…(14 chars)");
    }

    @Test
    void previewReturnsEmptyForNull() {
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
    }
}
