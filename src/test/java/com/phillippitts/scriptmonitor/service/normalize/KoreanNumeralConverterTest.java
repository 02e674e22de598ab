package com.phillippitts.scriptmonitor.service.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KoreanNumeralConverterTest {

    @Test
    void convertsSinoKoreanYears() {
        assertThat(KoreanNumeralConverter.koreanToNumber("천구백오십이")).isEqualTo("1952");
        assertThat(KoreanNumeralConverter.koreanToNumber("이천이십오")).isEqualTo("2025");
    }

    @Test
    void convertsTensAndUnits() {
        assertThat(KoreanNumeralConverter.koreanToNumber("삼십오")).isEqualTo("35");
        assertThat(KoreanNumeralConverter.koreanToNumber("십")).isEqualTo("10");
        assertThat(KoreanNumeralConverter.koreanToNumber("백이")).isEqualTo("102");
    }

    @Test
    void unitWithoutDigitCountsAsOne() {
        assertThat(KoreanNumeralConverter.koreanToNumber("천")).isEqualTo("1000");
        assertThat(KoreanNumeralConverter.koreanToNumber("만")).isEqualTo("10000");
    }

    @Test
    void largeUnitsCloseTheSegment() {
        assertThat(KoreanNumeralConverter.koreanToNumber("삼만오천")).isEqualTo("35000");
        assertThat(KoreanNumeralConverter.koreanToNumber("이억삼천만")).isEqualTo("230000000");
    }

    @Test
    void eachLargeUnitMultipliesOnlyItsOwnSegment() {
        assertThat(KoreanNumeralConverter.koreanToNumber("일조이억삼천만")).isEqualTo("1000230000000");
        assertThat(KoreanNumeralConverter.koreanToNumber("만오천")).isEqualTo("15000");
    }

    @Test
    void prefersTwoSyllableDigitWords() {
        assertThat(KoreanNumeralConverter.koreanToNumber("다섯")).isEqualTo("5");
        assertThat(KoreanNumeralConverter.koreanToNumber("여덟")).isEqualTo("8");
        assertThat(KoreanNumeralConverter.koreanToNumber("하나")).isEqualTo("1");
    }

    @Test
    void returnsRunUnchangedWhenAnySyllableIsNotNumeral() {
        assertThat(KoreanNumeralConverter.koreanToNumber("나이")).isEqualTo("나이");
        assertThat(KoreanNumeralConverter.koreanToNumber("하세")).isEqualTo("하세");
    }

    @Test
    void returnsRunUnchangedWhenValueIsZero() {
        assertThat(KoreanNumeralConverter.koreanToNumber("영")).isEqualTo("영");
        assertThat(KoreanNumeralConverter.koreanToNumber("공공")).isEqualTo("공공");
    }

    @Test
    void returnsRunUnchangedOnOverflow() {
        String huge = "구천".repeat(1100) + "조";
        assertThat(KoreanNumeralConverter.koreanToNumber(huge)).isEqualTo(huge);
    }

    @Test
    void convertsRunsInsideSentences() {
        assertThat(KoreanNumeralConverter.convertNumerals("나이가 삼십오살입니다"))
                .isEqualTo("나이가 35살입니다");
        assertThat(KoreanNumeralConverter.convertNumerals("천구백오십이년에"))
                .isEqualTo("1952년에");
    }

    @Test
    void leavesOrdinaryWordsAlone() {
        assertThat(KoreanNumeralConverter.convertNumerals("안녕하세요")).isEqualTo("안녕하세요");
        assertThat(KoreanNumeralConverter.convertNumerals("hello world")).isEqualTo("hello world");
    }

    @Test
    void handlesNullAndEmpty() {
        assertThat(KoreanNumeralConverter.convertNumerals(null)).isNull();
        assertThat(KoreanNumeralConverter.convertNumerals("")).isEmpty();
        assertThat(KoreanNumeralConverter.koreanToNumber("")).isEmpty();
    }
}
