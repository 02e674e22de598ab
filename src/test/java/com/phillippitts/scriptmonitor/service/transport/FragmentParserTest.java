package com.phillippitts.scriptmonitor.service.transport;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FragmentParserTest {

    @Test
    void extractsTrimmedText() {
        assertThat(FragmentParser.parse("{\"text\": \"  오늘 날씨가 \", \"final\": true}")).contains("오늘 날씨가");
    }

    @Test
    void blankOrMissingTextYieldsNothing() {
        assertThat(FragmentParser.parse("{\"text\": \"   \"}")).isEmpty();
        assertThat(FragmentParser.parse("{\"partial\": \"x\"}")).isEmpty();
        assertThat(FragmentParser.parse("")).isEmpty();
        assertThat(FragmentParser.parse(null)).isEmpty();
    }

    @Test
    void invalidJsonYieldsNothing() {
        assertThat(FragmentParser.parse("not json")).isEmpty();
        assertThat(FragmentParser.parse("{\"text\": ")).isEmpty();
        assertThat(FragmentParser.parse("[\"text\"]")).isEmpty();
    }
}
