package com.phillippitts.scriptmonitor.service.alignment.impl;

import com.phillippitts.scriptmonitor.service.alignment.CharacterAlignment;
import org.junit.jupiter.api.Test;

import static com.phillippitts.scriptmonitor.domain.CharacterState.DEL;
import static com.phillippitts.scriptmonitor.domain.CharacterState.HIT;
import static com.phillippitts.scriptmonitor.domain.CharacterState.PENDING;
import static com.phillippitts.scriptmonitor.domain.CharacterState.SUB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptimalAlignerTest {

    private final OptimalAligner aligner = new OptimalAligner();

    @Test
    void trailingDeletionsArePending() {
        CharacterAlignment a = aligner.align("abcdef", "abc");

        assertThat(a.states()).containsExactly(HIT, HIT, HIT, PENDING, PENDING, PENDING);
        assertThat(a.lastProcessedIndex()).isEqualTo(2);
    }

    @Test
    void interiorDeletionsStayDeleted() {
        CharacterAlignment a = aligner.align("abcdef", "abdef");

        assertThat(a.states()).containsExactly(HIT, HIT, DEL, HIT, HIT, HIT);
    }

    @Test
    void substitutionsAndInsertions() {
        assertThat(aligner.align("abcd", "abxd").states()).containsExactly(HIT, HIT, SUB, HIT);
        assertThat(aligner.align("abcd", "abxxcd").states()).containsExactly(HIT, HIT, HIT, HIT);
    }

    @Test
    void fallsBackWhenEditTableIsTooLarge() {
        OptimalAligner small = new OptimalAligner(10, new SequentialAligner());

        CharacterAlignment a = small.align("abcdef", "abc");

        assertThat(a.states()).containsExactly(HIT, HIT, HIT, PENDING, PENDING, PENDING);
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new OptimalAligner(0, new SequentialAligner()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OptimalAligner(100, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exposesName() {
        assertThat(aligner.name()).isEqualTo("optimal");
    }
}
