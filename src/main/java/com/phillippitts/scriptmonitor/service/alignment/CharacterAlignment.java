package com.phillippitts.scriptmonitor.service.alignment;

import com.phillippitts.scriptmonitor.domain.CharacterState;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Per-character states for the normalized reference plus the boundary between content the
 * hypothesis has reached and content not yet spoken.
 *
 * @param states             one state per reference character
 * @param lastProcessedIndex highest index whose state is not {@link CharacterState#PENDING}, or -1
 */
public record CharacterAlignment(List<CharacterState> states, int lastProcessedIndex) {

    public CharacterAlignment {
        states = List.copyOf(Objects.requireNonNull(states, "states must not be null"));
        if (lastProcessedIndex < -1 || lastProcessedIndex >= states.size()) {
            throw new IllegalArgumentException("lastProcessedIndex out of range: " + lastProcessedIndex);
        }
    }

    /**
     * Builds an alignment from a state array, deriving the last processed index by scanning from the end.
     */
    public static CharacterAlignment of(CharacterState[] states) {
        int last = -1;
        for (int i = states.length - 1; i >= 0; i--) {
            if (states[i] != CharacterState.PENDING) {
                last = i;
                break;
            }
        }
        return new CharacterAlignment(Arrays.asList(states), last);
    }

    /**
     * Alignment in which nothing has been reached yet.
     */
    public static CharacterAlignment allPending(int length) {
        CharacterState[] states = new CharacterState[length];
        Arrays.fill(states, CharacterState.PENDING);
        return new CharacterAlignment(Arrays.asList(states), -1);
    }

    public int length() {
        return states.size();
    }

    public CharacterState stateAt(int index) {
        return states.get(index);
    }
}
