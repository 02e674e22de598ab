package com.phillippitts.scriptmonitor.service.alignment;

import com.phillippitts.scriptmonitor.domain.CharacterState;

import java.util.Arrays;

/**
 * Abstract base class for character aligners implementing common degenerate-input handling.
 *
 * <p>This class implements the Template Method pattern: {@link #align(String, String)} resolves
 * empty inputs and delegates to {@link #doAlign(String, String, CharacterState[])} when both
 * strings are non-empty.
 *
 * <p><b>Degenerate Input Strategy:</b>
 * <ul>
 *   <li>Empty reference → empty alignment</li>
 *   <li>Empty hypothesis → every reference character pending</li>
 *   <li>Both non-empty → delegate to subclass</li>
 * </ul>
 *
 * @since 1.0
 */
public abstract class AbstractCharacterAligner implements CharacterAligner {

    @Override
    public final CharacterAlignment align(String reference, String hypothesis) {
        String ref = reference == null ? "" : reference;
        String hyp = hypothesis == null ? "" : hypothesis;
        if (ref.isEmpty() || hyp.isEmpty()) {
            return CharacterAlignment.allPending(ref.length());
        }

        CharacterState[] states = new CharacterState[ref.length()];
        Arrays.fill(states, CharacterState.PENDING);
        doAlign(ref, hyp, states);
        return CharacterAlignment.of(states);
    }

    /**
     * Fills {@code states} for two non-empty strings. Entries left untouched stay pending.
     *
     * @param reference  non-empty reference
     * @param hypothesis non-empty hypothesis
     * @param states     state array pre-filled with {@link CharacterState#PENDING}
     */
    protected abstract void doAlign(String reference, String hypothesis, CharacterState[] states);
}
