package com.phillippitts.scriptmonitor.service.alignment.impl;

import com.phillippitts.scriptmonitor.domain.CharacterState;
import com.phillippitts.scriptmonitor.service.alignment.AbstractCharacterAligner;

/**
 * Online, single-pass character aligner with a bounded resynchronization window.
 *
 * <p>Two cursors walk the reference and the hypothesis. On a mismatch the aligner first looks up
 * to {@code maxLookahead} characters ahead in the reference (skipped reference characters become
 * {@link CharacterState#DEL}), then up to {@code maxLookahead} characters ahead in the hypothesis
 * (skipped hypothesis characters are discarded as noise), and otherwise records a
 * {@link CharacterState#SUB}. Whatever remains of the reference when the hypothesis runs out stays
 * {@link CharacterState#PENDING}.
 *
 * <p>Unlike a global edit-distance alignment, a short hypothesis can never be matched against a
 * later repetition of the same phrase in the script, so the processed boundary tracks where the
 * speaker actually is. Cost is O(reference length × lookahead).
 */
public final class SequentialAligner extends AbstractCharacterAligner {

    public static final int DEFAULT_MAX_LOOKAHEAD = 3;

    private final int maxLookahead;

    public SequentialAligner() {
        this(DEFAULT_MAX_LOOKAHEAD);
    }

    /**
     * @param maxLookahead resynchronization window, at least 1
     * @throws IllegalArgumentException if maxLookahead is below 1
     */
    public SequentialAligner(int maxLookahead) {
        if (maxLookahead < 1) {
            throw new IllegalArgumentException("maxLookahead must be >= 1");
        }
        this.maxLookahead = maxLookahead;
    }

    @Override
    protected void doAlign(String ref, String hyp, CharacterState[] states) {
        int refIdx = 0;
        int hypIdx = 0;

        while (refIdx < ref.length() && hypIdx < hyp.length()) {
            char r = ref.charAt(refIdx);
            char h = hyp.charAt(hypIdx);

            if (r == h) {
                states[refIdx] = CharacterState.HIT;
                refIdx++;
                hypIdx++;
                continue;
            }

            int refSkip = findInReference(ref, refIdx, h);
            if (refSkip > 0) {
                for (int i = refIdx; i < refIdx + refSkip; i++) {
                    states[i] = CharacterState.DEL;
                }
                refIdx += refSkip;
                continue;
            }

            int hypSkip = findInHypothesis(hyp, hypIdx, r);
            if (hypSkip > 0) {
                hypIdx += hypSkip;
                continue;
            }

            states[refIdx] = CharacterState.SUB;
            refIdx++;
            hypIdx++;
        }
    }

    public int getMaxLookahead() {
        return maxLookahead;
    }

    @Override
    public String name() {
        return "sequential";
    }

    /** Distance to the first reference character after refIdx equal to target, or 0. */
    private int findInReference(String ref, int refIdx, char target) {
        for (int look = 1; look <= maxLookahead; look++) {
            int idx = refIdx + look;
            if (idx >= ref.length()) {
                break;
            }
            if (ref.charAt(idx) == target) {
                return look;
            }
        }
        return 0;
    }

    /** Distance to the first hypothesis character after hypIdx equal to target, or 0. */
    private int findInHypothesis(String hyp, int hypIdx, char target) {
        for (int look = 1; look <= maxLookahead; look++) {
            int idx = hypIdx + look;
            if (idx >= hyp.length()) {
                break;
            }
            if (hyp.charAt(idx) == target) {
                return look;
            }
        }
        return 0;
    }
}
