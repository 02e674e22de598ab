package com.phillippitts.scriptmonitor.service.alignment.impl;

import com.phillippitts.scriptmonitor.domain.CharacterState;
import com.phillippitts.scriptmonitor.service.alignment.AbstractCharacterAligner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Minimum-edit-distance character aligner.
 *
 * <p>Computes a full Levenshtein table, walks the backtrace into equal / substitute / delete /
 * insert operations, and maps them onto reference characters. Every deletion that comes after the
 * last non-deletion operation is reported {@link CharacterState#PENDING} rather than
 * {@link CharacterState#DEL}: it is script the hypothesis has not reached yet.
 *
 * <p>Because the alignment is global, a short hypothesis that repeats a phrase occurring twice in
 * the script may be matched against the later occurrence. {@link SequentialAligner} does not have
 * this weakness and is the default strategy.
 *
 * <p>Memory is O(reference × hypothesis). Inputs whose table would exceed {@code maxCells} are
 * aligned with the fallback aligner instead.
 */
public final class OptimalAligner extends AbstractCharacterAligner {

    private static final Logger LOG = LogManager.getLogger(OptimalAligner.class);

    public static final long DEFAULT_MAX_CELLS = 16_000_000L;

    private enum Op { EQUAL, SUBSTITUTE, DELETE, INSERT }

    private final long maxCells;
    private final AbstractCharacterAligner fallback;

    public OptimalAligner() {
        this(DEFAULT_MAX_CELLS, new SequentialAligner());
    }

    /**
     * @param maxCells largest edit table (rows × columns) computed before falling back
     * @param fallback aligner used for inputs over the limit
     * @throws IllegalArgumentException if maxCells is not positive or fallback is null
     */
    public OptimalAligner(long maxCells, AbstractCharacterAligner fallback) {
        if (maxCells <= 0) {
            throw new IllegalArgumentException("maxCells must be positive");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback must not be null");
        }
        this.maxCells = maxCells;
        this.fallback = fallback;
    }

    @Override
    protected void doAlign(String ref, String hyp, CharacterState[] states) {
        long cells = (long) (ref.length() + 1) * (hyp.length() + 1);
        if (cells > maxCells) {
            LOG.warn("Edit table too large ({} cells > {}); using {} aligner", cells, maxCells, fallback.name());
            List<CharacterState> fallbackStates = fallback.align(ref, hyp).states();
            for (int i = 0; i < states.length; i++) {
                states[i] = fallbackStates.get(i);
            }
            return;
        }

        List<Op> ops = backtrace(ref, hyp, distanceTable(ref, hyp));

        int lastNonDelete = -1;
        for (int k = ops.size() - 1; k >= 0; k--) {
            if (ops.get(k) != Op.DELETE) {
                lastNonDelete = k;
                break;
            }
        }

        int refIdx = 0;
        for (int k = 0; k < ops.size(); k++) {
            switch (ops.get(k)) {
                case EQUAL -> states[refIdx++] = CharacterState.HIT;
                case SUBSTITUTE -> states[refIdx++] = CharacterState.SUB;
                case DELETE -> states[refIdx++] = k > lastNonDelete ? CharacterState.PENDING : CharacterState.DEL;
                case INSERT -> {
                    // hypothesis-only character, nothing recorded against the reference
                }
            }
        }
    }

    @Override
    public String name() {
        return "optimal";
    }

    private static int[][] distanceTable(String ref, String hyp) {
        int n = ref.length();
        int m = hyp.length();
        int[][] d = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) {
            d[i][0] = i;
        }
        for (int j = 0; j <= m; j++) {
            d[0][j] = j;
        }
        for (int i = 1; i <= n; i++) {
            char r = ref.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = r == hyp.charAt(j - 1) ? 0 : 1;
                d[i][j] = Math.min(Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1), d[i - 1][j - 1] + cost);
            }
        }
        return d;
    }

    /** Operations in script order. Ties prefer a match, then a deletion, then an insertion. */
    private static List<Op> backtrace(String ref, String hyp, int[][] d) {
        List<Op> ops = new ArrayList<>(ref.length() + hyp.length());
        int i = ref.length();
        int j = hyp.length();
        while (i > 0 || j > 0) {
            if (i > 0 && j > 0 && ref.charAt(i - 1) == hyp.charAt(j - 1) && d[i][j] == d[i - 1][j - 1]) {
                ops.add(Op.EQUAL);
                i--;
                j--;
            } else if (i > 0 && d[i][j] == d[i - 1][j] + 1) {
                ops.add(Op.DELETE);
                i--;
            } else if (j > 0 && d[i][j] == d[i][j - 1] + 1) {
                ops.add(Op.INSERT);
                j--;
            } else {
                ops.add(Op.SUBSTITUTE);
                i--;
                j--;
            }
        }
        Collections.reverse(ops);
        return ops;
    }
}
