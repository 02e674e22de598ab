package com.phillippitts.scriptmonitor.presentation.render;

import com.phillippitts.scriptmonitor.domain.AlignType;
import com.phillippitts.scriptmonitor.domain.AlignedToken;
import com.phillippitts.scriptmonitor.domain.PartialMetrics;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders classified tokens for terminals and logs.
 *
 * <p>PENDING tokens are never rendered: only the part of the script the speaker has reached is
 * shown. Inserted tokens are bracketed.
 */
@Component
public class TokenRenderer {

    static final String RESET = "\u001B[0m";
    static final String GREEN = "\u001B[32m";
    static final String RED = "\u001B[31m";
    static final String YELLOW = "\u001B[33m";
    static final String ORANGE = "\u001B[38;5;208m";

    /**
     * Colored rendering: HIT green, SUB red, DEL yellow, INS orange.
     */
    public String renderAnsi(List<AlignedToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (AlignedToken token : tokens) {
            if (token.isPending()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(colorOf(token.alignType())).append(displayText(token)).append(RESET);
        }
        return sb.toString();
    }

    /**
     * Uncolored rendering. Hits appear as-is, errors as {@code <SUB:text>} or {@code <DEL:text>}.
     */
    public String renderPlain(List<AlignedToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (AlignedToken token : tokens) {
            if (token.isPending()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            switch (token.alignType()) {
                case HIT, INS -> sb.append(displayText(token));
                default -> sb.append('<').append(token.alignType()).append(':').append(token.text()).append('>');
            }
        }
        return sb.toString();
    }

    /**
     * e.g. {@code "Current WER: 12.50% | CER: 3.10%"}
     */
    public String formatMetrics(PartialMetrics metrics) {
        return String.format(Locale.ROOT, "Current WER: %.2f%% | CER: %.2f%%",
                metrics.wer() * 100.0, metrics.cer() * 100.0);
    }

    private static String displayText(AlignedToken token) {
        return token.alignType() == AlignType.INS ? "[" + token.text() + "]" : token.text();
    }

    private static String colorOf(AlignType type) {
        return switch (type) {
            case HIT -> GREEN;
            case SUB -> RED;
            case DEL -> YELLOW;
            case INS -> ORANGE;
            case PENDING -> RESET;
        };
    }
}
