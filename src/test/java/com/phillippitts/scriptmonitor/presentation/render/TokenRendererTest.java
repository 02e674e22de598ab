package com.phillippitts.scriptmonitor.presentation.render;

import com.phillippitts.scriptmonitor.domain.AlignType;
import com.phillippitts.scriptmonitor.domain.AlignedToken;
import com.phillippitts.scriptmonitor.domain.PartialMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenRendererTest {

    private final TokenRenderer renderer = new TokenRenderer();

    private static final List<AlignedToken> TOKENS = List.of(
            new AlignedToken("오늘", AlignType.HIT),
            new AlignedToken("날씨가", AlignType.SUB),
            new AlignedToken("매우", AlignType.DEL),
            new AlignedToken("음", AlignType.INS),
            new AlignedToken("좋습니다", AlignType.PENDING));

    @Test
    void plainRenderingMarksErrorsAndHidesPending() {
        assertThat(renderer.renderPlain(TOKENS)).isEqualTo("오늘 <SUB:날씨가> <DEL:매우> [음]");
    }

    @Test
    void ansiRenderingColorsEachVerdict() {
        String out = renderer.renderAnsi(TOKENS);

        assertThat(out).isEqualTo(TokenRenderer.GREEN + "오늘" + TokenRenderer.RESET + " "
                + TokenRenderer.RED + "날씨가" + TokenRenderer.RESET + " "
                + TokenRenderer.YELLOW + "매우" + TokenRenderer.RESET + " "
                + TokenRenderer.ORANGE + "[음]" + TokenRenderer.RESET);
        assertThat(out).doesNotContain("좋습니다");
    }

    @Test
    void allPendingRendersNothing() {
        List<AlignedToken> pending = List.of(new AlignedToken("안녕하세요", AlignType.PENDING));

        assertThat(renderer.renderPlain(pending)).isEmpty();
        assertThat(renderer.renderAnsi(pending)).isEmpty();
    }

    @Test
    void formatsMetricsAsPercentages() {
        PartialMetrics metrics = new PartialMetrics(0.125, 0.031, 7, 1, 0, 0, 8);

        assertThat(renderer.formatMetrics(metrics)).isEqualTo("Current WER: 12.50% | CER: 3.10%");
    }
}
