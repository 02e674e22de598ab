package com.phillippitts.scriptmonitor.config.alignment;

import com.phillippitts.scriptmonitor.config.properties.AlignmentProperties;
import com.phillippitts.scriptmonitor.service.alignment.CharacterAligner;
import com.phillippitts.scriptmonitor.service.alignment.MetricsCalculator;
import com.phillippitts.scriptmonitor.service.alignment.ScriptAlignmentEngine;
import com.phillippitts.scriptmonitor.service.alignment.TokenClassifier;
import com.phillippitts.scriptmonitor.service.alignment.TokenRangeMapper;
import com.phillippitts.scriptmonitor.service.alignment.impl.OptimalAligner;
import com.phillippitts.scriptmonitor.service.alignment.impl.SequentialAligner;
import com.phillippitts.scriptmonitor.service.normalize.TextNormalizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the scoring engine. The engine classes carry no Spring annotations so they stay plain,
 * directly constructible objects in tests.
 */
@Configuration
public class AlignmentConfig {

    @Bean
    public TextNormalizer textNormalizer() {
        return new TextNormalizer();
    }

    @Bean
    public CharacterAligner characterAligner(AlignmentProperties props) {
        SequentialAligner sequential = new SequentialAligner(props.getMaxLookahead());
        return switch (props.getStrategy()) {
            case SEQUENTIAL -> sequential;
            case OPTIMAL -> new OptimalAligner(OptimalAligner.DEFAULT_MAX_CELLS, sequential);
        };
    }

    @Bean
    public ScriptAlignmentEngine scriptAlignmentEngine(TextNormalizer normalizer, CharacterAligner aligner) {
        return new ScriptAlignmentEngine(
                normalizer,
                aligner,
                new TokenRangeMapper(normalizer),
                new TokenClassifier(),
                new MetricsCalculator()
        );
    }
}
