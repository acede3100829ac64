package io.github.drompincen.knowpipe.runtime.classification;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Audience level from beginner/advanced phrasing plus vocabulary complexity (long-word ratio and
 * jargon density). Without a clear cue the audience is {@link AudienceLevel#INTERMEDIATE}.
 */
@Component
public class AudienceDetector implements SignalDetector<AudienceLevel> {

    private static final int LONG_WORD = 10;
    private static final double LONG_WORD_RATIO = 0.3;
    private static final double COMPLEXITY_BONUS = 0.5;
    private static final double JARGON_WEIGHT = 0.4;
    private static final double NEUTRAL_CONFIDENCE = 0.5;

    private final ClassificationRules rules;
    private final double saturation;

    public AudienceDetector(ClassificationRules rules, PipelineProperties properties) {
        this.rules = rules;
        this.saturation = properties.getClassifier().getKeywordSaturation();
    }

    @Override
    public ClassificationDimension dimension() {
        return ClassificationDimension.AUDIENCE;
    }

    @Override
    public Signal<AudienceLevel> detect(String normalizedQuery) {
        double beginner = 0.0;
        double advanced = 0.0;
        List<String> evidence = new ArrayList<>();
        for (KeywordRule<AudienceLevel> rule : rules.audienceRules()) {
            KeywordRule.Match<AudienceLevel> m = rule.match(normalizedQuery);
            if (!m.matched()) continue;
            if (rule.label() == AudienceLevel.BEGINNER) beginner += m.score();
            if (rule.label() == AudienceLevel.ADVANCED) advanced += m.score();
            evidence.addAll(m.matchedKeywords());
        }

        List<String> tokens = QueryText.tokens(normalizedQuery);
        if (QueryText.longWordRatio(tokens, LONG_WORD) > LONG_WORD_RATIO) {
            advanced += COMPLEXITY_BONUS;
            evidence.add("complexity:long-words");
        }
        for (String term : rules.jargon()) {
            if (QueryText.containsKeyword(normalizedQuery, term)) {
                advanced += JARGON_WEIGHT;
                evidence.add("jargon:" + term);
            }
        }

        if (beginner == 0.0 && advanced < 1.0) {
            return new Signal<>(dimension(), AudienceLevel.INTERMEDIATE, NEUTRAL_CONFIDENCE, evidence);
        }
        if (beginner >= advanced) {
            return new Signal<>(dimension(), AudienceLevel.BEGINNER,
                    RuleScorer.confidence(beginner - advanced / 2, saturation), evidence);
        }
        return new Signal<>(dimension(), AudienceLevel.ADVANCED,
                RuleScorer.confidence(advanced - beginner / 2, saturation), evidence);
    }
}
