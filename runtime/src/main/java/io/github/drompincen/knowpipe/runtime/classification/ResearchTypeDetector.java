package io.github.drompincen.knowpipe.runtime.classification;

import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Keyword-rule research type detection. Also serves as the basic classifier: no match yields
 * {@link ResearchType#IMPLEMENTATION} with confidence 0.
 */
@Component
public class ResearchTypeDetector implements SignalDetector<ResearchType> {

    private final List<KeywordRule<ResearchType>> rules;
    private final double saturation;

    @Autowired
    public ResearchTypeDetector(ClassificationRules rules, PipelineProperties properties) {
        this(rules.researchTypeRules(), properties.getClassifier().getKeywordSaturation());
    }

    ResearchTypeDetector(List<KeywordRule<ResearchType>> rules, double saturation) {
        this.rules = rules;
        this.saturation = saturation;
    }

    @Override
    public ClassificationDimension dimension() {
        return ClassificationDimension.RESEARCH_TYPE;
    }

    @Override
    public Signal<ResearchType> detect(String normalizedQuery) {
        return RuleScorer.best(rules, normalizedQuery, saturation)
                .map(m -> new Signal<>(dimension(), m.rule().label(),
                        RuleScorer.confidence(m.score(), saturation), m.matchedKeywords()))
                .orElseGet(() -> new Signal<>(dimension(), ResearchType.IMPLEMENTATION, 0.0, List.of()));
    }
}
