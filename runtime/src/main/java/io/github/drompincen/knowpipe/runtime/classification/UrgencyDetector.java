package io.github.drompincen.knowpipe.runtime.classification;

import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/** Temporal and severity language; {@link UrgencyLevel#MEDIUM} when the query is neutral. */
@Component
public class UrgencyDetector implements SignalDetector<UrgencyLevel> {

    private final ClassificationRules rules;
    private final double saturation;

    public UrgencyDetector(ClassificationRules rules, PipelineProperties properties) {
        this.rules = rules;
        this.saturation = properties.getClassifier().getKeywordSaturation();
    }

    @Override
    public ClassificationDimension dimension() {
        return ClassificationDimension.URGENCY;
    }

    @Override
    public Signal<UrgencyLevel> detect(String normalizedQuery) {
        return RuleScorer.best(rules.urgencyRules(), normalizedQuery, saturation)
                .map(m -> new Signal<>(dimension(), m.rule().label(),
                        // one explicit urgency cue is already a strong signal
                        Math.max(0.6, RuleScorer.confidence(m.score(), saturation)), m.matchedKeywords()))
                .orElseGet(() -> new Signal<>(dimension(), UrgencyLevel.MEDIUM, 0.5, List.of()));
    }
}
