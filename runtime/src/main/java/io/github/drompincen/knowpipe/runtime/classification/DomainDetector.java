package io.github.drompincen.knowpipe.runtime.classification;

import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/** Technology domain from keyword clusters; {@code general} (configurable) when nothing matches. */
@Component
public class DomainDetector implements SignalDetector<String> {

    private final ClassificationRules rules;
    private final double saturation;

    public DomainDetector(ClassificationRules rules, PipelineProperties properties) {
        this.rules = rules;
        this.saturation = properties.getClassifier().getKeywordSaturation();
    }

    @Override
    public ClassificationDimension dimension() {
        return ClassificationDimension.DOMAIN;
    }

    @Override
    public Signal<String> detect(String normalizedQuery) {
        return RuleScorer.best(rules.domainRules(), normalizedQuery, saturation)
                .map(m -> new Signal<>(dimension(), m.rule().label(),
                        RuleScorer.confidence(m.score(), saturation), m.matchedKeywords()))
                .orElseGet(() -> new Signal<>(dimension(), rules.defaultDomain(), 0.3, List.of()));
    }
}
