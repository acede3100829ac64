package io.github.drompincen.knowpipe.runtime.classification;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds the four per-axis signals into one {@link ClassifiedRequest}. Pure: no clock, no I/O.
 *
 * <p>Overall confidence is the normalized weighted mean of the axis confidences. Axes above
 * {@link #HIGH_CONFIDENCE} are boosted, the urgency axis is boosted when urgency is HIGH or URGENT,
 * and a composed value under the low-confidence threshold is penalized. Hinted axes count as
 * certain. A query with no research type evidence composes to confidence 0.
 */
@Component
public class SignalComposer {

    static final double HIGH_CONFIDENCE = 0.8;

    public record Weights(
            double researchType,
            double audience,
            double domain,
            double urgency,
            double urgencyBoost,
            double highConfidenceBoost,
            double lowConfidenceThreshold,
            double lowConfidencePenalty
    ) {
        public static Weights from(PipelineProperties.Classifier c) {
            return new Weights(c.getResearchTypeWeight(), c.getAudienceWeight(), c.getDomainWeight(),
                    c.getUrgencyWeight(), c.getUrgencyBoost(), c.getHighConfidenceBoost(),
                    c.getLowConfidenceThreshold(), c.getLowConfidencePenalty());
        }

        double total() {
            return researchType + audience + domain + urgency;
        }
    }

    private final Weights weights;

    @Autowired
    public SignalComposer(PipelineProperties properties) {
        this(Weights.from(properties.getClassifier()));
    }

    public SignalComposer(Weights weights) {
        if (weights.total() <= 0) {
            throw new IllegalArgumentException("classifier weights must sum to a positive value");
        }
        this.weights = weights;
    }

    public ClassifiedRequest compose(String rawQuery,
                                     Signal<ResearchType> type,
                                     Signal<AudienceLevel> audience,
                                     Signal<String> domain,
                                     Signal<UrgencyLevel> urgency,
                                     ContextHints hints) {
        ContextHints h = hints == null ? ContextHints.none() : hints;
        AudienceLevel audienceLabel = h.audience() != null ? h.audience() : audience.label();
        String domainLabel = h.domain() != null && !h.domain().isBlank() ? h.domain() : domain.label();
        UrgencyLevel urgencyLabel = h.urgency() != null ? h.urgency() : urgency.label();

        Set<String> evidence = new LinkedHashSet<>();
        evidence.addAll(type.evidence());
        evidence.addAll(audience.evidence());
        evidence.addAll(domain.evidence());
        evidence.addAll(urgency.evidence());

        double confidence = 0.0;
        if (type.confidence() > 0.0) {
            double typeAxis = boosted(type.confidence());
            double audienceAxis = h.audience() != null ? 1.0 : boosted(audience.confidence());
            double domainAxis = h.domain() != null ? 1.0 : boosted(domain.confidence());
            double urgencyAxis = h.urgency() != null ? 1.0 : boosted(urgency.confidence());
            if (urgencyLabel.isAtLeast(UrgencyLevel.HIGH)) {
                urgencyAxis *= weights.urgencyBoost();
            }
            confidence = (weights.researchType() * typeAxis
                    + weights.audience() * audienceAxis
                    + weights.domain() * domainAxis
                    + weights.urgency() * urgencyAxis) / weights.total();
            if (confidence < weights.lowConfidenceThreshold()) {
                confidence *= weights.lowConfidencePenalty();
            }
            confidence = Math.max(0.0, Math.min(1.0, confidence));
        }

        return new ClassifiedRequest(rawQuery, type.label(), audienceLabel, domainLabel, urgencyLabel,
                confidence, List.copyOf(evidence));
    }

    private double boosted(double c) {
        return c > HIGH_CONFIDENCE ? c * weights.highConfidenceBoost() : c;
    }
}
