package io.github.drompincen.knowpipe.runtime.priority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/** Per-dispatch-cycle score of one task. Never persisted. */
public record PriorityScore(UUID subjectId, double score, Map<PriorityFactor, Double> factors) {

    public PriorityScore {
        factors = factors == null || factors.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(factors));
    }

    public double factor(PriorityFactor factor) {
        return factors.getOrDefault(factor, 0.0);
    }
}
