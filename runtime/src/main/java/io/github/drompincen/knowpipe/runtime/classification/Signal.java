package io.github.drompincen.knowpipe.runtime.classification;

import java.util.List;
import java.util.Objects;

/** One detector's labeled, confidence-scored opinion about a single classification axis. */
public record Signal<L>(
        ClassificationDimension dimension,
        L label,
        double confidence,
        List<String> evidence
) {
    public Signal {
        Objects.requireNonNull(dimension, "dimension");
        Objects.requireNonNull(label, "label");
        if (Double.isNaN(confidence)) confidence = 0.0;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
