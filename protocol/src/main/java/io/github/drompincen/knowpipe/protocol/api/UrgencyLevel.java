package io.github.drompincen.knowpipe.protocol.api;

public enum UrgencyLevel {
    LOW(0.25),
    MEDIUM(0.5),
    HIGH(0.75),
    URGENT(1.0);

    private final double weight;

    UrgencyLevel(double weight) {
        this.weight = weight;
    }

    /** Normalized urgency in [0, 1], used as the urgency priority factor. */
    public double weight() {
        return weight;
    }

    public boolean isAtLeast(UrgencyLevel other) {
        return compareTo(other) >= 0;
    }
}
