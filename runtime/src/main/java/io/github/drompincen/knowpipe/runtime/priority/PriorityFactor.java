package io.github.drompincen.knowpipe.runtime.priority;

public enum PriorityFactor {
    STALENESS,
    IMPACT,
    PREFERENCE,
    URGENCY,
    GAP_SEVERITY,
    INTERACTIVE
}
