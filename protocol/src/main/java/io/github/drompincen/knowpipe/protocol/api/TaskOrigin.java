package io.github.drompincen.knowpipe.protocol.api;

public enum TaskOrigin {
    /** User-triggered; never dropped by backpressure. */
    ON_DEMAND,
    /** Gap-sourced background refresh. */
    PROACTIVE
}
