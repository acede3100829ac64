package io.github.drompincen.knowpipe.protocol.api;

public enum DeliveryStatus {
    /** Accepted into the subscriber mailbox. */
    QUEUED,
    /** Rejected by the subscriber's preferences. */
    FILTERED,
    /** Progress event suppressed by the per-task throttle. */
    THROTTLED,
    /** Evicted from a full mailbox before delivery. */
    DROPPED,
    DELIVERED,
    FAILED
}
