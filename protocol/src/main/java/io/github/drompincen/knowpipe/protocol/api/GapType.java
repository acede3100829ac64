package io.github.drompincen.knowpipe.protocol.api;

public enum GapType {
    MISSING,
    OUTDATED,
    LOW_CONFIDENCE,
    ORPHANED,
    INCONSISTENT
}
