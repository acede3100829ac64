package io.github.drompincen.knowpipe.protocol.api;

public enum ResearchType {
    DECISION,
    IMPLEMENTATION,
    TROUBLESHOOTING,
    LEARNING,
    VALIDATION
}
