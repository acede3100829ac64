package io.github.drompincen.knowpipe.protocol.api;

public enum AudienceLevel {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED
}
