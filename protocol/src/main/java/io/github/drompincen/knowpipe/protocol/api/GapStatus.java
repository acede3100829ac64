package io.github.drompincen.knowpipe.protocol.api;

public enum GapStatus {
    OPEN,
    RESOLVED,
    DISMISSED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
