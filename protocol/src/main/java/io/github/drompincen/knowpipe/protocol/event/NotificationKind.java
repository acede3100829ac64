package io.github.drompincen.knowpipe.protocol.event;

public enum NotificationKind {
    STARTED,
    PROGRESS,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
