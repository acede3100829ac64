package io.github.drompincen.knowpipe.protocol.api;

public enum ChannelType {
    CLI,
    FILE,
    WEBHOOK
}
