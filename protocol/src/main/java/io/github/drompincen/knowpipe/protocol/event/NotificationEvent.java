package io.github.drompincen.knowpipe.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

@JsonPropertyOrder({"taskId", "kind", "timestamp", "payload"})
public record NotificationEvent(
        UUID taskId,
        NotificationKind kind,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> payload,
        Instant timestamp
) {
    public static final String REQUESTED_BY = "requestedBy";
    public static final String DOMAIN = "domain";
    public static final String RESEARCH_TYPE = "researchType";
    public static final String ORIGIN = "origin";
    public static final String QUERY = "query";
    public static final String MESSAGE = "message";
    public static final String PERCENT = "percent";
    public static final String ERROR = "error";
    public static final String CACHE_KEY = "cacheKey";
    public static final String ATTEMPT = "attempt";

    public NotificationEvent {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }
}
