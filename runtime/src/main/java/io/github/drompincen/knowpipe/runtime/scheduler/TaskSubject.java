package io.github.drompincen.knowpipe.runtime.scheduler;

import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.TaskOrigin;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.UUID;

/** What a task researches. Subjects with equal fingerprints share one in-flight task. */
public record TaskSubject(
        TaskOrigin origin,
        ClassifiedRequest request,
        CacheKey cacheKey,
        KnowledgeGap gap,
        String requestedBy
) {
    public TaskSubject {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(cacheKey, "cacheKey");
    }

    public static TaskSubject onDemand(ClassifiedRequest request, CacheKey key, String requestedBy) {
        return new TaskSubject(TaskOrigin.ON_DEMAND, request, key, null, requestedBy);
    }

    public static TaskSubject proactive(KnowledgeGap gap, ClassifiedRequest request, CacheKey key, String requestedBy) {
        return new TaskSubject(TaskOrigin.PROACTIVE, request, key, Objects.requireNonNull(gap, "gap"), requestedBy);
    }

    public String fingerprint() {
        return gap != null ? "gap|" + gap.id() : "request|" + cacheKey.id();
    }

    /** Name-based id; {@code generation} distinguishes later tasks for a subject whose earlier task finished. */
    public UUID taskId(int generation) {
        String name = generation == 0 ? fingerprint() : fingerprint() + "|" + generation;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
