package io.github.drompincen.knowpipe.runtime.support;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.KnowledgeGap;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import io.github.drompincen.knowpipe.runtime.cache.CacheKeys;
import io.github.drompincen.knowpipe.runtime.config.PipelineProperties;
import io.github.drompincen.knowpipe.runtime.scheduler.TaskSubject;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class Requests {

    private Requests() {}

    public static ClassifiedRequest request(String query) {
        return request(query, "java", UrgencyLevel.MEDIUM);
    }

    public static ClassifiedRequest request(String query, String domain, UrgencyLevel urgency) {
        return new ClassifiedRequest(query, ResearchType.IMPLEMENTATION, AudienceLevel.INTERMEDIATE,
                domain, urgency, 0.7, List.of());
    }

    public static CacheKey key(ClassifiedRequest request) {
        return CacheKeys.derive(request, ContextHints.none());
    }

    public static TaskSubject onDemand(String query, String user) {
        ClassifiedRequest r = request(query);
        return TaskSubject.onDemand(r, key(r), user);
    }

    public static TaskSubject onDemand(ClassifiedRequest r, String user) {
        return TaskSubject.onDemand(r, key(r), user);
    }

    public static KnowledgeGap gap(String location, int line, GapType type, String description, Instant at) {
        return new KnowledgeGap(KnowledgeGap.idFor(type, location, line, description), location, line, type,
                at, null, description, "", 0);
    }

    public static TaskSubject proactive(KnowledgeGap gap) {
        ClassifiedRequest r = request(gap.researchQuery());
        return TaskSubject.proactive(gap, r, key(r), "proactive");
    }

    /** Defaults with short timings so tests never wait long. */
    public static PipelineProperties fastProperties() {
        PipelineProperties p = new PipelineProperties();
        p.getNotify().setRetryBackoff(Duration.ofMillis(5));
        p.getNotify().setChannelTimeout(Duration.ofMillis(500));
        p.getNotify().setProgressInterval(Duration.ofSeconds(1));
        p.getScheduler().setExecutorTimeout(Duration.ofSeconds(5));
        p.getCache().setPersistent(false);
        return p;
    }
}
