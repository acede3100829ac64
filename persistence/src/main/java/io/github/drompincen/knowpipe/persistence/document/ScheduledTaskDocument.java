package io.github.drompincen.knowpipe.persistence.document;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.GapType;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.TaskOrigin;
import io.github.drompincen.knowpipe.protocol.api.TaskState;
import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Document(collection = "scheduled_tasks")
@CompoundIndex(name = "task_pickup_idx", def = "{'state': 1, 'nextAttemptAt': 1}")
public class ScheduledTaskDocument {

    @Id
    private String taskId;
    @Indexed
    private String fingerprint;
    private TaskOrigin origin;
    private TaskState state = TaskState.QUEUED;
    private int attempts;
    private int maxAttempts = 3;
    private Instant enqueuedAt;
    private Instant updatedAt;
    private Instant nextAttemptAt;
    private String cacheKeyId;
    private String contextHash;
    private String lastError;
    private String requestedBy;
    private RequestSnapshot request;
    private GapSnapshot gap;

    public ScheduledTaskDocument() {}

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public TaskOrigin getOrigin() { return origin; }
    public void setOrigin(TaskOrigin origin) { this.origin = origin; }
    public TaskState getState() { return state; }
    public void setState(TaskState state) { this.state = state; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public Instant getEnqueuedAt() { return enqueuedAt; }
    public void setEnqueuedAt(Instant enqueuedAt) { this.enqueuedAt = enqueuedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public void setNextAttemptAt(Instant nextAttemptAt) { this.nextAttemptAt = nextAttemptAt; }
    public String getCacheKeyId() { return cacheKeyId; }
    public void setCacheKeyId(String cacheKeyId) { this.cacheKeyId = cacheKeyId; }
    public String getContextHash() { return contextHash; }
    public void setContextHash(String contextHash) { this.contextHash = contextHash; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public String getRequestedBy() { return requestedBy; }
    public void setRequestedBy(String requestedBy) { this.requestedBy = requestedBy; }
    public RequestSnapshot getRequest() { return request; }
    public void setRequest(RequestSnapshot request) { this.request = request; }
    public GapSnapshot getGap() { return gap; }
    public void setGap(GapSnapshot gap) { this.gap = gap; }

    public static class RequestSnapshot {
        private String rawQuery;
        private ResearchType researchType;
        private AudienceLevel audience;
        private String domain;
        private UrgencyLevel urgency;
        private double confidence;
        private List<String> matchedKeywords = new ArrayList<>();

        public RequestSnapshot() {}

        public String getRawQuery() { return rawQuery; }
        public void setRawQuery(String rawQuery) { this.rawQuery = rawQuery; }
        public ResearchType getResearchType() { return researchType; }
        public void setResearchType(ResearchType researchType) { this.researchType = researchType; }
        public AudienceLevel getAudience() { return audience; }
        public void setAudience(AudienceLevel audience) { this.audience = audience; }
        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }
        public UrgencyLevel getUrgency() { return urgency; }
        public void setUrgency(UrgencyLevel urgency) { this.urgency = urgency; }
        public double getConfidence() { return confidence; }
        public void setConfidence(double confidence) { this.confidence = confidence; }
        public List<String> getMatchedKeywords() { return matchedKeywords; }
        public void setMatchedKeywords(List<String> matchedKeywords) { this.matchedKeywords = matchedKeywords; }
    }

    public static class GapSnapshot {
        private String gapId;
        private String location;
        private int line;
        private GapType gapType;
        private Instant detectedAt;
        private Double semanticScore;
        private String description;
        private String context;
        private int references;

        public GapSnapshot() {}

        public String getGapId() { return gapId; }
        public void setGapId(String gapId) { this.gapId = gapId; }
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public int getLine() { return line; }
        public void setLine(int line) { this.line = line; }
        public GapType getGapType() { return gapType; }
        public void setGapType(GapType gapType) { this.gapType = gapType; }
        public Instant getDetectedAt() { return detectedAt; }
        public void setDetectedAt(Instant detectedAt) { this.detectedAt = detectedAt; }
        public Double getSemanticScore() { return semanticScore; }
        public void setSemanticScore(Double semanticScore) { this.semanticScore = semanticScore; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getContext() { return context; }
        public void setContext(String context) { this.context = context; }
        public int getReferences() { return references; }
        public void setReferences(int references) { this.references = references; }
    }
}
