package io.github.drompincen.knowpipe.persistence.document;

import io.github.drompincen.knowpipe.protocol.api.GapStatus;
import io.github.drompincen.knowpipe.protocol.api.GapType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "knowledge_gaps")
@CompoundIndex(name = "location_status_idx", def = "{'location': 1, 'status': 1}")
public class KnowledgeGapDocument {

    @Id
    private String gapId;
    private String location;
    private int line;
    private GapType gapType;
    private GapStatus status = GapStatus.OPEN;
    private Instant detectedAt;
    private Instant lastSeenAt;
    private Instant closedAt;
    private Double semanticScore;
    private String description;
    private int references;
    private String taskId;

    public KnowledgeGapDocument() {}

    public String getGapId() { return gapId; }
    public void setGapId(String gapId) { this.gapId = gapId; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public int getLine() { return line; }
    public void setLine(int line) { this.line = line; }
    public GapType getGapType() { return gapType; }
    public void setGapType(GapType gapType) { this.gapType = gapType; }
    public GapStatus getStatus() { return status; }
    public void setStatus(GapStatus status) { this.status = status; }
    public Instant getDetectedAt() { return detectedAt; }
    public void setDetectedAt(Instant detectedAt) { this.detectedAt = detectedAt; }
    public Instant getLastSeenAt() { return lastSeenAt; }
    public void setLastSeenAt(Instant lastSeenAt) { this.lastSeenAt = lastSeenAt; }
    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }
    public Double getSemanticScore() { return semanticScore; }
    public void setSemanticScore(Double semanticScore) { this.semanticScore = semanticScore; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public int getReferences() { return references; }
    public void setReferences(int references) { this.references = references; }
    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }
}
