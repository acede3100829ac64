package io.github.drompincen.knowpipe.persistence.document;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Document(collection = "research_cache")
@CompoundIndex(name = "type_audience_domain_idx", def = "{'researchType': 1, 'audience': 1, 'domain': 1}")
public class CacheEntryDocument {

    @Id
    private String keyId;
    @Indexed
    private String topicHash;
    private ResearchType researchType;
    private AudienceLevel audience;
    @Indexed
    private String domain;
    private String contextHash;
    private String query;
    private String content;
    private List<String> sources = new ArrayList<>();
    private Map<String, String> metadata = new HashMap<>();
    private double qualityScore;
    private Instant producedAt;
    private Instant createdAt;
    private long ttlSeconds;
    @Indexed
    private Instant expiresAt;
    private long hitCount;
    private String checksum;
    private long sizeBytes;

    public CacheEntryDocument() {}

    public String getKeyId() { return keyId; }
    public void setKeyId(String keyId) { this.keyId = keyId; }
    public String getTopicHash() { return topicHash; }
    public void setTopicHash(String topicHash) { this.topicHash = topicHash; }
    public ResearchType getResearchType() { return researchType; }
    public void setResearchType(ResearchType researchType) { this.researchType = researchType; }
    public AudienceLevel getAudience() { return audience; }
    public void setAudience(AudienceLevel audience) { this.audience = audience; }
    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }
    public String getContextHash() { return contextHash; }
    public void setContextHash(String contextHash) { this.contextHash = contextHash; }
    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }
    public List<String> getSources() { return sources; }
    public void setSources(List<String> sources) { this.sources = sources; }
    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
    public double getQualityScore() { return qualityScore; }
    public void setQualityScore(double qualityScore) { this.qualityScore = qualityScore; }
    public Instant getProducedAt() { return producedAt; }
    public void setProducedAt(Instant producedAt) { this.producedAt = producedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public long getTtlSeconds() { return ttlSeconds; }
    public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public long getHitCount() { return hitCount; }
    public void setHitCount(long hitCount) { this.hitCount = hitCount; }
    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }
    public long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(long sizeBytes) { this.sizeBytes = sizeBytes; }
}
