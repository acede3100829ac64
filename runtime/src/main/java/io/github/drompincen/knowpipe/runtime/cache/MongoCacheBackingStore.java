package io.github.drompincen.knowpipe.runtime.cache;

import io.github.drompincen.knowpipe.persistence.document.CacheEntryDocument;
import io.github.drompincen.knowpipe.persistence.repository.CacheEntryRepository;
import io.github.drompincen.knowpipe.protocol.api.CacheEntry;
import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ResearchResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/** Write-through mirror of the cache in the {@code research_cache} collection. */
@Component
@ConditionalOnProperty(name = "knowpipe.cache.persistent", havingValue = "true", matchIfMissing = true)
public class MongoCacheBackingStore implements CacheBackingStore {

    private final CacheEntryRepository repository;

    public MongoCacheBackingStore(CacheEntryRepository repository) {
        this.repository = repository;
    }

    @Override
    public void save(CacheEntry entry, String checksum) {
        repository.save(toDocument(entry, checksum));
    }

    @Override
    public void delete(String keyId) {
        repository.deleteById(keyId);
    }

    @Override
    public List<StoredEntry> loadLive(Instant now) {
        List<StoredEntry> out = new ArrayList<>();
        for (CacheEntryDocument doc : repository.findByExpiresAtGreaterThan(now)) {
            out.add(new StoredEntry(fromDocument(doc), doc.getChecksum()));
        }
        return out;
    }

    @Override
    public long deleteExpired(Instant now) {
        return repository.deleteByExpiresAtLessThanEqual(now);
    }

    static CacheEntryDocument toDocument(CacheEntry entry, String checksum) {
        CacheEntryDocument doc = new CacheEntryDocument();
        CacheKey key = entry.key();
        doc.setKeyId(key.id());
        doc.setTopicHash(key.topicHash());
        doc.setResearchType(key.researchType());
        doc.setAudience(key.audience());
        doc.setDomain(key.domain());
        doc.setContextHash(key.contextHash());
        doc.setQuery(entry.query());
        doc.setContent(entry.result().content());
        doc.setSources(new ArrayList<>(entry.result().sources()));
        doc.setMetadata(new HashMap<>(entry.result().metadata()));
        doc.setQualityScore(entry.qualityScore());
        doc.setProducedAt(entry.result().producedAt());
        doc.setCreatedAt(entry.createdAt());
        doc.setTtlSeconds(entry.ttl().getSeconds());
        doc.setExpiresAt(entry.expiresAt());
        doc.setHitCount(entry.hitCount());
        doc.setChecksum(checksum);
        doc.setSizeBytes(entry.sizeBytes());
        return doc;
    }

    static CacheEntry fromDocument(CacheEntryDocument doc) {
        CacheKey key = new CacheKey(doc.getTopicHash(), doc.getResearchType(), doc.getAudience(),
                doc.getDomain(), doc.getContextHash());
        ResearchResult result = new ResearchResult(doc.getContent() == null ? "" : doc.getContent(),
                doc.getSources(), doc.getQualityScore(), doc.getMetadata(), doc.getProducedAt());
        return new CacheEntry(key, doc.getQuery(), result, doc.getCreatedAt(),
                Duration.ofSeconds(doc.getTtlSeconds()), doc.getHitCount(), doc.getQualityScore(),
                doc.getSizeBytes());
    }
}
