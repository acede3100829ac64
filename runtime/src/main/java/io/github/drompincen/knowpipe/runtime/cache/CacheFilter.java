package io.github.drompincen.knowpipe.runtime.cache;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.CacheEntry;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;

import java.util.Locale;

/**
 * Conjunctive slice over cache entries. Null fields match everything.
 */
public record CacheFilter(
        ResearchType researchType,
        AudienceLevel audience,
        String domain,
        String topicHash,
        String contextHash,
        Double minQuality,
        String queryContains
) {
    public static CacheFilter any() {
        return new CacheFilter(null, null, null, null, null, null, null);
    }

    public static CacheFilter domain(String domain) {
        return any().withDomain(domain);
    }

    public static CacheFilter researchType(ResearchType type) {
        return any().withResearchType(type);
    }

    public CacheFilter withResearchType(ResearchType type) {
        return new CacheFilter(type, audience, domain, topicHash, contextHash, minQuality, queryContains);
    }

    public CacheFilter withAudience(AudienceLevel level) {
        return new CacheFilter(researchType, level, domain, topicHash, contextHash, minQuality, queryContains);
    }

    public CacheFilter withDomain(String value) {
        return new CacheFilter(researchType, audience, value, topicHash, contextHash, minQuality, queryContains);
    }

    public CacheFilter withTopicHash(String value) {
        return new CacheFilter(researchType, audience, domain, value, contextHash, minQuality, queryContains);
    }

    public CacheFilter withContextHash(String value) {
        return new CacheFilter(researchType, audience, domain, topicHash, value, minQuality, queryContains);
    }

    public CacheFilter withMinQuality(double value) {
        return new CacheFilter(researchType, audience, domain, topicHash, contextHash, value, queryContains);
    }

    public CacheFilter withQueryContaining(String value) {
        return new CacheFilter(researchType, audience, domain, topicHash, contextHash, minQuality, value);
    }

    public boolean matches(CacheEntry entry) {
        if (researchType != null && entry.key().researchType() != researchType) return false;
        if (audience != null && entry.key().audience() != audience) return false;
        if (domain != null && !domain.equals(entry.key().domain())) return false;
        if (topicHash != null && !topicHash.equals(entry.key().topicHash())) return false;
        if (contextHash != null && !contextHash.equals(entry.key().contextHash())) return false;
        if (minQuality != null && entry.qualityScore() < minQuality) return false;
        if (queryContains != null) {
            String query = entry.query() == null ? "" : entry.query().toLowerCase(Locale.ROOT);
            return query.contains(queryContains.toLowerCase(Locale.ROOT));
        }
        return true;
    }
}
