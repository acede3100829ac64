package io.github.drompincen.knowpipe.protocol.api;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Multi-dimensional cache key. Each dimension is indexed by the cache so slices
 * (for example every entry for one domain) can be found without a full scan.
 */
public record CacheKey(
        String topicHash,
        ResearchType researchType,
        AudienceLevel audience,
        String domain,
        String contextHash
) {
    public CacheKey {
        Objects.requireNonNull(topicHash, "topicHash");
        Objects.requireNonNull(researchType, "researchType");
        Objects.requireNonNull(audience, "audience");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(contextHash, "contextHash");
    }

    /** Stable identifier: SHA-256 over the canonical form of all five dimensions. */
    public String id() {
        String canonical = String.join("|",
                "v1", topicHash, researchType.name(), audience.name(), domain, contextHash);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
