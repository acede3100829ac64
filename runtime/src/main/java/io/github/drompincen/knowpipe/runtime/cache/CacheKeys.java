package io.github.drompincen.knowpipe.runtime.cache;

import io.github.drompincen.knowpipe.protocol.api.CacheKey;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ContextHints;
import io.github.drompincen.knowpipe.runtime.classification.QueryText;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Set;

/**
 * Pure cache key derivation. The topic hash covers the sorted, de-duplicated, stop-word-free
 * token set of the query, so rephrasings that only reorder words or change casing share a key.
 */
public final class CacheKeys {

    public static final String NO_CONTEXT = "none";

    private CacheKeys() {}

    public static CacheKey derive(ClassifiedRequest request, ContextHints hints) {
        String projectContext = hints == null ? null : hints.projectContext();
        return new CacheKey(
                topicHash(request.rawQuery()),
                request.researchType(),
                request.audience(),
                request.domain(),
                contextHash(projectContext));
    }

    public static String topicHash(String query) {
        return sha256(String.join(" ", QueryText.topicTerms(query)));
    }

    public static String contextHash(String projectContext) {
        if (projectContext == null || projectContext.isBlank()) return NO_CONTEXT;
        Set<String> terms = QueryText.topicTerms(projectContext);
        return sha256(String.join(" ", terms)).substring(0, 16);
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
