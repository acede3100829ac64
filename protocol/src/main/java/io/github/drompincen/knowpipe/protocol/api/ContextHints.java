package io.github.drompincen.knowpipe.protocol.api;

/**
 * Optional caller-supplied context. Any non-null axis overrides the detected label;
 * {@code projectContext} only feeds the cache key context hash.
 */
public record ContextHints(
        AudienceLevel audience,
        String domain,
        UrgencyLevel urgency,
        String projectContext
) {
    public static ContextHints none() {
        return new ContextHints(null, null, null, null);
    }

    public static ContextHints forProject(String projectContext) {
        return new ContextHints(null, null, null, projectContext);
    }

    public boolean isEmpty() {
        return audience == null && domain == null && urgency == null && projectContext == null;
    }
}
