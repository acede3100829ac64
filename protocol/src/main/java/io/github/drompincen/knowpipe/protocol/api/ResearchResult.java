package io.github.drompincen.knowpipe.protocol.api;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ResearchResult(
        String content,
        List<String> sources,
        double qualityScore,
        Map<String, String> metadata,
        Instant producedAt
) {
    public ResearchResult {
        Objects.requireNonNull(content, "content");
        sources = sources == null ? List.of() : List.copyOf(sources);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ResearchResult of(String content, double qualityScore) {
        return new ResearchResult(content, List.of(), qualityScore, Map.of(), Instant.now());
    }
}
