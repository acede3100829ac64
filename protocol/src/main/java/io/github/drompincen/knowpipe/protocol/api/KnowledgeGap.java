package io.github.drompincen.knowpipe.protocol.api;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record KnowledgeGap(
        UUID id,
        String location,
        int line,
        GapType gapType,
        Instant detectedAt,
        Double semanticScore,
        String description,
        String context,
        int references
) {
    public KnowledgeGap {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(gapType, "gapType");
        Objects.requireNonNull(detectedAt, "detectedAt");
        description = description == null ? "" : description;
        context = context == null ? "" : context;
    }

    /** Name-based id: a rescan of unchanged content yields the same gap id. */
    public static UUID idFor(GapType type, String location, int line, String description) {
        String name = type.name() + "|" + location + "|" + line + "|" + description;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    public KnowledgeGap withSemanticScore(double score) {
        return new KnowledgeGap(id, location, line, gapType, detectedAt, score, description, context, references);
    }

    public KnowledgeGap reclassified(GapType type, double score) {
        return new KnowledgeGap(id, location, line, type, detectedAt, score, description, context, references);
    }

    public KnowledgeGap withReferences(int count) {
        return new KnowledgeGap(id, location, line, gapType, detectedAt, semanticScore, description, context, count);
    }

    /** Research question handed to the classifier when the gap is scheduled. */
    public String researchQuery() {
        return switch (gapType) {
            case MISSING -> "Document " + description + " in " + location;
            case OUTDATED -> "Update outdated documentation " + location + ": " + description;
            case LOW_CONFIDENCE -> "Verify and extend existing knowledge for " + location + ": " + description;
            case ORPHANED -> "Fix orphaned documentation reference in " + location + ": " + description;
            case INCONSISTENT -> "Explain and resolve " + description + " in " + location;
        };
    }
}
