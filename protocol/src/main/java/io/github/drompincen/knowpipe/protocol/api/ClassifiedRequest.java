package io.github.drompincen.knowpipe.protocol.api;

import java.util.List;
import java.util.Objects;

public record ClassifiedRequest(
        String rawQuery,
        ResearchType researchType,
        AudienceLevel audience,
        String domain,
        UrgencyLevel urgency,
        double confidence,
        List<String> matchedKeywords
) {
    public ClassifiedRequest {
        Objects.requireNonNull(rawQuery, "rawQuery");
        Objects.requireNonNull(researchType, "researchType");
        Objects.requireNonNull(audience, "audience");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(urgency, "urgency");
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    /** True when the request was produced by the fallback path. */
    public boolean degraded() {
        return confidence == 0.0;
    }
}
