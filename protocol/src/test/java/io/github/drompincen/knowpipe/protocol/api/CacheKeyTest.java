package io.github.drompincen.knowpipe.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyTest {

    @Test
    void idIsHexSha256OfAllDimensions() {
        CacheKey key = new CacheKey("abc", ResearchType.IMPLEMENTATION, AudienceLevel.INTERMEDIATE, "async", "-");
        CacheKey same = new CacheKey("abc", ResearchType.IMPLEMENTATION, AudienceLevel.INTERMEDIATE, "async", "-");
        CacheKey otherAudience = new CacheKey("abc", ResearchType.IMPLEMENTATION, AudienceLevel.ADVANCED, "async", "-");

        assertThat(key.id()).hasSize(64).matches("[0-9a-f]+");
        assertThat(key.id()).isEqualTo(same.id());
        assertThat(key.id()).isNotEqualTo(otherAudience.id());
    }

    @Test
    void zeroConfidenceMarksDegradedRequest() {
        ClassifiedRequest degraded = new ClassifiedRequest("q", ResearchType.IMPLEMENTATION,
                AudienceLevel.INTERMEDIATE, "general", UrgencyLevel.MEDIUM, 0.0, null);

        assertThat(degraded.degraded()).isTrue();
        assertThat(degraded.matchedKeywords()).isEmpty();
    }
}
