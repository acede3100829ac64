package io.github.drompincen.knowpipe.app.config;

import io.github.drompincen.knowpipe.protocol.api.AudienceLevel;
import io.github.drompincen.knowpipe.protocol.api.ClassifiedRequest;
import io.github.drompincen.knowpipe.protocol.api.ResearchType;
import io.github.drompincen.knowpipe.protocol.api.UrgencyLevel;
import io.github.drompincen.knowpipe.runtime.scheduler.ResearchExecutionException;
import io.github.drompincen.knowpipe.runtime.scheduler.ResearchExecutor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearchExecutorConfigTest {

    @Test
    void fallbackExecutorFailsWithoutRetry() {
        ResearchExecutor executor = new ResearchExecutorConfig().unconfiguredResearchExecutor();
        ClassifiedRequest request = new ClassifiedRequest("q", ResearchType.IMPLEMENTATION,
                AudienceLevel.INTERMEDIATE, "java", UrgencyLevel.MEDIUM, 0.7, List.of());

        assertThatThrownBy(() -> executor.execute(request, null))
                .isInstanceOf(ResearchExecutionException.class)
                .satisfies(e -> assertThat(((ResearchExecutionException) e).retryable()).isFalse());
    }
}
