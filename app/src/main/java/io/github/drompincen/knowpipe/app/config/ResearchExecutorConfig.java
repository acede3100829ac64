package io.github.drompincen.knowpipe.app.config;

import io.github.drompincen.knowpipe.runtime.scheduler.ResearchExecutionException;
import io.github.drompincen.knowpipe.runtime.scheduler.ResearchExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback used until a real research backend is wired in. Every task it receives fails
 * without retries, so submissions still get a terminal FAILED notification.
 */
@Configuration
public class ResearchExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ResearchExecutorConfig.class);

    @Bean
    @ConditionalOnMissingBean(ResearchExecutor.class)
    ResearchExecutor unconfiguredResearchExecutor() {
        log.warn("No ResearchExecutor bean found; research tasks will fail until one is provided");
        return (request, context) -> {
            throw ResearchExecutionException.fatal("no research executor configured");
        };
    }
}
