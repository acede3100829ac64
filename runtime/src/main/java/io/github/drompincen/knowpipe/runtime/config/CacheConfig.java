package io.github.drompincen.knowpipe.runtime.config;

import io.github.drompincen.knowpipe.runtime.cache.CacheBackingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    /** Memory-only cache when {@code knowpipe.cache.persistent=false}. */
    @Bean
    @ConditionalOnProperty(name = "knowpipe.cache.persistent", havingValue = "false")
    public CacheBackingStore noCacheBackingStore() {
        return CacheBackingStore.NONE;
    }
}
