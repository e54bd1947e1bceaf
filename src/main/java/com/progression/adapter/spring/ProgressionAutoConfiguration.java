package com.progression.adapter.spring;

import com.progression.cache.CacheKeyFunction;
import com.progression.cache.PendingPayloadKeyFunction;
import com.progression.config.ContentLoader;
import com.progression.config.ContentTables;
import com.progression.engine.ProgressionEngine;
import com.progression.engine.ProgressionEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the progression engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "progression", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ProgressionProperties.class)
public class ProgressionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ProgressionAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ContentTables progressionContentTables(ProgressionProperties properties) {
        return ContentLoader.load(properties.getContentPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheKeyFunction buildIntentCacheKeyFunction() {
        return new PendingPayloadKeyFunction();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressionEngine progressionEngine(ContentTables tables, CacheKeyFunction keyFunction,
                                               ProgressionProperties properties) {
        log.info("Creating ProgressionEngine from {}", properties.getContentPath());
        return ProgressionEngineFactory.builder(tables)
                .cacheEnabled(properties.getCache().isEnabled())
                .cacheMaxEntries(properties.getCache().getMaxEntries())
                .keyFunction(keyFunction)
                .futureAvailability(properties.isFutureAvailability())
                .build();
    }
}
