package com.progression.adapter.spring;

import com.progression.cache.BuildIntentCache;
import com.progression.config.ContentLoader;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the progression engine.
 */
@ConfigurationProperties(prefix = "progression")
public class ProgressionProperties {

    /**
     * Whether the progression engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the content tables file.
     * Supports classpath: prefix for classpath resources.
     */
    private String contentPath = ContentLoader.DEFAULT_PATH;

    /**
     * Rank illegal candidates by how soon they become legal.
     */
    private boolean futureAvailability = false;

    private final Cache cache = new Cache();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getContentPath() {
        return contentPath;
    }

    public void setContentPath(String contentPath) {
        this.contentPath = contentPath;
    }

    public boolean isFutureAvailability() {
        return futureAvailability;
    }

    public void setFutureAvailability(boolean futureAvailability) {
        this.futureAvailability = futureAvailability;
    }

    public Cache getCache() {
        return cache;
    }

    /**
     * Build-intent cache settings.
     */
    public static class Cache {

        private boolean enabled = true;

        /**
         * Least recently used entries are evicted past this size.
         */
        private int maxEntries = BuildIntentCache.DEFAULT_MAX_ENTRIES;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }
}
