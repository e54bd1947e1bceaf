package com.progression.cache;

import com.progression.intent.BuildIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Bounded LRU cache of build intents. Entries never expire on their own; callers drop a
 * character's entries with {@link #invalidate(String)} when a new progression session starts.
 */
public class BuildIntentCache {

    private static final Logger log = LoggerFactory.getLogger(BuildIntentCache.class);

    public static final int DEFAULT_MAX_ENTRIES = 256;

    private final int maxEntries;
    private final LinkedHashMap<CacheKey, BuildIntent> entries;

    public BuildIntentCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public BuildIntentCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(Math.min(16, maxEntries), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, BuildIntent> eldest) {
                return size() > BuildIntentCache.this.maxEntries;
            }
        };
    }

    /**
     * Cached intent for the key, computing and storing it on a miss.
     */
    public synchronized BuildIntent getOrCompute(CacheKey key, Supplier<BuildIntent> compute) {
        BuildIntent cached = entries.get(key);
        if (cached != null) {
            log.trace("Build intent cache hit for {}", key.characterId());
            return cached;
        }
        BuildIntent computed = compute.get();
        entries.put(key, computed);
        return computed;
    }

    public synchronized BuildIntent get(CacheKey key) {
        return entries.get(key);
    }

    /**
     * Drop every entry belonging to a character.
     *
     * @return number of entries removed
     */
    public synchronized int invalidate(String characterId) {
        int removed = 0;
        Iterator<CacheKey> keys = entries.keySet().iterator();
        while (keys.hasNext()) {
            if (keys.next().characterId().equals(characterId)) {
                keys.remove();
                removed++;
            }
        }
        log.debug("Invalidated {} build intent entries for {}", removed, characterId);
        return removed;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
