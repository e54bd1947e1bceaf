package com.progression.cache;

import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;

/**
 * Derives the cache key for an analysis request. Returning null bypasses the cache.
 */
@FunctionalInterface
public interface CacheKeyFunction {

    CacheKey keyFor(CharacterSnapshot snapshot, PendingSelections pending);
}
