package com.progression.cache;

import java.util.Objects;

/**
 * Build-intent cache key: the character it belongs to plus a serialized form of the pending selections.
 */
public record CacheKey(String characterId, String pendingPayload) {

    public CacheKey {
        Objects.requireNonNull(characterId, "characterId");
        pendingPayload = pendingPayload == null ? "" : pendingPayload;
    }
}
