package com.progression.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default key: the character id plus the pending selections serialized as JSON.
 * Characters without an id are not cached.
 */
public class PendingPayloadKeyFunction implements CacheKeyFunction {

    private static final Logger log = LoggerFactory.getLogger(PendingPayloadKeyFunction.class);

    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    @Override
    public CacheKey keyFor(CharacterSnapshot snapshot, PendingSelections pending) {
        if (snapshot.getCharacterId() == null) {
            return null;
        }
        PendingSelections selections = pending == null ? PendingSelections.empty() : pending;
        try {
            return new CacheKey(snapshot.getCharacterId(), objectMapper.writeValueAsString(selections));
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize pending selections for {}, skipping cache: {}",
                    snapshot.getCharacterId(), e.getOriginalMessage());
            return null;
        }
    }
}
