package com.progression.cache;

import com.progression.intent.Alignment;
import com.progression.intent.BuildIntent;
import com.progression.intent.BuildIntentAnalyzer;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;

/**
 * BuildIntentAnalyzer decorator that memoizes {@link #analyze} results in a {@link BuildIntentCache}.
 */
public class CachingBuildIntentAnalyzer implements BuildIntentAnalyzer {

    private final BuildIntentAnalyzer delegate;
    private final BuildIntentCache cache;
    private final CacheKeyFunction keyFunction;

    public CachingBuildIntentAnalyzer(BuildIntentAnalyzer delegate, BuildIntentCache cache) {
        this(delegate, cache, new PendingPayloadKeyFunction());
    }

    public CachingBuildIntentAnalyzer(BuildIntentAnalyzer delegate, BuildIntentCache cache, CacheKeyFunction keyFunction) {
        this.delegate = delegate;
        this.cache = cache;
        this.keyFunction = keyFunction;
    }

    @Override
    public BuildIntent analyze(CharacterSnapshot snapshot, PendingSelections pending) {
        CacheKey key = keyFunction.keyFor(snapshot, pending);
        if (key == null) {
            return delegate.analyze(snapshot, pending);
        }
        return cache.getOrCompute(key, () -> delegate.analyze(snapshot, pending));
    }

    @Override
    public Alignment checkFeatAlignment(String featName, BuildIntent intent) {
        return delegate.checkFeatAlignment(featName, intent);
    }

    @Override
    public Alignment checkTalentAlignment(String talentName, String treeName, BuildIntent intent) {
        return delegate.checkTalentAlignment(talentName, treeName, intent);
    }

    @Override
    public String prestigeRecommendationReason(String className, BuildIntent intent) {
        return delegate.prestigeRecommendationReason(className, intent);
    }

    public int invalidate(String characterId) {
        return cache.invalidate(characterId);
    }

    public BuildIntentCache getCache() {
        return cache;
    }
}
