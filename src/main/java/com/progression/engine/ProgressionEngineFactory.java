package com.progression.engine;

import com.progression.cache.BuildIntentCache;
import com.progression.cache.CacheKeyFunction;
import com.progression.cache.CachingBuildIntentAnalyzer;
import com.progression.cache.PendingPayloadKeyFunction;
import com.progression.coherence.BuildCoherenceAnalyzer;
import com.progression.coherence.CoherenceScorer;
import com.progression.coherence.SynergyEvaluator;
import com.progression.config.ContentLoader;
import com.progression.config.ContentTables;
import com.progression.intent.BuildIntentAnalyzer;
import com.progression.intent.DefaultBuildIntentAnalyzer;
import com.progression.prerequisite.DefaultPrerequisiteEvaluator;
import com.progression.prerequisite.PrerequisiteEvaluator;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;
import com.progression.suggestion.ClassSuggestionRanker;
import com.progression.suggestion.DefaultSuggestionRanker;
import com.progression.suggestion.FutureAvailabilityEstimator;
import com.progression.suggestion.RankingOptions;
import com.progression.suggestion.SuggestionRanker;
import com.progression.synergy.DefaultSynergyDetector;
import com.progression.synergy.SynergyDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires a {@link DefaultProgressionEngine} from content tables.
 *
 * <pre>
 * ProgressionEngine engine = ProgressionEngineFactory.builder(ContentLoader.load(path))
 *         .cacheMaxEntries(512)
 *         .futureAvailability(true)
 *         .build();
 * </pre>
 */
public final class ProgressionEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(ProgressionEngineFactory.class);

    private ProgressionEngineFactory() {
    }

    /**
     * Engine over the bundled content with default options.
     */
    public static ProgressionEngine createDefault() {
        return builder(ContentLoader.load(ContentLoader.DEFAULT_PATH)).build();
    }

    public static Builder builder(ContentTables tables) {
        return new Builder(tables);
    }

    public static final class Builder {
        private final ContentTables tables;
        private int cacheMaxEntries = BuildIntentCache.DEFAULT_MAX_ENTRIES;
        private boolean cacheEnabled = true;
        private CacheKeyFunction keyFunction = new PendingPayloadKeyFunction();
        private boolean futureAvailability;

        private Builder(ContentTables tables) {
            this.tables = tables;
        }

        public Builder cacheMaxEntries(int cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder keyFunction(CacheKeyFunction keyFunction) {
            this.keyFunction = keyFunction;
            return this;
        }

        public Builder futureAvailability(boolean futureAvailability) {
            this.futureAvailability = futureAvailability;
            return this;
        }

        public ProgressionEngine build() {
            LegacyPrerequisiteNormalizer normalizer =
                    new LegacyPrerequisiteNormalizer(tables.knownClasses(), tables.knownSpecies());
            PrerequisiteEvaluator evaluator = new DefaultPrerequisiteEvaluator(normalizer, tables.treeAccessRules());

            BuildIntentAnalyzer analyzer = new DefaultBuildIntentAnalyzer(tables.prestigeSignals(),
                    tables.classProfiles(), tables.themeSignals(), tables.tuning());
            if (cacheEnabled) {
                analyzer = new CachingBuildIntentAnalyzer(analyzer, new BuildIntentCache(cacheMaxEntries), keyFunction);
            }

            SynergyDetector synergyDetector = new DefaultSynergyDetector(tables.synergyRules(), tables.themeEmphasis());
            CoherenceScorer coherence = new SynergyEvaluator(
                    new BuildCoherenceAnalyzer(tables.coherenceTables(), normalizer), synergyDetector);

            SuggestionRanker ranker = new DefaultSuggestionRanker(evaluator, normalizer, analyzer, synergyDetector,
                    coherence, tables.mentorBiasKeywords(), new FutureAvailabilityEstimator(), tables.tuning());
            ClassSuggestionRanker classRanker = new ClassSuggestionRanker(evaluator, normalizer, tables.classProfiles());

            log.info("Created progression engine: cache {}, future availability {}",
                    cacheEnabled ? "max " + cacheMaxEntries + " entries" : "disabled", futureAvailability);
            return new DefaultProgressionEngine(evaluator, analyzer, synergyDetector, ranker, classRanker,
                    RankingOptions.defaults().withFutureAvailability(futureAvailability));
        }
    }
}
