package com.progression.suggestion;

import com.progression.coherence.CoherenceScorer;
import com.progression.condition.AbilityMinimum;
import com.progression.condition.ArmorProficiency;
import com.progression.condition.Condition;
import com.progression.condition.EvaluationContext;
import com.progression.condition.FeatureOwned;
import com.progression.condition.SkillTrained;
import com.progression.condition.SpeciesMatch;
import com.progression.condition.WeaponTraining;
import com.progression.config.EngineTuning;
import com.progression.intent.Alignment;
import com.progression.intent.BuildIntent;
import com.progression.intent.BuildIntentAnalyzer;
import com.progression.intent.PrestigeAffinity;
import com.progression.intent.PriorityPrerequisite;
import com.progression.prerequisite.CombinatorMode;
import com.progression.prerequisite.PrerequisiteEvaluator;
import com.progression.prerequisite.PrerequisiteResult;
import com.progression.prerequisite.PrerequisiteSet;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;
import com.progression.synergy.ActiveSynergy;
import com.progression.synergy.SuggestionKind;
import com.progression.synergy.SynergyDetector;
import com.progression.synergy.SynergyMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Default implementation of SuggestionRanker.
 * <p>
 * The ladder is walked top to bottom and the first rule that matches decides the tier:
 * <pre>
 *   6    PRESTIGE_PREREQ       priority prerequisite of a prestige target
 *   5.5  WISHLIST_PATH         unmet prerequisite of a wishlist item
 *   5    MARTIAL_ARTS          martial arts feat
 *   5    META_SYNERGY          suggested by an active synergy rule
 *   4.5  SPECIES_EARLY         species feat, decaying with level
 *   4    CHAIN_CONTINUATION    prerequisites name an owned feature
 *   3.5  MENTOR_BIAS           matches a positive mentor-survey dimension
 *   3    SKILL_PREREQ_MATCH    requires a skill the character has trained
 *   2    ABILITY_PREREQ_MATCH  requires the character's highest ability
 *   1    CLASS_SYNERGY         linked to an owned class, or aligned with the build intent
 *   0    FALLBACK
 * </pre>
 * A failure while ranking one candidate is logged and that candidate falls back to tier 0.
 */
public class DefaultSuggestionRanker implements SuggestionRanker {

    private static final Logger log = LoggerFactory.getLogger(DefaultSuggestionRanker.class);

    private static final double SPECIES_SKILL_BOOST = 0.5;
    private static final double SPECIES_TIER_CAP = 5.0;
    private static final String ALL_CLASSES = "all";

    private final PrerequisiteEvaluator evaluator;
    private final LegacyPrerequisiteNormalizer normalizer;
    private final BuildIntentAnalyzer intentAnalyzer;
    private final SynergyDetector synergyDetector;
    private final CoherenceScorer coherenceScorer;
    private final MentorBiasKeywords mentorKeywords;
    private final FutureAvailabilityEstimator futureEstimator;
    private final EngineTuning tuning;

    public DefaultSuggestionRanker(PrerequisiteEvaluator evaluator,
                                   LegacyPrerequisiteNormalizer normalizer,
                                   BuildIntentAnalyzer intentAnalyzer,
                                   SynergyDetector synergyDetector,
                                   CoherenceScorer coherenceScorer,
                                   MentorBiasKeywords mentorKeywords,
                                   FutureAvailabilityEstimator futureEstimator,
                                   EngineTuning tuning) {
        this.evaluator = evaluator;
        this.normalizer = normalizer;
        this.intentAnalyzer = intentAnalyzer;
        this.synergyDetector = synergyDetector;
        this.coherenceScorer = coherenceScorer;
        this.mentorKeywords = mentorKeywords;
        this.futureEstimator = futureEstimator;
        this.tuning = tuning;
    }

    @Override
    public List<RankedCandidate> rank(List<Candidate> candidates,
                                      CharacterSnapshot snapshot,
                                      PendingSelections pending,
                                      BuildIntent intent,
                                      RankingOptions options) {
        CharacterSnapshot state = snapshot.withPending(pending);
        BuildIntent buildIntent = intent != null ? intent : BuildIntent.empty();
        RankingOptions rankingOptions = options != null ? options : RankingOptions.defaults();
        List<ActiveSynergy> activeSynergies = synergyDetector.findActiveSynergies(state);

        List<RankedCandidate> ranked = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            ranked.add(rankOne(candidate, state, buildIntent, rankingOptions, activeSynergies));
        }
        ranked.sort(BY_TIER_THEN_NAME);

        log.debug("Ranked {} candidates for {} ({} active synergies)",
                ranked.size(), state.getCharacterId(), activeSynergies.size());
        return ranked;
    }

    private RankedCandidate rankOne(Candidate candidate,
                                    CharacterSnapshot state,
                                    BuildIntent intent,
                                    RankingOptions options,
                                    List<ActiveSynergy> activeSynergies) {
        PrerequisiteSet prerequisites;
        PrerequisiteResult result;
        try {
            prerequisites = candidate.effectivePrerequisites(normalizer);
            result = evaluator.evaluate(state, prerequisites, candidate.idOrName());
        } catch (RuntimeException e) {
            log.warn("Prerequisite check for {} failed, treating as unconstrained: {}", candidate, e.getMessage());
            prerequisites = PrerequisiteSet.none();
            result = PrerequisiteResult.satisfied();
        }
        double coherence = coherenceScorer.score(candidate, state);

        if (!result.isSatisfied()) {
            Suggestion future = null;
            if (options.futureAvailability()) {
                future = futureSuggestion(candidate, state, result);
            }
            log.trace("{} not legal: {}", candidate, result.getUnmetReasons());
            return new RankedCandidate(candidate, future, false, result.getUnmetReasons(), coherence);
        }

        Suggestion suggestion;
        try {
            suggestion = ladder(candidate, prerequisites, state, intent, options, activeSynergies);
        } catch (RuntimeException e) {
            log.warn("Ranking {} failed, using fallback tier: {}", candidate, e.getMessage());
            suggestion = Suggestion.fallback();
        }
        log.trace("{} -> {} ({})", candidate, suggestion.reasonCode(), suggestion.sourceId());
        return new RankedCandidate(candidate, suggestion, true, List.of(), coherence);
    }

    private Suggestion futureSuggestion(Candidate candidate, CharacterSnapshot state, PrerequisiteResult result) {
        try {
            return futureEstimator.suggest(result.getUnmetConditions(), state, linkedClass(candidate, state).isPresent());
        } catch (RuntimeException e) {
            log.warn("Future availability estimate for {} failed: {}", candidate, e.getMessage());
            return null;
        }
    }

    Suggestion ladder(Candidate candidate,
                      PrerequisiteSet prerequisites,
                      CharacterSnapshot state,
                      BuildIntent intent,
                      RankingOptions options,
                      List<ActiveSynergy> activeSynergies) {
        List<Condition> leaves = prerequisites.positiveConditions();

        Optional<Suggestion> suggestion = prestigePrerequisite(candidate, intent);
        if (suggestion.isEmpty()) {
            suggestion = wishlistPath(candidate, state, options.wishlist());
        }
        if (suggestion.isEmpty() && candidate.isFeat()
                && Candidate.FEAT_TYPE_MARTIAL_ARTS.equals(candidate.getFeatType())) {
            suggestion = Optional.of(Suggestion.of(ReasonCode.MARTIAL_ARTS, null, "Strong martial arts foundation"));
        }
        if (suggestion.isEmpty()) {
            suggestion = metaSynergy(candidate, activeSynergies);
        }
        if (suggestion.isEmpty()) {
            suggestion = speciesEarly(candidate, leaves, state);
        }
        if (suggestion.isEmpty()) {
            suggestion = chainContinuation(candidate, leaves, state);
        }
        if (suggestion.isEmpty()) {
            suggestion = mentorBias(candidate, intent);
        }
        if (suggestion.isEmpty()) {
            suggestion = trainedSkill(leaves, state).map(skill -> Suggestion.of(
                    ReasonCode.SKILL_PREREQ_MATCH, "skill:" + skill.key(), "Uses your trained " + skill.skill()));
        }
        if (suggestion.isEmpty()) {
            suggestion = highestAbility(leaves, state);
        }
        if (suggestion.isEmpty()) {
            suggestion = classSynergy(candidate, state, intent);
        }
        return suggestion.orElseGet(Suggestion::fallback);
    }

    private Optional<Suggestion> prestigePrerequisite(Candidate candidate, BuildIntent intent) {
        if (candidate.isFeat()) {
            Optional<PriorityPrerequisite> priority = intent.priorityFeat(candidate.getName());
            Alignment alignment = intentAnalyzer.checkFeatAlignment(candidate.getName(), intent);
            if (priority.isPresent() && alignment.aligned()) {
                return Optional.of(Suggestion.of(ReasonCode.PRESTIGE_PREREQ,
                        "prestige:" + priority.get().forClass(), alignment.reason()));
            }
        } else if (candidate.isTalent()) {
            Optional<PrestigeAffinity> top = intent.topAffinity();
            if (top.isPresent() && top.get().confidence() >= tuning.prestigeTalentConfidence()) {
                Alignment alignment = intentAnalyzer.checkTalentAlignment(
                        candidate.getName(), candidate.getTalentTree(), intent);
                if (alignment.aligned()) {
                    return Optional.of(Suggestion.of(ReasonCode.PRESTIGE_PREREQ,
                            "prestige:" + top.get().className(), alignment.reason()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Suggestion> wishlistPath(Candidate candidate, CharacterSnapshot state, List<Candidate> wishlist) {
        for (Candidate wished : wishlist) {
            if (wished.idOrName().equalsIgnoreCase(candidate.idOrName())) {
                continue;
            }
            try {
                PrerequisiteResult wishedResult = evaluator.evaluate(
                        state, wished.effectivePrerequisites(normalizer), wished.idOrName());
                if (wishedResult.isSatisfied()) {
                    continue;
                }
                PrerequisiteSet unmet = new PrerequisiteSet(wishedResult.getUnmetConditions(), CombinatorMode.ALL);
                EvaluationContext context = EvaluationContext.of(state);
                for (Condition leaf : unmet.positiveConditions()) {
                    Optional<String> named = featureName(leaf);
                    if (named.isPresent() && named.get().equalsIgnoreCase(candidate.getName())
                            && !leaf.evaluate(context)) {
                        return Optional.of(Suggestion.of(ReasonCode.WISHLIST_PATH,
                                "wishlist:" + wished.idOrName(), "Required for " + wished.getName() + " on your wishlist"));
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Wishlist check of {} against {} failed: {}", candidate, wished, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private Optional<Suggestion> metaSynergy(Candidate candidate, List<ActiveSynergy> activeSynergies) {
        if (!candidate.isFeat() && !candidate.isTalent()) {
            return Optional.empty();
        }
        SuggestionKind kind = candidate.isFeat() ? SuggestionKind.FEAT : SuggestionKind.TALENT;
        return SynergyMatch.find(candidate.getName(), kind, activeSynergies)
                .map(match -> Suggestion.of(ReasonCode.META_SYNERGY,
                        "synergy:" + match.ruleId(), match.suggestion().reason()));
    }

    private Optional<Suggestion> speciesEarly(Candidate candidate, List<Condition> leaves, CharacterSnapshot state) {
        String species = state.getSpecies();
        if (species == null || !candidate.isFeat() || !Candidate.FEAT_TYPE_SPECIES.equals(candidate.getFeatType())) {
            return Optional.empty();
        }
        boolean structuredMatch = leaves.stream()
                .anyMatch(c -> c instanceof SpeciesMatch match && match.matches(species));
        String legacy = candidate.getLegacyPrerequisite();
        boolean textMatch = legacy != null
                && legacy.toLowerCase(Locale.ROOT).contains(species.toLowerCase(Locale.ROOT));
        if (!structuredMatch && !textMatch) {
            return Optional.empty();
        }

        double tier = speciesTier(state.getCharacterLevel(), tuning.speciesHalfLife());
        if (trainedSkill(leaves, state).isPresent()) {
            tier = Math.min(SPECIES_TIER_CAP, tier + SPECIES_SKILL_BOOST);
        }
        return Optional.of(Suggestion.at(tier, ReasonCode.SPECIES_EARLY,
                "species:" + species.toLowerCase(Locale.ROOT), "Matches your species heritage"));
    }

    /**
     * Species feat tier before any skill boost: {@code 4.5 * 0.5^(level / halfLife)}, level at least 1.
     */
    public static double speciesTier(int characterLevel, double halfLife) {
        int level = Math.max(1, characterLevel);
        return ReasonCode.SPECIES_EARLY.baseTier() * Math.pow(0.5, level / halfLife);
    }

    private Optional<Suggestion> chainContinuation(Candidate candidate, List<Condition> leaves, CharacterSnapshot state) {
        String declared = candidate.getPrerequisiteFeature();
        if (declared != null && state.ownsFeature(declared)) {
            return Optional.of(chain(declared));
        }
        EvaluationContext context = EvaluationContext.of(state);
        for (Condition leaf : leaves) {
            Optional<String> named = featureName(leaf);
            if (named.isPresent() && leaf.evaluate(context)) {
                return Optional.of(chain(named.get()));
            }
        }
        return Optional.empty();
    }

    private static Suggestion chain(String ownedName) {
        return Suggestion.of(ReasonCode.CHAIN_CONTINUATION, "chain:" + ownedName, "Builds on " + ownedName);
    }

    private Optional<Suggestion> mentorBias(Candidate candidate, BuildIntent intent) {
        if (intent.getMentorBiases().isEmpty()) {
            return Optional.empty();
        }
        return mentorKeywords.resolve(candidate, dimension -> intent.mentorBias(dimension) > 0)
                .map(dimension -> Suggestion.of(ReasonCode.MENTOR_BIAS,
                        "mentor_bias:" + dimension, "Aligns with your mentor guidance"));
    }

    private static Optional<SkillTrained> trainedSkill(List<Condition> leaves, CharacterSnapshot state) {
        return leaves.stream()
                .filter(SkillTrained.class::isInstance)
                .map(SkillTrained.class::cast)
                .filter(skill -> state.hasTrainedSkill(skill.skill()))
                .findFirst();
    }

    private static Optional<Suggestion> highestAbility(List<Condition> leaves, CharacterSnapshot state) {
        return leaves.stream()
                .filter(AbilityMinimum.class::isInstance)
                .map(AbilityMinimum.class::cast)
                .filter(ability -> ability.ability() == state.getHighestAbility())
                .findFirst()
                .map(ability -> Suggestion.of(ReasonCode.ABILITY_PREREQ_MATCH,
                        "ability:" + ability.ability().key(),
                        "Uses your highest ability, " + ability.ability().fullName()));
    }

    private Optional<Suggestion> classSynergy(Candidate candidate, CharacterSnapshot state, BuildIntent intent) {
        Optional<String> linked = linkedClass(candidate, state);
        if (linked.isPresent()) {
            return Optional.of(Suggestion.of(ReasonCode.CLASS_SYNERGY,
                    "class:" + linked.get(), "Fits your " + linked.get() + " training"));
        }
        Alignment alignment = candidate.isTalent()
                ? intentAnalyzer.checkTalentAlignment(candidate.getName(), candidate.getTalentTree(), intent)
                : intentAnalyzer.checkFeatAlignment(candidate.getName(), intent);
        if (alignment.aligned()) {
            return Optional.of(Suggestion.of(ReasonCode.CLASS_SYNERGY, null, alignment.reason()));
        }
        return Optional.empty();
    }

    /**
     * The owned class a candidate is a bonus feat for, or whose talent tree it belongs to.
     */
    static Optional<String> linkedClass(Candidate candidate, CharacterSnapshot state) {
        for (String className : candidate.getBonusFeatFor()) {
            if (ALL_CLASSES.equalsIgnoreCase(className)) {
                return state.getClassLevels().keySet().stream().findFirst().or(() -> Optional.of(ALL_CLASSES));
            }
            if (state.hasClass(className)) {
                return Optional.of(className);
            }
        }
        String tree = candidate.getTalentTree();
        if (tree != null) {
            String lowerTree = tree.toLowerCase(Locale.ROOT);
            for (String owned : state.getClassLevels().keySet()) {
                if (lowerTree.contains(owned.toLowerCase(Locale.ROOT))) {
                    return Optional.of(owned);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Feature name a leaf condition is satisfied by, for leaves that name one.
     */
    static Optional<String> featureName(Condition condition) {
        if (condition instanceof FeatureOwned owned) {
            return Optional.of(owned.name());
        }
        if (condition instanceof WeaponTraining weapon) {
            return Optional.of(weapon.featureName());
        }
        if (condition instanceof ArmorProficiency armor) {
            return Optional.of(armor.featureName());
        }
        return Optional.empty();
    }
}
