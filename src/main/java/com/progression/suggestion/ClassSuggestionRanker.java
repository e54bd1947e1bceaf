package com.progression.suggestion;

import com.progression.condition.Condition;
import com.progression.intent.ClassProfile;
import com.progression.prerequisite.PrerequisiteEvaluator;
import com.progression.prerequisite.PrerequisiteResult;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;
import com.progression.snapshot.Ability;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ranks base, advanced and prestige classes on the class ladder:
 * PRESTIGE_NOW 5, PATH_CONTINUATION 4, PRESTIGE_SOON 3, MECHANICAL_SYNERGY 2, THEMATIC 1, FALLBACK 0.
 * <p>
 * Classes are sorted by tier plus their category bias, prestige classes first on exact ties.
 * Requirements listed as "other" cannot be checked; they block PRESTIGE_NOW but are not counted
 * towards PRESTIGE_SOON.
 */
public class ClassSuggestionRanker {

    private static final Logger log = LoggerFactory.getLogger(ClassSuggestionRanker.class);

    static final int MECHANICAL_SYNERGY_SCORE = 3;
    static final int THEMATIC_SCORE = 1;
    static final int MAX_MISSING_FOR_SOON = 2;
    static final int GOOD_ABILITY_SCORE = 14;

    public static final Comparator<RankedClass> BY_BIASED_TIER = Comparator
            .comparingDouble(RankedClass::tierWithBias).reversed()
            .thenComparing(r -> r.candidate().isPrestige() ? 0 : 1)
            .thenComparing(r -> r.candidate().getName(), String.CASE_INSENSITIVE_ORDER);

    private final PrerequisiteEvaluator evaluator;
    private final LegacyPrerequisiteNormalizer normalizer;
    private final Map<String, ClassProfile> classProfiles;

    public ClassSuggestionRanker(PrerequisiteEvaluator evaluator,
                                 LegacyPrerequisiteNormalizer normalizer,
                                 Map<String, ClassProfile> classProfiles) {
        this.evaluator = evaluator;
        this.normalizer = normalizer;
        this.classProfiles = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        this.classProfiles.putAll(classProfiles);
    }

    /**
     * Rank classes for a character with its pending selections merged in.
     */
    public List<RankedClass> rank(List<Candidate> classes, CharacterSnapshot snapshot, PendingSelections pending) {
        CharacterSnapshot state = snapshot.withPending(pending);
        List<RankedClass> ranked = new ArrayList<>(classes.size());
        for (Candidate candidate : classes) {
            ranked.add(rankOne(candidate, state));
        }
        ranked.sort(BY_BIASED_TIER);
        log.debug("Ranked {} classes for {}", ranked.size(), state.getCharacterId());
        return ranked;
    }

    private RankedClass rankOne(Candidate candidate, CharacterSnapshot state) {
        List<String> verifiable = new ArrayList<>();
        try {
            PrerequisiteResult result = evaluator.evaluate(
                    state, candidate.effectivePrerequisites(normalizer), candidate.idOrName());
            for (Condition condition : result.getUnmetConditions()) {
                verifiable.add(condition.describe());
            }
        } catch (RuntimeException e) {
            log.warn("Prerequisite check for class {} failed, treating as unconstrained: {}",
                    candidate.getName(), e.getMessage());
        }
        List<String> missing = new ArrayList<>(verifiable);
        missing.addAll(candidate.getOtherRequirements());

        Suggestion suggestion = classTier(candidate, state, verifiable, missing);
        double tierWithBias = suggestion.tier() + candidate.getClassCategory().bias();
        log.trace("{} -> {} (biased {})", candidate, suggestion.reasonCode(), tierWithBias);
        return new RankedClass(candidate, suggestion, tierWithBias, missing);
    }

    private Suggestion classTier(Candidate candidate, CharacterSnapshot state, List<String> verifiable, List<String> missing) {
        String name = candidate.getName();
        boolean prestige = candidate.isPrestige();

        if (prestige && missing.isEmpty()) {
            return Suggestion.of(ReasonCode.PRESTIGE_NOW, "prestige:" + name,
                    "You meet all prerequisites for this prestige class");
        }
        if (state.hasClass(name)) {
            return Suggestion.of(ReasonCode.PATH_CONTINUATION, "class:" + name,
                    "Continue your " + name + " progression");
        }
        if (prestige && !verifiable.isEmpty() && verifiable.size() <= MAX_MISSING_FOR_SOON) {
            return Suggestion.of(ReasonCode.PRESTIGE_SOON, "prestige:" + name,
                    "Missing only: " + String.join(", ", verifiable));
        }

        ClassProfile profile = classProfiles.get(name);
        int score = profile == null ? 0 : synergyScore(profile, state);
        if (score >= MECHANICAL_SYNERGY_SCORE) {
            return Suggestion.of(ReasonCode.MECHANICAL_SYNERGY, "class:" + name, synergyReason(profile, state));
        }
        if (score >= THEMATIC_SCORE) {
            return Suggestion.of(ReasonCode.THEMATIC, "class:" + name, "Fits your character's theme");
        }
        return Suggestion.of(ReasonCode.FALLBACK, null, "Legal option");
    }

    /**
     * Highest ability +2 (or +1 for a score of 14 or more), +1 per trained skill, owned feat and
     * talent tree, +2 per owned talent.
     */
    static int synergyScore(ClassProfile profile, CharacterSnapshot state) {
        int score = 0;
        for (Ability ability : profile.abilities()) {
            if (ability == state.getHighestAbility()) {
                score += 2;
            } else if (state.abilityScore(ability) >= GOOD_ABILITY_SCORE) {
                score += 1;
            }
        }
        score += (int) profile.skills().stream().filter(state::hasTrainedSkill).count();
        score += (int) profile.feats().stream().filter(state::hasFeat).count();
        score += (int) profile.talentTrees().stream().filter(state::hasTalentTree).count();
        score += 2 * (int) profile.talents().stream().filter(state::hasTalent).count();
        return score;
    }

    static String synergyReason(ClassProfile profile, CharacterSnapshot state) {
        List<String> reasons = new ArrayList<>();
        Ability highest = state.getHighestAbility();
        if (profile.abilities().contains(highest)) {
            String fullName = highest.fullName();
            reasons.add("Uses your high " + Character.toUpperCase(fullName.charAt(0)) + fullName.substring(1));
        }
        if (profile.skills().stream().anyMatch(state::hasTrainedSkill)) {
            reasons.add("Uses trained skills");
        }
        if (profile.feats().stream().anyMatch(state::hasFeat)) {
            reasons.add("Builds on your feats");
        }
        if (profile.talentTrees().stream().anyMatch(state::hasTalentTree)) {
            reasons.add("Expands your talent options");
        }
        return reasons.isEmpty() ? "Strong mechanical synergy with your build" : String.join("; ", reasons);
    }
}
