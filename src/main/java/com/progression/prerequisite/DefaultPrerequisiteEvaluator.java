package com.progression.prerequisite;

import com.progression.condition.AnyOf;
import com.progression.condition.Condition;
import com.progression.condition.EvaluationContext;
import com.progression.condition.ForceSensitive;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;
import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.OwnedFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Default implementation of PrerequisiteEvaluator.
 * <p>
 * Each condition is evaluated at its own boundary: an exception raised by one condition is
 * logged and counts as unmet, the rest of the set is still evaluated.
 */
public class DefaultPrerequisiteEvaluator implements PrerequisiteEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultPrerequisiteEvaluator.class);

    private final LegacyPrerequisiteNormalizer normalizer;
    private final Map<String, List<TalentTreeAccessRule>> treeAccessRules;

    public DefaultPrerequisiteEvaluator(LegacyPrerequisiteNormalizer normalizer,
                                        Map<String, List<TalentTreeAccessRule>> treeAccessRules) {
        this.normalizer = normalizer;
        this.treeAccessRules = lowerKeys(treeAccessRules);
    }

    @Override
    public PrerequisiteResult evaluate(CharacterSnapshot snapshot, PrerequisiteSet set, String candidateId) {
        if (set == null || set.isEmpty()) {
            return PrerequisiteResult.satisfied();
        }
        EvaluationContext context = new EvaluationContext(snapshot, candidateId);

        if (set.mode() == CombinatorMode.ANY) {
            for (Condition condition : set.conditions()) {
                if (holds(condition, context)) {
                    return PrerequisiteResult.satisfied();
                }
            }
            AnyOf group = new AnyOf(set.conditions());
            return PrerequisiteResult.unsatisfied(List.of(group.unmetReason(context)), List.of(group));
        }

        List<String> reasons = new ArrayList<>();
        List<Condition> unmet = new ArrayList<>();
        for (Condition condition : set.conditions()) {
            if (!holds(condition, context)) {
                unmet.add(condition);
                reasons.add(reason(condition, context));
            }
        }
        if (unmet.isEmpty()) {
            return PrerequisiteResult.satisfied();
        }
        log.trace("Prerequisites unmet for {}: {}", candidateId, reasons);
        return PrerequisiteResult.unsatisfied(reasons, unmet);
    }

    @Override
    public PrerequisiteResult evaluateLegacy(CharacterSnapshot snapshot, String prerequisiteText, String candidateId) {
        return evaluate(snapshot, normalizer.normalize(prerequisiteText), candidateId);
    }

    @Override
    public boolean canAccessTalentTree(CharacterSnapshot snapshot, String treeId) {
        if (treeId == null) {
            return false;
        }
        List<TalentTreeAccessRule> rules = treeAccessRules.get(treeId.toLowerCase(Locale.ROOT));
        if (rules == null || rules.isEmpty()) {
            log.debug("No access rules for talent tree '{}'", treeId);
            return false;
        }
        for (TalentTreeAccessRule rule : rules) {
            if (allows(rule, snapshot)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The normalizer used for free-text prerequisites.
     */
    public LegacyPrerequisiteNormalizer getNormalizer() {
        return normalizer;
    }

    private boolean allows(TalentTreeAccessRule rule, CharacterSnapshot snapshot) {
        return switch (rule.type()) {
            case CLASS -> false;
            case FORCE_GENERIC -> ForceSensitive.isForceSensitive(snapshot.getFeatNames());
            case FORCE_TRADITION -> ForceSensitive.isForceSensitive(snapshot.getFeatNames())
                    && belongsToTradition(snapshot, rule.tradition());
        };
    }

    private boolean belongsToTradition(CharacterSnapshot snapshot, String tradition) {
        if (tradition == null || tradition.isBlank()) {
            return false;
        }
        String wanted = tradition.toLowerCase(Locale.ROOT);
        return Stream.concat(snapshot.getFeats().stream(), snapshot.getTalents().stream())
                .anyMatch(feature -> matchesTradition(feature, wanted, tradition));
    }

    private static boolean matchesTradition(OwnedFeature feature, String lowerTradition, String tradition) {
        return feature.lowerName().contains(lowerTradition) || tradition.equalsIgnoreCase(feature.tradition());
    }

    private boolean holds(Condition condition, EvaluationContext context) {
        try {
            return condition.evaluate(context);
        } catch (RuntimeException e) {
            log.warn("Condition {} failed to evaluate for {}, treating as unmet: {}",
                    condition.getType(), context.candidateId(), e.getMessage());
            return false;
        }
    }

    private String reason(Condition condition, EvaluationContext context) {
        try {
            return condition.unmetReason(context);
        } catch (RuntimeException e) {
            log.warn("Condition {} failed to describe its unmet reason: {}", condition.getType(), e.getMessage());
            return "Requires " + condition.getType();
        }
    }

    private static Map<String, List<TalentTreeAccessRule>> lowerKeys(Map<String, List<TalentTreeAccessRule>> rules) {
        if (rules == null) {
            return Map.of();
        }
        Map<String, List<TalentTreeAccessRule>> lowered = new HashMap<>();
        rules.forEach((tree, list) -> lowered.put(tree.toLowerCase(Locale.ROOT), List.copyOf(list)));
        return Map.copyOf(lowered);
    }
}
