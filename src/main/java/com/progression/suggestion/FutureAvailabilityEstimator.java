package com.progression.suggestion;

import com.progression.condition.AbilityMinimum;
import com.progression.condition.AllOf;
import com.progression.condition.AnyOf;
import com.progression.condition.AttackBonusMinimum;
import com.progression.condition.ClassLevelMinimum;
import com.progression.condition.Condition;
import com.progression.condition.EvaluationContext;
import com.progression.condition.LevelMinimum;
import com.progression.snapshot.CharacterSnapshot;

import java.util.List;
import java.util.OptionalInt;

/**
 * Estimates how many levels a character needs before an illegal candidate becomes legal,
 * and maps that estimate onto the reduced future-availability scale.
 * <p>
 * Species, species traits and droid classification cannot be gained by levelling, so a
 * candidate blocked only by one of those still yields no estimate.
 */
public class FutureAvailabilityEstimator {

    static final double BAB_PER_LEVEL = 0.75;
    static final int LEVELS_PER_ABILITY_POINT = 4;
    static final double CLASS_THEME_BOOST = 1.2;

    /**
     * Levels until every unmet condition could hold, or empty when one can never hold.
     */
    public OptionalInt estimateLevels(List<Condition> unmet, CharacterSnapshot snapshot) {
        int levels = 1;
        for (Condition condition : unmet) {
            OptionalInt gap = gap(condition, snapshot);
            if (gap.isEmpty()) {
                return OptionalInt.empty();
            }
            levels = Math.max(levels, gap.getAsInt());
        }
        return OptionalInt.of(levels);
    }

    /**
     * Future-availability suggestion for the given unmet conditions, or null when not obtainable.
     *
     * @param classThemeMatch whether the candidate is linked to one of the character's classes
     */
    public Suggestion suggest(List<Condition> unmet, CharacterSnapshot snapshot, boolean classThemeMatch) {
        OptionalInt levels = estimateLevels(unmet, snapshot);
        if (levels.isEmpty()) {
            return null;
        }
        int n = levels.getAsInt();
        double tier = scale(n);
        if (classThemeMatch) {
            tier *= CLASS_THEME_BOOST;
        }
        return new Suggestion(tier, ReasonCode.FUTURE_AVAILABLE, "future_availability:" + n,
                TierConfidence.FUTURE_CONFIDENCE, "Available in about " + n + (n == 1 ? " level" : " levels"));
    }

    /**
     * Reduced scale: one level 0.6, two 0.4, up to five 0.2, anything further 0.05.
     */
    public static double scale(int levels) {
        if (levels <= 1) {
            return ReasonCode.FUTURE_AVAILABLE.baseTier();
        }
        if (levels <= 2) {
            return 0.4;
        }
        if (levels <= 5) {
            return 0.2;
        }
        return 0.05;
    }

    private OptionalInt gap(Condition condition, CharacterSnapshot snapshot) {
        switch (condition.getType()) {
            case ATTACK_BONUS_MINIMUM: {
                int missing = ((AttackBonusMinimum) condition).minimum() - snapshot.getBaseAttackBonus();
                return OptionalInt.of(Math.max(1, (int) Math.ceil(missing / BAB_PER_LEVEL)));
            }
            case LEVEL_MINIMUM:
                return OptionalInt.of(Math.max(1,
                        ((LevelMinimum) condition).minimum() - snapshot.getCharacterLevel()));
            case CLASS_LEVEL_MINIMUM: {
                ClassLevelMinimum classLevel = (ClassLevelMinimum) condition;
                return OptionalInt.of(Math.max(1,
                        classLevel.minimum() - snapshot.classLevel(classLevel.className())));
            }
            case ABILITY_MINIMUM: {
                AbilityMinimum ability = (AbilityMinimum) condition;
                int missing = ability.minimum() - snapshot.abilityScore(ability.ability());
                return OptionalInt.of(Math.max(1, missing * LEVELS_PER_ABILITY_POINT));
            }
            case SPECIES_MATCH:
            case SPECIES_TRAIT:
            case DROID_STATUS:
            case DROID_DEGREE:
                return OptionalInt.empty();
            case ANY_OF:
                return cheapestAlternative(((AnyOf) condition).conditions(), snapshot);
            case ALL_OF:
                return estimateLevels(unmetWithin(((AllOf) condition).conditions(), snapshot), snapshot);
            default:
                return OptionalInt.of(1);
        }
    }

    private OptionalInt cheapestAlternative(List<Condition> alternatives, CharacterSnapshot snapshot) {
        OptionalInt best = OptionalInt.empty();
        for (Condition alternative : alternatives) {
            OptionalInt gap = gap(alternative, snapshot);
            if (gap.isPresent() && (best.isEmpty() || gap.getAsInt() < best.getAsInt())) {
                best = gap;
            }
        }
        return best;
    }

    private static List<Condition> unmetWithin(List<Condition> conditions, CharacterSnapshot snapshot) {
        EvaluationContext context = EvaluationContext.of(snapshot);
        return conditions.stream().filter(c -> !c.evaluate(context)).toList();
    }
}
