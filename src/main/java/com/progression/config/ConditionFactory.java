package com.progression.config;

import com.progression.condition.AbilityMinimum;
import com.progression.condition.AlignmentComparison;
import com.progression.condition.AlignmentScoreMinimum;
import com.progression.condition.AllOf;
import com.progression.condition.AnyOf;
import com.progression.condition.ArmorProficiency;
import com.progression.condition.AttackBonusMinimum;
import com.progression.condition.ClassLevelMinimum;
import com.progression.condition.ComparisonOperator;
import com.progression.condition.Condition;
import com.progression.condition.ConditionType;
import com.progression.condition.DroidDegree;
import com.progression.condition.DroidStatus;
import com.progression.condition.FeatureKind;
import com.progression.condition.FeatureOwned;
import com.progression.condition.FeaturePattern;
import com.progression.condition.ForcePowerKnown;
import com.progression.condition.ForceSecretKnown;
import com.progression.condition.ForceSensitive;
import com.progression.condition.ForceTechniqueKnown;
import com.progression.condition.LevelMinimum;
import com.progression.condition.Not;
import com.progression.condition.SkillTrained;
import com.progression.condition.SpeciesMatch;
import com.progression.condition.SpeciesTrait;
import com.progression.condition.TalentsFromTree;
import com.progression.condition.WeaponTraining;
import com.progression.exception.ConfigurationException;
import com.progression.prerequisite.CombinatorMode;
import com.progression.prerequisite.PrerequisiteSet;
import com.progression.snapshot.Ability;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Creates Condition instances from content-table maps, e.g.
 * <pre>
 * - type: feat
 *   name: Point-Blank Shot
 * - type: attribute
 *   ability: dex
 *   minimum: 13
 * - type: or
 *   conditions: [...]
 * </pre>
 * Type names are matched case-insensitively, ignoring '-' and '_'.
 */
public final class ConditionFactory {

    private static final Map<String, ConditionType> TYPE_ALIASES = Map.ofEntries(
            Map.entry("feat", ConditionType.FEATURE_OWNED),
            Map.entry("talent", ConditionType.FEATURE_OWNED),
            Map.entry("feature", ConditionType.FEATURE_OWNED),
            Map.entry("talentfromtree", ConditionType.TALENTS_FROM_TREE),
            Map.entry("featpattern", ConditionType.FEATURE_PATTERN),
            Map.entry("attribute", ConditionType.ABILITY_MINIMUM),
            Map.entry("ability", ConditionType.ABILITY_MINIMUM),
            Map.entry("bab", ConditionType.ATTACK_BONUS_MINIMUM),
            Map.entry("level", ConditionType.LEVEL_MINIMUM),
            Map.entry("classlevel", ConditionType.CLASS_LEVEL_MINIMUM),
            Map.entry("darksidescore", ConditionType.ALIGNMENT_SCORE_MINIMUM),
            Map.entry("darksidescoredynamic", ConditionType.ALIGNMENT_COMPARISON),
            Map.entry("skilltrained", ConditionType.SKILL_TRAINED),
            Map.entry("skill", ConditionType.SKILL_TRAINED),
            Map.entry("weaponproficiency", ConditionType.WEAPON_TRAINING),
            Map.entry("weaponfocus", ConditionType.WEAPON_TRAINING),
            Map.entry("weaponspecialization", ConditionType.WEAPON_TRAINING),
            Map.entry("armorproficiency", ConditionType.ARMOR_PROFICIENCY),
            Map.entry("species", ConditionType.SPECIES_MATCH),
            Map.entry("speciestrait", ConditionType.SPECIES_TRAIT),
            Map.entry("isdroid", ConditionType.DROID_STATUS),
            Map.entry("nondroid", ConditionType.DROID_STATUS),
            Map.entry("droiddegree", ConditionType.DROID_DEGREE),
            Map.entry("forcesensitive", ConditionType.FORCE_SENSITIVE),
            Map.entry("forcepower", ConditionType.FORCE_POWER),
            Map.entry("forcetechnique", ConditionType.FORCE_TECHNIQUE),
            Map.entry("forcesecret", ConditionType.FORCE_SECRET),
            Map.entry("or", ConditionType.ANY_OF),
            Map.entry("and", ConditionType.ALL_OF),
            Map.entry("not", ConditionType.NOT)
    );

    private ConditionFactory() {
    }

    /**
     * Create a prerequisite set. Accepts a list of condition maps (AND) or a map with
     * {@code mode} (all/any) and {@code conditions}. Null yields an empty set.
     */
    @SuppressWarnings("unchecked")
    public static PrerequisiteSet createSet(Object config) {
        if (config == null) {
            return PrerequisiteSet.none();
        }
        if (config instanceof List<?> list) {
            return new PrerequisiteSet(createAll(list), CombinatorMode.ALL);
        }
        if (config instanceof Map<?, ?> map) {
            Map<String, Object> typed = (Map<String, Object>) map;
            CombinatorMode mode = CombinatorMode.fromName(getString(typed, "mode", getString(typed, "type", null)));
            Object conditions = typed.get("conditions");
            if (!(conditions instanceof List<?> list)) {
                throw new ConfigurationException("Prerequisite set requires a 'conditions' list: " + typed);
            }
            return new PrerequisiteSet(createAll(list), mode);
        }
        throw new ConfigurationException("Unsupported prerequisite definition: " + config);
    }

    /**
     * Create a single condition from its map form.
     */
    public static Condition create(Map<String, Object> config) {
        if (config == null) {
            throw new ConfigurationException("Condition configuration cannot be null");
        }
        String rawType = getString(config, "type", null);
        if (rawType == null) {
            throw new ConfigurationException("Condition type cannot be null: " + config);
        }
        String alias = rawType.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        ConditionType type = TYPE_ALIASES.get(alias);
        if (type == null) {
            throw new ConfigurationException("Unknown condition type '" + rawType + "'");
        }

        return switch (type) {
            case FEATURE_OWNED -> createFeatureOwned(config, alias);
            case TALENTS_FROM_TREE -> new TalentsFromTree(requireString(config, "tree", type),
                    getInt(config, "count", 1));
            case FEATURE_PATTERN -> new FeaturePattern(requireString(config, "pattern", type),
                    getString(config, "description", null));
            case ABILITY_MINIMUM -> new AbilityMinimum(requireAbility(config, type),
                    requireInt(config, "minimum", type));
            case ATTACK_BONUS_MINIMUM -> new AttackBonusMinimum(requireInt(config, "minimum", type));
            case LEVEL_MINIMUM -> new LevelMinimum(requireInt(config, "minimum", type));
            case CLASS_LEVEL_MINIMUM -> new ClassLevelMinimum(requireString(config, "className", type),
                    getInt(config, "minimum", 1));
            case ALIGNMENT_SCORE_MINIMUM -> new AlignmentScoreMinimum(requireInt(config, "minimum", type));
            case ALIGNMENT_COMPARISON -> createAlignmentComparison(config);
            case SKILL_TRAINED -> new SkillTrained(requireString(config, "skill", type));
            case WEAPON_TRAINING -> createWeaponTraining(config, alias);
            case ARMOR_PROFICIENCY -> new ArmorProficiency(requireString(config, "armorType", type));
            case SPECIES_MATCH -> new SpeciesMatch(requireNames(config, type));
            case SPECIES_TRAIT -> new SpeciesTrait(requireString(config, "trait", type));
            case DROID_STATUS -> alias.equals("nondroid") ? DroidStatus.excluded() : DroidStatus.required();
            case DROID_DEGREE -> new DroidDegree(requireString(config, "degree", type));
            case FORCE_SENSITIVE -> new ForceSensitive();
            case FORCE_POWER -> new ForcePowerKnown(getStrings(config, "names"),
                    getString(config, "category", null), getInt(config, "count", 1));
            case FORCE_TECHNIQUE -> new ForceTechniqueKnown(getInt(config, "count", 0),
                    getString(config, "associatedWithPower", null));
            case FORCE_SECRET -> new ForceSecretKnown(getStrings(config, "names"), getBoolean(config, "any"));
            case ANY_OF -> new AnyOf(createNested(config, type));
            case ALL_OF -> new AllOf(createNested(config, type));
            case NOT -> createNot(config);
        };
    }

    private static Condition createFeatureOwned(Map<String, Object> config, String alias) {
        FeatureKind kind = switch (alias) {
            case "feat" -> FeatureKind.FEAT;
            case "talent" -> FeatureKind.TALENT;
            default -> FeatureKind.ANY;
        };
        return new FeatureOwned(requireString(config, "name", ConditionType.FEATURE_OWNED), kind);
    }

    private static Condition createAlignmentComparison(Map<String, Object> config) {
        Ability ability = requireAbility(config, ConditionType.ALIGNMENT_COMPARISON);
        String operator = requireString(config, "operator", ConditionType.ALIGNMENT_COMPARISON);
        try {
            return new AlignmentComparison(ComparisonOperator.fromName(operator), ability);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown comparison operator '" + operator + "'", e);
        }
    }

    private static Condition createWeaponTraining(Map<String, Object> config, String alias) {
        WeaponTraining.Level level = switch (alias) {
            case "weaponfocus" -> WeaponTraining.Level.FOCUS;
            case "weaponspecialization" -> WeaponTraining.Level.SPECIALIZATION;
            default -> WeaponTraining.Level.PROFICIENCY;
        };
        String group = getString(config, "group", getString(config, "weapon", null));
        if (group == null) {
            throw new ConfigurationException(ConditionType.WEAPON_TRAINING + " condition requires 'group'");
        }
        return new WeaponTraining(level, group);
    }

    private static Condition createNot(Map<String, Object> config) {
        List<Condition> nested = createNested(config, ConditionType.NOT);
        if (nested.size() != 1) {
            throw new ConfigurationException("NOT condition requires exactly one nested condition");
        }
        return new Not(nested.get(0));
    }

    private static List<Condition> createNested(Map<String, Object> config, ConditionType type) {
        Object conditions = config.get("conditions");
        if (!(conditions instanceof List<?> list) || list.isEmpty()) {
            throw new ConfigurationException(type + " condition requires nested conditions");
        }
        return createAll(list);
    }

    @SuppressWarnings("unchecked")
    private static List<Condition> createAll(List<?> list) {
        List<Condition> result = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new ConfigurationException("Condition entry must be a map: " + item);
            }
            result.add(create((Map<String, Object>) map));
        }
        return result;
    }

    private static Ability requireAbility(Map<String, Object> config, ConditionType type) {
        String name = requireString(config, "ability", type);
        return Ability.lookup(name)
                .orElseThrow(() -> new ConfigurationException(type + " condition has unknown ability '" + name + "'"));
    }

    private static List<String> requireNames(Map<String, Object> config, ConditionType type) {
        List<String> names = getStrings(config, "names");
        if (names.isEmpty()) {
            String name = getString(config, "name", null);
            if (name == null) {
                throw new ConfigurationException(type + " condition requires 'name' or 'names'");
            }
            return List.of(name);
        }
        return names;
    }

    private static String requireString(Map<String, Object> config, String key, ConditionType type) {
        String value = getString(config, key, null);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(type + " condition requires '" + key + "'");
        }
        return value;
    }

    private static int requireInt(Map<String, Object> config, String key, ConditionType type) {
        if (config.get(key) == null) {
            throw new ConfigurationException(type + " condition requires numeric '" + key + "'");
        }
        return getInt(config, key, 0);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Boolean) return (Boolean) value;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static List<String> getStrings(Map<String, Object> map, String key) {
        Object value = map.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        } else if (value != null) {
            result.add(value.toString());
        }
        return result;
    }
}
