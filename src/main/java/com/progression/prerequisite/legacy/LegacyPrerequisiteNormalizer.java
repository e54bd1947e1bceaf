package com.progression.prerequisite.legacy;

import com.progression.condition.AbilityMinimum;
import com.progression.condition.AlignmentScoreMinimum;
import com.progression.condition.AnyOf;
import com.progression.condition.ArmorProficiency;
import com.progression.condition.AttackBonusMinimum;
import com.progression.condition.ClassLevelMinimum;
import com.progression.condition.Condition;
import com.progression.condition.DroidDegree;
import com.progression.condition.DroidStatus;
import com.progression.condition.FeatureOwned;
import com.progression.condition.ForceSecretKnown;
import com.progression.condition.ForceSensitive;
import com.progression.condition.ForceTechniqueKnown;
import com.progression.condition.LevelMinimum;
import com.progression.condition.SkillTrained;
import com.progression.condition.SpeciesMatch;
import com.progression.condition.WeaponTraining;
import com.progression.prerequisite.CombinatorMode;
import com.progression.prerequisite.PrerequisiteSet;
import com.progression.snapshot.Ability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-text prerequisites ("Dex 13, Point-Blank Shot, BAB +1") into a structured
 * {@link PrerequisiteSet} evaluated by the same evaluator as native condition trees.
 * <p>
 * The text is split on commas, semicolons and "and"; each segment is classified by fixed
 * rules, tried in order. Segments that match no rule are dropped, which makes them
 * behave as satisfied. An OR phrase with any unrecognized alternative is dropped whole.
 */
public class LegacyPrerequisiteNormalizer {

    private static final Logger log = LoggerFactory.getLogger(LegacyPrerequisiteNormalizer.class);

    private static final Pattern SEGMENT_SPLIT =
            Pattern.compile("\\s*[,;]\\s*|\\s+and\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern OR_SPLIT = Pattern.compile("\\s+or\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern ABILITY = Pattern.compile(
            "^(str|dex|con|int|wis|cha|strength|dexterity|constitution|intelligence|wisdom|charisma)\\s+(\\d+)\\+?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BAB = Pattern.compile(
            "(?:bab|base attack bonus)\\s*\\+?\\s*(\\d+)|\\+?(\\d+)\\s*(?:bab|base attack bonus)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CLASS_LEVEL = Pattern.compile(
            "^([A-Za-z][A-Za-z ]*?)\\s+(?:level\\s+)?(\\d+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEVEL = Pattern.compile(
            "(?:character\\s+)?level\\s+(\\d+)|(\\d+)(?:st|nd|rd|th)?[\\s-]+level", Pattern.CASE_INSENSITIVE);
    private static final Pattern SKILL_RANKS = Pattern.compile(
            "^(.+?)\\s+(\\d+)\\s+ranks?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAINED_IN = Pattern.compile(
            "trained\\s+in\\s+(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORCE_SENSITIVE = Pattern.compile(
            "force\\s+sensitiv(?:e|ity)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORCE_SECRET = Pattern.compile(
            "force\\s+secrets?", Pattern.CASE_INSENSITIVE);
    private static final Pattern FORCE_TECHNIQUE = Pattern.compile(
            "^(?:(\\d+)\\s+)?(?:any\\s+)?force\\s+techniques?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_DROID = Pattern.compile(
            "^(?:non-?droid|not\\s+a\\s+droid|cannot\\s+be\\s+a\\s+droid|must\\s+not\\s+be\\s+a\\s+droid)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DROID = Pattern.compile(
            "^(?:droid|must\\s+be\\s+a\\s+droid)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DROID_DEGREE = Pattern.compile(
            "^(\\d(?:st|nd|rd|th)[\\s-]degree)\\s+droid$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEAPON = Pattern.compile(
            "^weapon\\s+(proficiency|focus|specialization)\\s*\\((.+)\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROFICIENT_WITH = Pattern.compile(
            "^proficient\\s+with\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ARMOR = Pattern.compile(
            "^armor\\s+proficiency\\s*\\((.+)\\)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DARK_SIDE = Pattern.compile(
            "dark\\s+side\\s+score\\s*(?:of\\s+)?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FEATURE_NAME = Pattern.compile(
            "^[A-Z][A-Za-z0-9'\u2019()\\-:/ ]*$");

    private static final int MAX_FEATURE_NAME_WORDS = 6;

    private final Map<String, String> knownClasses;
    private final Map<String, String> knownSpecies;

    /**
     * @param knownClasses Class names recognized in "Jedi 7" / "Soldier level 3" segments
     * @param knownSpecies Species names recognized as species requirements
     */
    public LegacyPrerequisiteNormalizer(Collection<String> knownClasses, Collection<String> knownSpecies) {
        this.knownClasses = byLowerName(knownClasses);
        this.knownSpecies = byLowerName(knownSpecies);
    }

    /**
     * Normalize a free-text prerequisite into an AND set. Null or blank text yields an empty set.
     */
    public PrerequisiteSet normalize(String text) {
        return normalizeWithReport(text).prerequisites();
    }

    /**
     * Normalize and also report which segments were dropped as unrecognized.
     */
    public NormalizedPrerequisite normalizeWithReport(String text) {
        List<Condition> conditions = new ArrayList<>();
        List<String> dropped = new ArrayList<>();

        for (String segment : segments(text)) {
            Optional<Condition> condition = classifyPhrase(segment);
            if (condition.isPresent()) {
                conditions.add(condition.get());
            } else {
                log.debug("Dropping unrecognized prerequisite segment '{}' from '{}'", segment, text);
                dropped.add(segment);
            }
        }
        return new NormalizedPrerequisite(new PrerequisiteSet(conditions, CombinatorMode.ALL), dropped);
    }

    /**
     * Split text into AND segments.
     */
    public List<String> segments(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        List<String> result = new ArrayList<>();
        for (String part : SEGMENT_SPLIT.split(collapsed)) {
            String cleaned = part.trim().replaceAll("[.]+$", "").trim();
            if (!cleaned.isEmpty()) {
                result.add(cleaned);
            }
        }
        return result;
    }

    /**
     * Classify one segment, expanding OR phrases into an {@link AnyOf} group.
     */
    public Optional<Condition> classifyPhrase(String segment) {
        String[] alternatives = OR_SPLIT.split(segment);
        if (alternatives.length == 1) {
            return classify(segment);
        }
        List<Condition> options = new ArrayList<>();
        for (String alternative : alternatives) {
            Optional<Condition> option = classify(alternative.trim());
            if (option.isEmpty()) {
                return Optional.empty();
            }
            options.add(option.get());
        }
        return Optional.of(new AnyOf(options));
    }

    /**
     * Classify a single segment with no OR phrase.
     *
     * @return the recognized condition, or empty when no rule matches
     */
    public Optional<Condition> classify(String segment) {
        String text = segment.trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return match(text);
        } catch (NumberFormatException e) {
            // Numbers past int range read as unrecognized text
            return Optional.empty();
        }
    }

    private Optional<Condition> match(String text) {
        Matcher m = ABILITY.matcher(text);
        if (m.find()) {
            Ability ability = Ability.lookup(m.group(1)).orElseThrow();
            return Optional.of(new AbilityMinimum(ability, Integer.parseInt(m.group(2))));
        }

        m = BAB.matcher(text);
        if (m.find()) {
            String value = m.group(1) != null ? m.group(1) : m.group(2);
            return Optional.of(new AttackBonusMinimum(Integer.parseInt(value)));
        }

        m = CLASS_LEVEL.matcher(text);
        if (m.find()) {
            String className = knownClasses.get(m.group(1).trim().toLowerCase(Locale.ROOT));
            if (className != null) {
                return Optional.of(new ClassLevelMinimum(className, Integer.parseInt(m.group(2))));
            }
        }

        m = LEVEL.matcher(text);
        if (m.find()) {
            String value = m.group(1) != null ? m.group(1) : m.group(2);
            return Optional.of(new LevelMinimum(Integer.parseInt(value)));
        }

        m = SKILL_RANKS.matcher(text);
        if (m.find()) {
            return Optional.of(new SkillTrained(m.group(1).trim()));
        }

        m = TRAINED_IN.matcher(text);
        if (m.find()) {
            return Optional.of(new SkillTrained(m.group(1).trim()));
        }

        if (FORCE_SENSITIVE.matcher(text).find()) {
            return Optional.of(new ForceSensitive());
        }

        m = FORCE_TECHNIQUE.matcher(text);
        if (m.find()) {
            int count = m.group(1) != null ? Integer.parseInt(m.group(1)) : 1;
            return Optional.of(new ForceTechniqueKnown(count, null));
        }

        if (FORCE_SECRET.matcher(text).find()) {
            return Optional.of(ForceSecretKnown.anySecret());
        }

        if (NON_DROID.matcher(text).find()) {
            return Optional.of(DroidStatus.excluded());
        }
        m = DROID_DEGREE.matcher(text);
        if (m.find()) {
            return Optional.of(new DroidDegree(m.group(1)));
        }
        if (DROID.matcher(text).find()) {
            return Optional.of(DroidStatus.required());
        }

        m = WEAPON.matcher(text);
        if (m.find()) {
            WeaponTraining.Level level = WeaponTraining.Level.valueOf(m.group(1).toUpperCase(Locale.ROOT));
            return Optional.of(new WeaponTraining(level, m.group(2).trim()));
        }
        m = PROFICIENT_WITH.matcher(text);
        if (m.find()) {
            return Optional.of(new WeaponTraining(WeaponTraining.Level.PROFICIENCY, m.group(1).trim()));
        }
        m = ARMOR.matcher(text);
        if (m.find()) {
            return Optional.of(new ArmorProficiency(m.group(1).trim()));
        }

        m = DARK_SIDE.matcher(text);
        if (m.find()) {
            return Optional.of(new AlignmentScoreMinimum(Integer.parseInt(m.group(1))));
        }

        String species = knownSpecies.get(text.replaceAll("(?i)\\s+species$", "").toLowerCase(Locale.ROOT));
        if (species != null) {
            return Optional.of(SpeciesMatch.of(species));
        }

        if (FEATURE_NAME.matcher(text).matches() && text.split(" ").length <= MAX_FEATURE_NAME_WORDS) {
            return Optional.of(FeatureOwned.any(text));
        }

        return Optional.empty();
    }

    private static Map<String, String> byLowerName(Collection<String> names) {
        Map<String, String> result = new LinkedHashMap<>();
        if (names != null) {
            for (String name : names) {
                result.put(name.toLowerCase(Locale.ROOT), name);
            }
        }
        return result;
    }
}
