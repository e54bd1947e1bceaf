package com.progression.snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of a character, built once per request from the character store.
 * All name sets are lowercased; skill keys are normalized through {@link SkillNames}.
 */
public final class CharacterSnapshot {

    static final int DEFAULT_ABILITY_SCORE = 10;

    private final String characterId;
    private final List<OwnedFeature> feats;
    private final List<OwnedFeature> talents;
    private final Set<String> featNames;
    private final Set<String> talentNames;
    private final Set<String> ownedPrerequisiteNames;
    private final Set<String> talentTrees;
    private final Set<String> trainedSkills;
    private final Map<Ability, Integer> abilityScores;
    private final Ability highestAbility;
    private final Map<String, Integer> classLevels;
    private final String species;
    private final Set<String> speciesTraits;
    private final int characterLevel;
    private final int baseAttackBonus;
    private final int darkSideScore;
    private final boolean droid;
    private final String droidDegree;
    private final List<ForcePower> forcePowers;
    private final List<ForceTechnique> forceTechniques;
    private final List<String> forceSecrets;
    private final String archetype;
    private final Map<String, Double> mentorBiases;

    private CharacterSnapshot(Builder builder) {
        this.characterId = builder.characterId;
        this.feats = List.copyOf(builder.feats);
        this.talents = List.copyOf(builder.talents);
        this.featNames = lowerNames(feats);
        this.talentNames = lowerNames(talents);

        Set<String> owned = new LinkedHashSet<>(featNames);
        owned.addAll(talentNames);
        this.ownedPrerequisiteNames = Collections.unmodifiableSet(owned);

        Set<String> trees = new LinkedHashSet<>();
        for (OwnedFeature talent : talents) {
            if (talent.talentTree() != null) {
                trees.add(talent.talentTree().toLowerCase(Locale.ROOT));
            }
        }
        for (String tree : builder.talentTrees) {
            trees.add(tree.toLowerCase(Locale.ROOT));
        }
        this.talentTrees = Collections.unmodifiableSet(trees);

        Set<String> skills = new LinkedHashSet<>();
        for (String skill : builder.trainedSkills) {
            skills.add(SkillNames.normalize(skill));
        }
        this.trainedSkills = Collections.unmodifiableSet(skills);

        EnumMap<Ability, Integer> scores = new EnumMap<>(Ability.class);
        for (Ability ability : Ability.values()) {
            scores.put(ability, builder.abilityScores.getOrDefault(ability, DEFAULT_ABILITY_SCORE));
        }
        this.abilityScores = Collections.unmodifiableMap(scores);
        this.highestAbility = findHighest(scores);

        this.classLevels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.classLevels));
        this.species = builder.species;

        Set<String> traits = new LinkedHashSet<>();
        for (String trait : builder.speciesTraits) {
            traits.add(trait.toLowerCase(Locale.ROOT));
        }
        this.speciesTraits = Collections.unmodifiableSet(traits);

        int levelFromClasses = builder.classLevels.values().stream().mapToInt(Integer::intValue).sum();
        this.characterLevel = builder.characterLevel > 0
                ? builder.characterLevel
                : Math.max(1, levelFromClasses);
        this.baseAttackBonus = builder.baseAttackBonus;
        this.darkSideScore = builder.darkSideScore;
        this.droid = builder.droid;
        this.droidDegree = builder.droidDegree;
        this.forcePowers = List.copyOf(builder.forcePowers);
        this.forceTechniques = List.copyOf(builder.forceTechniques);
        this.forceSecrets = List.copyOf(builder.forceSecrets);
        this.archetype = builder.archetype;
        this.mentorBiases = Collections.unmodifiableMap(new LinkedHashMap<>(builder.mentorBiases));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copy this snapshot into a new builder.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .characterId(characterId)
                .species(species)
                .characterLevel(characterLevel)
                .baseAttackBonus(baseAttackBonus)
                .darkSideScore(darkSideScore)
                .droid(droid)
                .droidDegree(droidDegree)
                .archetype(archetype);
        feats.forEach(builder::feat);
        talents.forEach(builder::talent);
        talentTrees.forEach(builder::talentTree);
        trainedSkills.forEach(builder::trainedSkill);
        abilityScores.forEach(builder::ability);
        classLevels.forEach(builder::classLevel);
        speciesTraits.forEach(builder::speciesTrait);
        forcePowers.forEach(builder::forcePower);
        forceTechniques.forEach(builder::forceTechnique);
        forceSecrets.forEach(builder::forceSecret);
        mentorBiases.forEach(builder::mentorBias);
        return builder;
    }

    /**
     * Merge in-progress selections into a new snapshot. The pending class gains one level;
     * pending mentor answers override stored ones.
     */
    public CharacterSnapshot withPending(PendingSelections pending) {
        if (pending == null || pending.isEmpty()) {
            return this;
        }
        Builder builder = toBuilder();
        pending.feats().forEach(builder::feat);
        pending.talents().forEach(builder::talent);
        pending.skills().forEach(builder::trainedSkill);
        if (pending.selectedClass() != null && !pending.selectedClass().isBlank()) {
            String existing = findClassKey(pending.selectedClass());
            String key = existing != null ? existing : pending.selectedClass();
            builder.classLevel(key, classLevels.getOrDefault(key, 0) + 1);
        }
        pending.mentorBiases().forEach(builder::mentorBias);
        return builder.build();
    }

    // ====================================================================================
    // Queries
    // ====================================================================================

    public boolean hasFeat(String name) {
        return name != null && featNames.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean hasTalent(String name) {
        return name != null && talentNames.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * True when a feat or talent of this name is owned.
     */
    public boolean ownsFeature(String name) {
        return name != null && ownedPrerequisiteNames.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean hasTrainedSkill(String skill) {
        return trainedSkills.contains(SkillNames.normalize(skill));
    }

    public boolean hasTalentTree(String tree) {
        return tree != null && talentTrees.contains(tree.toLowerCase(Locale.ROOT));
    }

    public boolean hasClass(String className) {
        return findClassKey(className) != null;
    }

    public int classLevel(String className) {
        String key = findClassKey(className);
        return key == null ? 0 : classLevels.get(key);
    }

    public int abilityScore(Ability ability) {
        return abilityScores.get(ability);
    }

    /**
     * Count owned talents in a tree, excluding the talent identified by {@code excludeIdOrName}.
     */
    public int talentsInTree(String tree, String excludeIdOrName) {
        int count = 0;
        for (OwnedFeature talent : talents) {
            if (talent.talentTree() != null
                    && talent.talentTree().equalsIgnoreCase(tree)
                    && !talent.isSameAs(excludeIdOrName)) {
                count++;
            }
        }
        return count;
    }

    private String findClassKey(String className) {
        if (className == null) {
            return null;
        }
        for (String key : classLevels.keySet()) {
            if (key.equalsIgnoreCase(className)) {
                return key;
            }
        }
        return null;
    }

    // ====================================================================================
    // Accessors
    // ====================================================================================

    public String getCharacterId() {
        return characterId;
    }

    public List<OwnedFeature> getFeats() {
        return feats;
    }

    public List<OwnedFeature> getTalents() {
        return talents;
    }

    public Set<String> getFeatNames() {
        return featNames;
    }

    public Set<String> getTalentNames() {
        return talentNames;
    }

    /**
     * Lowercased union of owned feat and talent names.
     */
    public Set<String> getOwnedPrerequisiteNames() {
        return ownedPrerequisiteNames;
    }

    public Set<String> getTalentTrees() {
        return talentTrees;
    }

    public Set<String> getTrainedSkills() {
        return trainedSkills;
    }

    public Map<Ability, Integer> getAbilityScores() {
        return abilityScores;
    }

    public Ability getHighestAbility() {
        return highestAbility;
    }

    public Map<String, Integer> getClassLevels() {
        return classLevels;
    }

    public String getSpecies() {
        return species;
    }

    public Set<String> getSpeciesTraits() {
        return speciesTraits;
    }

    public int getCharacterLevel() {
        return characterLevel;
    }

    public int getBaseAttackBonus() {
        return baseAttackBonus;
    }

    public int getDarkSideScore() {
        return darkSideScore;
    }

    public boolean isDroid() {
        return droid;
    }

    public String getDroidDegree() {
        return droidDegree;
    }

    public List<ForcePower> getForcePowers() {
        return forcePowers;
    }

    public List<ForceTechnique> getForceTechniques() {
        return forceTechniques;
    }

    public List<String> getForceSecrets() {
        return forceSecrets;
    }

    public String getArchetype() {
        return archetype;
    }

    public Map<String, Double> getMentorBiases() {
        return mentorBiases;
    }

    @Override
    public String toString() {
        return "CharacterSnapshot{" +
                "characterId='" + characterId + '\'' +
                ", level=" + characterLevel +
                ", classes=" + classLevels +
                ", feats=" + featNames.size() +
                ", talents=" + talentNames.size() +
                '}';
    }

    private static Set<String> lowerNames(List<OwnedFeature> features) {
        Set<String> names = new LinkedHashSet<>();
        for (OwnedFeature feature : features) {
            names.add(feature.lowerName());
        }
        return Collections.unmodifiableSet(names);
    }

    private static Ability findHighest(Map<Ability, Integer> scores) {
        Ability highest = Ability.STR;
        int best = scores.get(Ability.STR);
        for (Ability ability : Ability.values()) {
            int score = scores.get(ability);
            if (score > best) {
                best = score;
                highest = ability;
            }
        }
        return highest;
    }

    /**
     * Builder for CharacterSnapshot.
     */
    public static final class Builder {
        private String characterId;
        private final List<OwnedFeature> feats = new ArrayList<>();
        private final List<OwnedFeature> talents = new ArrayList<>();
        private final List<String> talentTrees = new ArrayList<>();
        private final List<String> trainedSkills = new ArrayList<>();
        private final Map<Ability, Integer> abilityScores = new EnumMap<>(Ability.class);
        private final Map<String, Integer> classLevels = new LinkedHashMap<>();
        private String species;
        private final List<String> speciesTraits = new ArrayList<>();
        private int characterLevel;
        private int baseAttackBonus;
        private int darkSideScore;
        private boolean droid;
        private String droidDegree;
        private final List<ForcePower> forcePowers = new ArrayList<>();
        private final List<ForceTechnique> forceTechniques = new ArrayList<>();
        private final List<String> forceSecrets = new ArrayList<>();
        private String archetype;
        private final Map<String, Double> mentorBiases = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder characterId(String characterId) {
            this.characterId = characterId;
            return this;
        }

        public Builder feat(String name) {
            return feat(OwnedFeature.feat(name));
        }

        public Builder feat(OwnedFeature feat) {
            this.feats.add(feat);
            return this;
        }

        public Builder talent(String name, String talentTree) {
            return talent(OwnedFeature.talent(name, talentTree));
        }

        public Builder talent(OwnedFeature talent) {
            this.talents.add(talent);
            return this;
        }

        public Builder talentTree(String tree) {
            this.talentTrees.add(tree);
            return this;
        }

        public Builder trainedSkill(String skill) {
            this.trainedSkills.add(skill);
            return this;
        }

        public Builder ability(Ability ability, int score) {
            this.abilityScores.put(ability, score);
            return this;
        }

        public Builder classLevel(String className, int level) {
            this.classLevels.put(className, level);
            return this;
        }

        public Builder species(String species) {
            this.species = species;
            return this;
        }

        public Builder speciesTrait(String trait) {
            this.speciesTraits.add(trait);
            return this;
        }

        /**
         * Explicit character level. When unset or zero, the sum of class levels is used.
         */
        public Builder characterLevel(int characterLevel) {
            this.characterLevel = characterLevel;
            return this;
        }

        public Builder baseAttackBonus(int baseAttackBonus) {
            this.baseAttackBonus = baseAttackBonus;
            return this;
        }

        public Builder darkSideScore(int darkSideScore) {
            this.darkSideScore = darkSideScore;
            return this;
        }

        public Builder droid(boolean droid) {
            this.droid = droid;
            return this;
        }

        public Builder droidDegree(String droidDegree) {
            this.droidDegree = droidDegree;
            return this;
        }

        public Builder forcePower(ForcePower power) {
            this.forcePowers.add(power);
            return this;
        }

        public Builder forceTechnique(ForceTechnique technique) {
            this.forceTechniques.add(technique);
            return this;
        }

        public Builder forceSecret(String secret) {
            this.forceSecrets.add(secret);
            return this;
        }

        public Builder archetype(String archetype) {
            this.archetype = archetype;
            return this;
        }

        public Builder mentorBias(String dimension, double weight) {
            this.mentorBiases.put(dimension, weight);
            return this;
        }

        public CharacterSnapshot build() {
            return new CharacterSnapshot(this);
        }
    }
}
