package com.progression.suggestion;

import com.progression.prerequisite.PrerequisiteSet;
import com.progression.prerequisite.legacy.LegacyPrerequisiteNormalizer;

import java.util.List;
import java.util.Objects;

/**
 * A feat, talent or class offered for ranking, as supplied by the content catalog.
 * <p>
 * Prerequisites are either a structured {@link PrerequisiteSet} or a legacy free-text string;
 * the structured form wins when both are present.
 */
public final class Candidate {

    public static final String FEAT_TYPE_MARTIAL_ARTS = "martial_arts";
    public static final String FEAT_TYPE_SPECIES = "species";

    private final String id;
    private final String name;
    private final CandidateKind kind;
    private final String featType;
    private final String talentTree;
    private final PrerequisiteSet prerequisites;
    private final String legacyPrerequisite;
    private final String prerequisiteFeature;
    private final List<String> bonusFeatFor;
    private final List<String> tags;
    private final String buildBias;
    private final ClassCategory classCategory;
    private final List<String> otherRequirements;

    private Candidate(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name");
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.featType = builder.featType;
        this.talentTree = builder.talentTree;
        this.prerequisites = builder.prerequisites;
        this.legacyPrerequisite = builder.legacyPrerequisite;
        this.prerequisiteFeature = builder.prerequisiteFeature;
        this.bonusFeatFor = List.copyOf(builder.bonusFeatFor);
        this.tags = List.copyOf(builder.tags);
        this.buildBias = builder.buildBias;
        this.classCategory = builder.classCategory;
        this.otherRequirements = List.copyOf(builder.otherRequirements);
    }

    public static Builder feat(String name) {
        return new Builder(name, CandidateKind.FEAT);
    }

    public static Builder talent(String name, String talentTree) {
        return new Builder(name, CandidateKind.TALENT).talentTree(talentTree);
    }

    public static Builder characterClass(String name, ClassCategory category) {
        return new Builder(name, CandidateKind.CLASS).classCategory(category);
    }

    public static Builder builder(String name, CandidateKind kind) {
        return new Builder(name, kind);
    }

    /**
     * Structured prerequisites, or the legacy text run through the normalizer.
     */
    public PrerequisiteSet effectivePrerequisites(LegacyPrerequisiteNormalizer normalizer) {
        if (prerequisites != null && !prerequisites.isEmpty()) {
            return prerequisites;
        }
        if (legacyPrerequisite != null && !legacyPrerequisite.isBlank() && normalizer != null) {
            return normalizer.normalize(legacyPrerequisite);
        }
        return PrerequisiteSet.none();
    }

    /**
     * Identifier used for self-exclusion in tree counts and for wishlist pointers.
     */
    public String idOrName() {
        return id != null ? id : name;
    }

    public boolean isFeat() {
        return kind == CandidateKind.FEAT;
    }

    public boolean isTalent() {
        return kind == CandidateKind.TALENT;
    }

    public boolean isPrestige() {
        return classCategory == ClassCategory.PRESTIGE;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public CandidateKind getKind() {
        return kind;
    }

    public String getFeatType() {
        return featType;
    }

    public String getTalentTree() {
        return talentTree;
    }

    public PrerequisiteSet getPrerequisites() {
        return prerequisites;
    }

    public String getLegacyPrerequisite() {
        return legacyPrerequisite;
    }

    public String getPrerequisiteFeature() {
        return prerequisiteFeature;
    }

    public List<String> getBonusFeatFor() {
        return bonusFeatFor;
    }

    public List<String> getTags() {
        return tags;
    }

    public String getBuildBias() {
        return buildBias;
    }

    public ClassCategory getClassCategory() {
        return classCategory;
    }

    /**
     * Class requirements the engine cannot verify, e.g. "Must have built a lightsaber".
     */
    public List<String> getOtherRequirements() {
        return otherRequirements;
    }

    @Override
    public String toString() {
        return kind + ":" + name;
    }

    public static final class Builder {
        private String id;
        private final String name;
        private final CandidateKind kind;
        private String featType;
        private String talentTree;
        private PrerequisiteSet prerequisites;
        private String legacyPrerequisite;
        private String prerequisiteFeature;
        private List<String> bonusFeatFor = List.of();
        private List<String> tags = List.of();
        private String buildBias;
        private ClassCategory classCategory = ClassCategory.BASE;
        private List<String> otherRequirements = List.of();

        private Builder(String name, CandidateKind kind) {
            this.name = name;
            this.kind = kind;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder featType(String featType) {
            this.featType = featType;
            return this;
        }

        public Builder talentTree(String talentTree) {
            this.talentTree = talentTree;
            return this;
        }

        public Builder prerequisites(PrerequisiteSet prerequisites) {
            this.prerequisites = prerequisites;
            return this;
        }

        public Builder legacyPrerequisite(String legacyPrerequisite) {
            this.legacyPrerequisite = legacyPrerequisite;
            return this;
        }

        public Builder prerequisiteFeature(String prerequisiteFeature) {
            this.prerequisiteFeature = prerequisiteFeature;
            return this;
        }

        public Builder bonusFeatFor(List<String> bonusFeatFor) {
            this.bonusFeatFor = bonusFeatFor == null ? List.of() : bonusFeatFor;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags == null ? List.of() : tags;
            return this;
        }

        public Builder buildBias(String buildBias) {
            this.buildBias = buildBias;
            return this;
        }

        public Builder classCategory(ClassCategory classCategory) {
            this.classCategory = classCategory == null ? ClassCategory.BASE : classCategory;
            return this;
        }

        public Builder otherRequirements(List<String> otherRequirements) {
            this.otherRequirements = otherRequirements == null ? List.of() : otherRequirements;
            return this;
        }

        public Candidate build() {
            return new Candidate(this);
        }
    }
}
