package com.progression.suggestion;

/**
 * Semantic tag explaining which signal decided a suggestion's tier.
 */
public enum ReasonCode {

    // Feature ladder
    PRESTIGE_PREREQ(6),
    WISHLIST_PATH(5.5),
    MARTIAL_ARTS(5),
    META_SYNERGY(5),
    SPECIES_EARLY(4.5),
    CHAIN_CONTINUATION(4),
    MENTOR_BIAS(3.5),
    SKILL_PREREQ_MATCH(3),
    ABILITY_PREREQ_MATCH(2),
    CLASS_SYNERGY(1),

    // Class ladder
    PRESTIGE_NOW(5),
    PATH_CONTINUATION(4),
    PRESTIGE_SOON(3),
    MECHANICAL_SYNERGY(2),
    THEMATIC(1),

    // Not yet legal, only reported in future-availability mode
    FUTURE_AVAILABLE(0.6),

    FALLBACK(0);

    private final double baseTier;

    ReasonCode(double baseTier) {
        this.baseTier = baseTier;
    }

    /**
     * Tier this code is reported at. SPECIES_EARLY and FUTURE_AVAILABLE are scaled from it.
     */
    public double baseTier() {
        return baseTier;
    }
}
