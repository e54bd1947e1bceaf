package com.progression.suggestion;

/**
 * Ranking outcome for one candidate.
 *
 * @param tier       Position on the tier ladder, higher is stronger
 * @param reasonCode Signal that decided the tier
 * @param sourceId   Pointer to the evidence, e.g. "chain:Point-Blank Shot"; may be null
 * @param confidence Fixed confidence for the tier
 * @param reason     Human-readable explanation, may be null
 */
public record Suggestion(double tier, ReasonCode reasonCode, String sourceId, double confidence, String reason) {

    public static Suggestion of(ReasonCode code, String sourceId, String reason) {
        return at(code.baseTier(), code, sourceId, reason);
    }

    public static Suggestion at(double tier, ReasonCode code, String sourceId, String reason) {
        return new Suggestion(tier, code, sourceId, TierConfidence.forTier(tier), reason);
    }

    public static Suggestion fallback() {
        return of(ReasonCode.FALLBACK, null, null);
    }
}
