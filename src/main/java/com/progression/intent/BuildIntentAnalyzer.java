package com.progression.intent;

import com.progression.snapshot.CharacterSnapshot;
import com.progression.snapshot.PendingSelections;

/**
 * Infers a character's build direction from what it already owns.
 */
public interface BuildIntentAnalyzer {

    /**
     * Analyze a character with its in-progress selections merged in.
     *
     * @param snapshot Committed character state
     * @param pending  Selections made this session, may be null
     * @return Inferred intent, never null
     */
    BuildIntent analyze(CharacterSnapshot snapshot, PendingSelections pending);

    /**
     * Whether a feat fits the inferred intent.
     */
    Alignment checkFeatAlignment(String featName, BuildIntent intent);

    /**
     * Whether a talent from the given tree fits the inferred intent.
     */
    Alignment checkTalentAlignment(String talentName, String treeName, BuildIntent intent);

    /**
     * Short explanation of why a prestige class suits the build, or null when the affinity is too weak.
     */
    String prestigeRecommendationReason(String className, BuildIntent intent);
}
