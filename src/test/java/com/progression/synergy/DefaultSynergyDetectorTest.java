package com.progression.synergy;

import com.progression.condition.FeatureOwned;
import com.progression.config.TriggerExpressionParser;
import com.progression.snapshot.CharacterSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultSynergyDetector.
 */
class DefaultSynergyDetectorTest {

    private SynergyRule pinToCrush;
    private SynergyRule shotChain;
    private SynergyRule dualWield;
    private CharacterSnapshot brawler;

    @BeforeEach
    void setUp() {
        pinToCrush = rule("pin_to_crush", "melee", "HAS_FEAT('Pin') AND NOT HAS_TALENT('Crush')",
                SynergyPriority.CRITICAL, suggestion("Crush", SuggestionKind.TALENT));
        shotChain = rule("shot_chain", "ranged", "HAS_FEAT('Point-Blank Shot')",
                SynergyPriority.LOW, suggestion("Precise Shot", SuggestionKind.FEAT));
        dualWield = rule("dual_wield", "melee", "HAS_FEAT('Point-Blank Shot') OR HAS_FEAT('Pin')",
                SynergyPriority.LOW, suggestion("Dual Weapon Mastery I", SuggestionKind.FEAT));

        brawler = CharacterSnapshot.builder()
                .characterId("brawler")
                .feat("Pin")
                .feat("Point-Blank Shot")
                .build();
    }

    // =====================================================================
    // Detection
    // =====================================================================

    @Test
    @DisplayName("Should activate a rule whose trigger holds")
    void shouldActivateMatchingRule() {
        SynergyDetector detector = new DefaultSynergyDetector(List.of(pinToCrush), Map.of());

        List<ActiveSynergy> active = detector.findActiveSynergies(brawler);

        assertEquals(1, active.size());
        assertEquals("pin_to_crush", active.get(0).id());
        assertEquals(1.0, active.get(0).weight(), 1e-9);
    }

    @Test
    @DisplayName("Should deactivate a rule once its follow-up is owned")
    void shouldDeactivateWhenFollowUpOwned() {
        SynergyDetector detector = new DefaultSynergyDetector(List.of(pinToCrush), Map.of());
        CharacterSnapshot crusher = brawler.toBuilder().talent("Crush", "Brawler").build();

        assertTrue(detector.findActiveSynergies(crusher).isEmpty());
    }

    @Test
    @DisplayName("Should order by priority, then by archetype emphasis")
    void shouldOrderByPriorityThenWeight() {
        SynergyDetector detector = new DefaultSynergyDetector(
                List.of(shotChain, dualWield, pinToCrush), Map.of("melee", 1.5, "ranged", 0.8));

        List<ActiveSynergy> active = detector.findActiveSynergies(brawler);

        assertEquals(List.of("pin_to_crush", "dual_wield", "shot_chain"),
                active.stream().map(ActiveSynergy::id).toList());
        assertEquals(0.8, active.get(2).weight(), 1e-9);
    }

    @Test
    @DisplayName("Should weigh rules without an archetype at the default emphasis")
    void shouldDefaultMissingArchetype() {
        SynergyRule untagged = rule("untagged", null, "HAS_FEAT('Pin')",
                SynergyPriority.MEDIUM, suggestion("Crush", SuggestionKind.TALENT));
        SynergyDetector detector = new DefaultSynergyDetector(List.of(untagged), Map.of("melee", 2.0));

        List<ActiveSynergy> active = detector.findActiveSynergies(brawler);

        assertEquals(1, active.size());
        assertEquals(1.0, active.get(0).weight(), 1e-9);
    }

    @Test
    @DisplayName("Should skip a rule whose trigger fails and keep evaluating the rest")
    void shouldIsolateFailingRule() {
        SynergyRule broken = new SynergyRule("broken", "Broken", "melee", new FeatureOwned("Pin", null),
                SynergyPriority.CRITICAL, List.of(suggestion("Crush", SuggestionKind.TALENT)));
        SynergyDetector detector = new DefaultSynergyDetector(List.of(broken, shotChain), null);

        List<ActiveSynergy> active = detector.findActiveSynergies(brawler);

        assertEquals(List.of("shot_chain"), active.stream().map(ActiveSynergy::id).toList());
    }

    @Test
    @DisplayName("Should return nothing for an empty rule table")
    void shouldHandleEmptyRules() {
        SynergyDetector detector = new DefaultSynergyDetector(List.of(), Map.of());

        assertTrue(detector.findActiveSynergies(brawler).isEmpty());
        assertTrue(detector.getRules().isEmpty());
    }

    // =====================================================================
    // Item lookup
    // =====================================================================

    @Test
    @DisplayName("Should find the synergy recommending an item, ignoring case")
    void shouldFindSynergyForItem() {
        SynergyDetector detector = new DefaultSynergyDetector(List.of(shotChain, pinToCrush), Map.of());

        SynergyMatch match = detector.getSynergyForItem("crush", SuggestionKind.TALENT, brawler).orElseThrow();

        assertEquals("pin_to_crush", match.ruleId());
        assertEquals("Crush", match.suggestion().name());
    }

    @Test
    @DisplayName("Should not match an item of a different kind")
    void shouldRespectSuggestionKind() {
        SynergyDetector detector = new DefaultSynergyDetector(List.of(pinToCrush), Map.of());

        assertTrue(detector.getSynergyForItem("Crush", SuggestionKind.FEAT, brawler).isEmpty());
        assertTrue(detector.getSynergyForItem(null, SuggestionKind.TALENT, brawler).isEmpty());
        assertTrue(detector.getSynergyForItem("Crush", null, brawler).isEmpty());
    }

    // Helper methods

    private static SynergyRule rule(String id, String archetype, String trigger,
                                    SynergyPriority priority, SynergySuggestion suggestion) {
        return new SynergyRule(id, id, archetype, TriggerExpressionParser.parse(trigger), priority, List.of(suggestion));
    }

    private static SynergySuggestion suggestion(String name, SuggestionKind kind) {
        return new SynergySuggestion(name, kind, "Follows up on your build", SynergyPriority.HIGH);
    }
}
