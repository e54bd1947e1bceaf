package com.progression.config;

import com.progression.exception.ConfigurationException;
import com.progression.intent.PrestigeSignals;
import com.progression.prerequisite.TalentTreeAccessRule;
import com.progression.snapshot.Ability;
import com.progression.synergy.SuggestionKind;
import com.progression.synergy.SynergyPriority;
import com.progression.synergy.SynergyRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ContentLoader.
 */
class ContentLoaderTest {

    // =====================================================================
    // Bundled content
    // =====================================================================

    @Test
    @DisplayName("Should load the bundled content tables")
    void shouldLoadBundledContent() {
        ContentTables tables = ContentLoader.load(ContentLoader.DEFAULT_PATH);

        assertEquals(23, tables.prestigeSignals().size());
        assertFalse(tables.classProfiles().isEmpty());
        assertFalse(tables.synergyRules().isEmpty());
        assertTrue(tables.knownClasses().contains("Jedi"));
        assertTrue(tables.knownSpecies().contains("Zabrak"));
        assertEquals(0.4, tables.tuning().prestigeTalentConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Should parse the pin_to_crush synergy rule from bundled content")
    void shouldParseBundledSynergyRule() {
        ContentTables tables = ContentLoader.load(ContentLoader.DEFAULT_PATH);

        SynergyRule rule = tables.synergyRules().stream()
                .filter(r -> r.id().equals("pin_to_crush"))
                .findFirst()
                .orElseThrow();

        assertEquals(SynergyPriority.CRITICAL, rule.priority());
        assertEquals("Crush", rule.suggestions().get(0).name());
        assertEquals(SuggestionKind.TALENT, rule.suggestions().get(0).kind());
    }

    @Test
    @DisplayName("Should parse tradition tree access from bundled content")
    void shouldParseBundledTreeAccess() {
        ContentTables tables = ContentLoader.load(ContentLoader.DEFAULT_PATH);

        TalentTreeAccessRule rule = tables.treeAccessRules().get("Sith Alchemy").get(0);

        assertEquals(TalentTreeAccessRule.Type.FORCE_TRADITION, rule.type());
        assertEquals("Sith", rule.tradition());
    }

    // =====================================================================
    // Test content
    // =====================================================================

    @Test
    @DisplayName("Should load a content file from the test classpath")
    void shouldLoadTestContent() {
        ContentTables tables = ContentLoader.load("classpath:progression/test-content.yaml");

        PrestigeSignals gunslinger = tables.prestigeSignals().get(0);
        assertEquals("Gunslinger", gunslinger.className());
        assertEquals(2, gunslinger.maxScore());
        assertEquals(4.0, tables.tuning().speciesHalfLife(), 1e-9);
        assertEquals(0.2, tables.tuning().primaryThemeThreshold(), 1e-9);
        assertEquals("ranged", tables.themeSignals().featTheme("Precise Shot"));
        assertEquals(List.of("shot"), tables.coherenceTables().madKeywords().get(Ability.DEX));
        assertEquals(List.of("Soldier"), tables.knownClasses());
    }

    @Test
    @DisplayName("Should default missing sections to empty tables")
    void shouldDefaultMissingSections() {
        ContentTables tables = parse("progression:\n  known-species: [Human]\n");

        assertTrue(tables.prestigeSignals().isEmpty());
        assertTrue(tables.synergyRules().isEmpty());
        assertTrue(tables.treeAccessRules().isEmpty());
        assertEquals(List.of("Human"), tables.knownSpecies());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("Should reject an empty content file")
    void shouldRejectEmptyFile() {
        assertThrows(ConfigurationException.class, () -> parse(""));
    }

    @Test
    @DisplayName("Should reject a missing file")
    void shouldRejectMissingFile() {
        assertThrows(ConfigurationException.class, () -> ContentLoader.load("classpath:progression/missing.yaml"));
    }

    @Test
    @DisplayName("Should name the rule whose trigger does not parse")
    void shouldRejectInvalidTrigger() {
        String yaml = """
                synergy:
                  rules:
                    - id: broken
                      trigger: HAS_FEAT("Pin") AND
                      suggestions:
                        - {name: Crush, type: talent}
                """;

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse(yaml));
        assertTrue(e.getMessage().contains("broken"));
    }

    @Test
    @DisplayName("Should reject a synergy rule without suggestions")
    void shouldRejectRuleWithoutSuggestions() {
        String yaml = """
                synergy:
                  rules:
                    - id: empty
                      trigger: HAS_FEAT("Pin")
                """;

        assertThrows(ConfigurationException.class, () -> parse(yaml));
    }

    @Test
    @DisplayName("Should reject a tradition access rule without a tradition")
    void shouldRejectTraditionWithoutName() {
        String yaml = """
                talent-tree-access:
                  Sith Alchemy:
                    - type: force-tradition
                """;

        assertThrows(ConfigurationException.class, () -> parse(yaml));
    }

    @Test
    @DisplayName("Should reject unknown abilities and malformed numbers")
    void shouldRejectMalformedValues() {
        assertThrows(ConfigurationException.class, () -> parse("""
                class-profiles:
                  Soldier:
                    abilities: [luck]
                """));
        assertThrows(ConfigurationException.class, () -> parse("""
                tuning:
                  species-half-life: forever
                """));
        assertThrows(ConfigurationException.class, () -> parse("""
                prestige-signals: [Gunslinger]
                """));
    }

    private static ContentTables parse(String yaml) {
        return ContentLoader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }
}
