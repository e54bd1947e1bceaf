package com.progression.suggestion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MentorBiasKeywords.
 */
class MentorBiasKeywordsTest {

    private MentorBiasKeywords keywords;

    @BeforeEach
    void setUp() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("Stealth", List.of("Sneak", "shadow"));
        table.put("ranged", List.of("shot"));
        keywords = new MentorBiasKeywords(table);
    }

    @Test
    @DisplayName("Should resolve a declared build bias first")
    void shouldPreferDeclaredBias() {
        Candidate candidate = Candidate.feat("Sneak Shot").buildBias("RANGED").build();

        assertEquals(Optional.of("ranged"), keywords.resolve(candidate, dimension -> true));
    }

    @Test
    @DisplayName("Should resolve a tag naming a dimension before name keywords")
    void shouldResolveTag() {
        Candidate candidate = Candidate.feat("Sneak Shot").tags(List.of("Ranged")).build();

        assertEquals(Optional.of("ranged"), keywords.resolve(candidate, dimension -> true));
    }

    @Test
    @DisplayName("Should resolve name keywords in dimension order")
    void shouldResolveNameKeyword() {
        Candidate candidate = Candidate.feat("Sneak Shot").build();

        assertEquals(Optional.of("stealth"), keywords.resolve(candidate, dimension -> true));
        assertEquals(Optional.of("ranged"), keywords.resolve(candidate, "ranged"::equals));
    }

    @Test
    @DisplayName("Should skip inactive dimensions")
    void shouldSkipInactiveDimensions() {
        Candidate candidate = Candidate.feat("Shadow Striker").buildBias("stealth").build();

        assertTrue(keywords.resolve(candidate, dimension -> false).isEmpty());
        assertTrue(MentorBiasKeywords.empty().resolve(candidate, dimension -> true).isEmpty());
    }
}
