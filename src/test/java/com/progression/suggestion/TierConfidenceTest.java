package com.progression.suggestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TierConfidence.
 */
class TierConfidenceTest {

    @ParameterizedTest
    @DisplayName("Should look up the confidence of the nearest whole tier")
    @CsvSource({
            "6, 0.95",
            "5.5, 0.85",
            "5, 0.85",
            "4.5, 0.75",
            "4, 0.75",
            "3.5, 0.60",
            "3, 0.60",
            "2, 0.50",
            "1, 0.40",
            "0, 0.20",
            "0.6, 0.40",
            "0.2, 0.20",
            "7, 0.95",
            "-1, 0.20"
    })
    void shouldLookUpConfidence(double tier, double expected) {
        assertEquals(expected, TierConfidence.forTier(tier), 1e-9);
    }
}
