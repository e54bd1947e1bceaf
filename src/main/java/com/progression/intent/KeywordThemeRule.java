package com.progression.intent;

import java.util.List;

/**
 * Adds {@code increment} to {@code theme} once per owned feat whose name contains any keyword.
 * Keywords are matched case-sensitively.
 */
public record KeywordThemeRule(List<String> keywords, String theme, double increment) {

    public KeywordThemeRule {
        keywords = List.copyOf(keywords);
    }

    public boolean matches(String featName) {
        for (String keyword : keywords) {
            if (featName.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
