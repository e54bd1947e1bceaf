package com.progression.snapshot;

import java.util.Locale;

/**
 * Skill name normalization shared by snapshots, conditions and content tables.
 * "Use the Force", "useTheForce" and "use the force" all map to "usetheforce";
 * every Knowledge specialty maps to "knowledge".
 */
public final class SkillNames {

    private SkillNames() {
    }

    public static String normalize(String skill) {
        if (skill == null) {
            return "";
        }
        String lower = skill.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("knowledge")) {
            return "knowledge";
        }
        return lower.replaceAll("[^a-z0-9]", "");
    }
}
