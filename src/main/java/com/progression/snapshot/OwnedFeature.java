package com.progression.snapshot;

import java.util.List;
import java.util.Locale;

/**
 * A feat or talent held by a character.
 *
 * @param id          Stable identifier, may be null for hand-built snapshots
 * @param name        Display name
 * @param talentTree  Talent tree for talents, null for feats
 * @param tags        Free-form content tags
 * @param tradition   Force tradition the feature belongs to, if any
 */
public record OwnedFeature(String id, String name, String talentTree, List<String> tags, String tradition) {

    public OwnedFeature {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Owned feature requires a name");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static OwnedFeature feat(String name) {
        return new OwnedFeature(null, name, null, List.of(), null);
    }

    public static OwnedFeature talent(String name, String talentTree) {
        return new OwnedFeature(null, name, talentTree, List.of(), null);
    }

    public String lowerName() {
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * True when this feature is the one identified by the given id or name.
     */
    public boolean isSameAs(String idOrName) {
        if (idOrName == null) {
            return false;
        }
        return idOrName.equals(id) || name.equalsIgnoreCase(idOrName);
    }
}
