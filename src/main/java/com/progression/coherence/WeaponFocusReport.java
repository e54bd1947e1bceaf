package com.progression.coherence;

/**
 * @param primaryFocus "ranged", "melee" or "force"; null when no combat feats are owned
 * @param spreadScore  0 when every combat feat shares one style, higher when spread out
 */
public record WeaponFocusReport(String primaryFocus, double spreadScore) {
}
