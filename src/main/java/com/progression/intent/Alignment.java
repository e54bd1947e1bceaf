package com.progression.intent;

/**
 * Whether a feature fits the inferred build direction, with a short explanation.
 */
public record Alignment(boolean aligned, String reason) {

    private static final Alignment NONE = new Alignment(false, null);

    public static Alignment none() {
        return NONE;
    }

    public static Alignment because(String reason) {
        return new Alignment(true, reason);
    }
}
