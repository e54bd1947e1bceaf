package com.progression.suggestion;

import java.util.List;

/**
 * Per-call ranking switches.
 *
 * @param futureAvailability Score illegal candidates by how soon they become legal instead of dropping them
 * @param wishlist           Player-designated goal items
 */
public record RankingOptions(boolean futureAvailability, List<Candidate> wishlist) {

    private static final RankingOptions DEFAULTS = new RankingOptions(false, List.of());

    public RankingOptions {
        wishlist = wishlist == null ? List.of() : List.copyOf(wishlist);
    }

    public static RankingOptions defaults() {
        return DEFAULTS;
    }

    public RankingOptions withFutureAvailability(boolean enabled) {
        return new RankingOptions(enabled, wishlist);
    }

    public RankingOptions withWishlist(List<Candidate> items) {
        return new RankingOptions(futureAvailability, items);
    }
}
