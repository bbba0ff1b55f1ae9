package com.hoopsbot.model;

import java.util.Set;

/**
 * Coarse position group used for bench balance. A player belongs to the first group whose
 * positions it lists, checked C, then F, then G.
 */
public enum BenchCategory {
    G(Set.of("PG", "SG", "G")),
    F(Set.of("SF", "PF", "F")),
    C(Set.of("C"));

    private final Set<String> positions;

    BenchCategory(Set<String> positions) {
        this.positions = positions;
    }

    public static BenchCategory classify(PoolPlayer player) {
        if (player == null) {
            return null;
        }
        for (BenchCategory category : new BenchCategory[]{C, F, G}) {
            if (player.playsAny(category.positions)) {
                return category;
            }
        }
        return null;
    }
}
