package com.hoopsbot.model;

/**
 * Which tier of the value chain produced a {@link ComparableValue}.
 */
public enum ValueSource {
    CATEGORY_SCORE,
    RANK_30D,
    RANK_14D,
    PLATFORM_RANK,
    NONE;

    public boolean isRankBased() {
        return this == RANK_30D || this == RANK_14D || this == PLATFORM_RANK;
    }
}
