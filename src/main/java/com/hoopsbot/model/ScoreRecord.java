package com.hoopsbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One row of the external per-category scoring source. Ranks are 1-based, lower is better;
 * any field may be missing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScoreRecord {
    public final PlayerIdentity identity;
    public final Double categoryScore;
    public final Integer rank30d;
    public final Integer rank14d;

    public boolean hasCategoryScore() {
        return categoryScore != null && !categoryScore.isNaN();
    }
}
