package com.hoopsbot.model;

import java.util.Collection;
import java.util.Set;

/**
 * Common read view over roster players and free agents.
 */
public interface PoolPlayer {

    PlayerIdentity getIdentity();

    Set<String> getEligiblePositions();

    ScoreRecord getScoreRecord();

    Integer getPlatformRank();

    String getTeam();

    String getInjuryStatus();

    int getGamesRemainingThisWeek();

    boolean isUntouchable();

    default String displayName() {
        return getIdentity().displayName;
    }

    default String key() {
        return getIdentity().normalizedKey;
    }

    default Double categoryScore() {
        ScoreRecord record = getScoreRecord();
        return record != null && record.hasCategoryScore() ? record.categoryScore : null;
    }

    /**
     * True when the player lists at least one of the accepted positions. An empty
     * collection accepts every position.
     */
    default boolean playsAny(Collection<String> accepted) {
        if (accepted == null || accepted.isEmpty()) {
            return true;
        }
        for (String position : getEligiblePositions()) {
            if (accepted.contains(position)) {
                return true;
            }
        }
        return false;
    }
}
