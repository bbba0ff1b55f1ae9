package com.hoopsbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RosterPlayer implements PoolPlayer {
    public final PlayerIdentity identity;
    public final Set<String> eligiblePositions;
    public final RosterStatus currentStatus;
    public final boolean untouchable;
    public final ScoreRecord scoreRecord;
    public final String team;
    public final String injuryStatus;
    public final Integer platformRank;
    public final int gamesRemainingThisWeek;
    public final Boolean gameToday;

    /**
     * True when the player's team plays today. An unknown schedule counts as playing.
     */
    public boolean playsToday() {
        return gameToday == null || gameToday;
    }

    public RosterPlayer withScoreRecord(ScoreRecord record) {
        return toBuilder().scoreRecord(record).build();
    }
}
