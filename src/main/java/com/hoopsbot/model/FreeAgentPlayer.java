package com.hoopsbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class FreeAgentPlayer implements PoolPlayer {
    public final PlayerIdentity identity;
    public final Set<String> eligiblePositions;
    public final ScoreRecord scoreRecord;
    public final Integer platformRank;
    public final int gamesRemainingThisWeek;
    public final String team;
    public final String injuryStatus;
    public final Double minutesPerGame;
    public final Integer gamesLast30;

    @Override
    public boolean isUntouchable() {
        return false;
    }

    public FreeAgentPlayer withScoreRecord(ScoreRecord record) {
        return toBuilder().scoreRecord(record).build();
    }
}
