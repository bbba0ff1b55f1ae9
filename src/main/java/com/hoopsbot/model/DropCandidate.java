package com.hoopsbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Bench player suggested as the roster spot to free when someone returns from IL.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DropCandidate {
    public final RosterPlayer player;
    public final Double categoryScore;
    public final Integer rank14d;
    public final boolean positionOverlap;
    public final String reason;
}
