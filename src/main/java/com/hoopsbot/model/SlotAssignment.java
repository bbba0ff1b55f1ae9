package com.hoopsbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * One slot of the lineup and its occupant. {@code player} is null for an empty active slot;
 * {@code phase} is null for BN and IL slots.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class SlotAssignment {
    public final String slotLabel;
    public final int slotIndex;
    public final ValuePhase phase;
    public final RosterPlayer player;
    public final ComparableValue value;
    public final boolean lowConfidence;

    public boolean isEmpty() {
        return player == null;
    }
}
