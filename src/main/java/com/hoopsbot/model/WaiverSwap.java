package com.hoopsbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Proposed pickup: add {@code freeAgent}, drop {@code replaces}. {@code valueDelta} is the
 * weekly value gained and is always positive.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class WaiverSwap {
    public final FreeAgentPlayer freeAgent;
    public final RosterPlayer replaces;
    public final double valueDelta;
    public final String replacedSlotLabel;
    public final ComparableValue freeAgentValue;
    public final ComparableValue replacedValue;

    public String describe() {
        return String.format(Locale.US, "Add %s (%s), drop %s [%s] (%s): +%.2f",
                freeAgent.displayName(),
                freeAgentValue.describe(),
                replaces.displayName(),
                replacedSlotLabel,
                replacedValue.describe(),
                valueDelta);
    }
}
