package com.hoopsbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class IlFlag {
    public final IlAction action;
    public final RosterPlayer player;
    public final String currentSlot;
    public final String injuryStatus;
    public final DropCandidate dropCandidate;
    public final String actionLine;

    public Optional<DropCandidate> drop() {
        return Optional.ofNullable(dropCandidate);
    }
}
