package com.hoopsbot.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Optimizer output for one run: active slots in display order (empty ones included),
 * bench, injured list, and players left without a slot.
 */
@Value
public final class Assignment {
    public final List<SlotAssignment> active;
    public final List<SlotAssignment> bench;
    public final List<SlotAssignment> injured;
    public final List<RosterPlayer> overflow;
    public final List<String> emptySlots;

    public Assignment(
            List<SlotAssignment> active,
            List<SlotAssignment> bench,
            List<SlotAssignment> injured,
            List<RosterPlayer> overflow,
            List<String> emptySlots
    ) {
        this.active = active == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(active));
        this.bench = bench == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bench));
        this.injured = injured == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(injured));
        this.overflow = overflow == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(overflow));
        this.emptySlots = emptySlots == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(emptySlots));
    }

    public List<SlotAssignment> lowConfidenceActive() {
        List<SlotAssignment> out = new ArrayList<>();
        for (SlotAssignment entry : active) {
            if (!entry.isEmpty() && entry.lowConfidence) {
                out.add(entry);
            }
        }
        return out;
    }

    public List<RosterPlayer> activePlayers() {
        return playersOf(active);
    }

    public List<RosterPlayer> benchPlayers() {
        return playersOf(bench);
    }

    public List<RosterPlayer> injuredPlayers() {
        return playersOf(injured);
    }

    public int filledActiveCount() {
        return active.size() - emptySlots.size();
    }

    public Optional<SlotAssignment> slotOf(RosterPlayer player) {
        for (List<SlotAssignment> group : List.of(active, bench, injured)) {
            for (SlotAssignment entry : group) {
                if (entry.player != null && entry.player.equals(player)) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    private static List<RosterPlayer> playersOf(List<SlotAssignment> entries) {
        List<RosterPlayer> out = new ArrayList<>();
        for (SlotAssignment entry : entries) {
            if (entry.player != null) {
                out.add(entry.player);
            }
        }
        return out;
    }
}
