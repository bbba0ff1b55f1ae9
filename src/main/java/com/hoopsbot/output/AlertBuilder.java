package com.hoopsbot.output;

import com.hoopsbot.model.Assignment;
import com.hoopsbot.model.BenchShape;
import com.hoopsbot.model.IlReport;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.SlotAssignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects the one-line alerts shown at the top of the report.
 */
public final class AlertBuilder {
    private static final Set<String> INJURY_DESIGNATIONS = Set.of("INJ", "O", "Q", "DTD");
    private static final Set<String> OUT_DESIGNATIONS = Set.of("INJ", "O");

    public List<String> build(Assignment assignment, IlReport ilReport, BenchShape benchShape,
                              List<RosterPlayer> unscoredRoster) {
        List<String> alerts = new ArrayList<>();
        if (ilReport != null) {
            alerts.addAll(ilReport.actionLines());
            for (RosterPlayer player : ilReport.skippedMoves) {
                alerts.add(player.displayName() + " should go to IL but no IL slot is free.");
            }
        }

        for (SlotAssignment entry : assignment.active) {
            if (entry.isEmpty()) {
                continue;
            }
            String status = entry.player.injuryStatus == null ? "" : entry.player.injuryStatus;
            if (INJURY_DESIGNATIONS.contains(status) && !alreadyFlagged(ilReport, entry.player)) {
                alerts.add(entry.player.displayName() + " is in active slot " + entry.slotLabel
                        + " with status " + status + ", consider sitting or moving to IL.");
            }
        }

        for (SlotAssignment entry : assignment.lowConfidenceActive()) {
            alerts.add(entry.player.displayName() + " (" + entry.slotLabel + ") is a low-confidence starter: "
                    + entry.value.describe() + ".");
        }

        if (!assignment.emptySlots.isEmpty()) {
            alerts.add("No eligible player for active slot(s): " + String.join(", ", assignment.emptySlots) + ".");
        }

        if (benchShape != null && !benchShape.met) {
            alerts.add("Bench shape target not met: " + benchShape.description);
        }

        List<RosterPlayer> idle = new ArrayList<>();
        for (SlotAssignment entry : assignment.active) {
            if (!entry.isEmpty() && !entry.player.playsToday()
                    && !OUT_DESIGNATIONS.contains(entry.player.injuryStatus == null ? "" : entry.player.injuryStatus)) {
                idle.add(entry.player);
            }
        }
        if (!idle.isEmpty()) {
            alerts.add("Active players with no game today: " + names(idle) + ".");
        }

        if (!assignment.overflow.isEmpty()) {
            alerts.add("No bench or IL room for: " + names(assignment.overflow) + ".");
        }

        if (unscoredRoster != null && !unscoredRoster.isEmpty()) {
            alerts.add(unscoredRoster.size() + " roster player(s) without a score row, valued by rank: "
                    + names(unscoredRoster) + ".");
        }
        return alerts;
    }

    private static boolean alreadyFlagged(IlReport ilReport, RosterPlayer player) {
        if (ilReport == null) {
            return false;
        }
        return ilReport.moveToIl.stream().anyMatch(flag -> flag.player.equals(player));
    }

    private static String names(List<RosterPlayer> players) {
        List<String> out = new ArrayList<>();
        for (RosterPlayer player : players) {
            out.add(player.displayName());
        }
        return String.join(", ", out);
    }
}
