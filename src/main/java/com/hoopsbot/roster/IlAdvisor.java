package com.hoopsbot.roster;

import com.hoopsbot.config.Config;
import com.hoopsbot.model.Assignment;
import com.hoopsbot.model.DropCandidate;
import com.hoopsbot.model.IlAction;
import com.hoopsbot.model.IlFlag;
import com.hoopsbot.model.IlReport;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.RosterStatus;
import com.hoopsbot.model.ScoreRecord;
import com.hoopsbot.model.SlotAssignment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Surfaces injured-list moves. Only suggestions are produced; nothing on the roster changes.
 *
 * <ul>
 *   <li>move to IL: not on IL, injury status in {@code il.move_statuses}; trimmed to the IL
 *   slots still free</li>
 *   <li>activate from IL: on IL with no injury designation, paired with a bench player to drop</li>
 * </ul>
 */
public final class IlAdvisor {
    private static final Logger LOG = LogManager.getLogger(IlAdvisor.class);

    static final double NO_SCORE = -999.0;
    static final double OVERLAP_NUDGE = 0.5;

    private final Set<String> moveStatuses;
    private final int ilSlots;

    public IlAdvisor(Config config) {
        this(config.getList("il.move_statuses"), config.getInt("lineup.il_slots", 3));
    }

    public IlAdvisor(List<String> moveStatuses, int ilSlots) {
        this.moveStatuses = new HashSet<>();
        for (String status : moveStatuses) {
            this.moveStatuses.add(status.trim().toUpperCase(Locale.ROOT));
        }
        this.ilSlots = Math.max(0, ilSlots);
    }

    public IlReport review(List<RosterPlayer> roster, Assignment assignment) {
        Objects.requireNonNull(assignment, "assignment");
        if (roster == null || roster.isEmpty()) {
            return IlReport.empty();
        }
        int occupied = 0;
        for (RosterPlayer player : roster) {
            if (player.currentStatus == RosterStatus.IL) {
                occupied++;
            }
        }
        int available = Math.max(0, ilSlots - occupied);

        List<IlFlag> moves = new ArrayList<>();
        List<IlFlag> activations = new ArrayList<>();
        for (RosterPlayer player : roster) {
            String status = normalizedStatus(player);
            String slot = slotLabel(player, assignment);
            if (player.currentStatus != RosterStatus.IL && moveStatuses.contains(status)) {
                moves.add(IlFlag.builder()
                        .action(IlAction.MOVE_TO_IL)
                        .player(player)
                        .currentSlot(slot)
                        .injuryStatus(status)
                        .actionLine(String.format(Locale.ROOT, "Move %s (%s) -> IL  [status: %s]",
                                player.displayName(), slot, status))
                        .build());
            } else if (player.currentStatus == RosterStatus.IL && isHealthy(status)) {
                DropCandidate drop = recommendDrop(player, assignment.benchPlayers()).orElse(null);
                String line = String.format(Locale.ROOT, "Activate %s from %s [status: healthy]",
                        player.displayName(), slot);
                if (drop != null) {
                    line += " - consider dropping " + drop.player.displayName() + " (" + drop.reason + ")";
                }
                activations.add(IlFlag.builder()
                        .action(IlAction.ACTIVATE_FROM_IL)
                        .player(player)
                        .currentSlot(slot)
                        .injuryStatus(status)
                        .dropCandidate(drop)
                        .actionLine(line)
                        .build());
            }
        }

        List<RosterPlayer> skipped = new ArrayList<>();
        if (moves.size() > available) {
            for (IlFlag flag : moves.subList(available, moves.size())) {
                skipped.add(flag.player);
            }
            moves = new ArrayList<>(moves.subList(0, available));
            LOG.warn("IL is full ({}/{}), skipping move suggestion for {}",
                    occupied, ilSlots, names(skipped));
        }

        if (!moves.isEmpty()) {
            LOG.info("{} player(s) should be moved to IL", moves.size());
        }
        if (!activations.isEmpty()) {
            LOG.info("{} player(s) can be activated from IL", activations.size());
        }
        if (moves.isEmpty() && activations.isEmpty()) {
            LOG.info("no IL flags");
        }
        return new IlReport(moves, activations, skipped);
    }

    /**
     * Most droppable bench player for the returning one. Untouchables are never offered.
     * Order: lowest category score (none counts as {@value #NO_SCORE}), shifted down by
     * {@value #OVERLAP_NUDGE} when the player shares a position with the returning one; then
     * the worse 14-day rank.
     */
    public Optional<DropCandidate> recommendDrop(RosterPlayer returning, List<RosterPlayer> bench) {
        if (bench == null || bench.isEmpty()) {
            return Optional.empty();
        }
        List<DropCandidate> candidates = new ArrayList<>();
        for (RosterPlayer player : bench) {
            if (player.untouchable) {
                continue;
            }
            Double score = player.categoryScore();
            ScoreRecord record = player.scoreRecord;
            Integer rank14 = record == null ? null : record.rank14d;
            boolean overlap = returning.playsAny(player.eligiblePositions)
                    && !player.eligiblePositions.isEmpty();
            candidates.add(DropCandidate.builder()
                    .player(player)
                    .categoryScore(score)
                    .rank14d(rank14)
                    .positionOverlap(overlap)
                    .reason(reason(score, rank14, overlap))
                    .build());
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Comparator<DropCandidate> order = Comparator
                .comparingDouble(IlAdvisor::dropScore)
                .thenComparing(Comparator.comparingInt(IlAdvisor::rankOrZero).reversed())
                .thenComparing(candidate -> candidate.player.displayName());
        candidates.sort(order);
        return Optional.of(candidates.get(0));
    }

    private static double dropScore(DropCandidate candidate) {
        double base = candidate.categoryScore == null ? NO_SCORE : candidate.categoryScore;
        return candidate.positionOverlap ? base - OVERLAP_NUDGE : base;
    }

    private static int rankOrZero(DropCandidate candidate) {
        return candidate.rank14d == null ? 0 : candidate.rank14d;
    }

    private static String reason(Double score, Integer rank14, boolean overlap) {
        List<String> parts = new ArrayList<>();
        parts.add(score == null ? "no score" : String.format(Locale.US, "score: %.1f", score));
        if (rank14 != null && rank14 > 0) {
            parts.add("rank14: " + rank14);
        }
        if (overlap) {
            parts.add("position overlap");
        }
        return String.join(", ", parts);
    }

    private static String slotLabel(RosterPlayer player, Assignment assignment) {
        Optional<SlotAssignment> slot = assignment.slotOf(player);
        if (slot.isPresent()) {
            return slot.get().slotLabel;
        }
        return player.currentStatus == RosterStatus.IL ? "IL" : "BN";
    }

    private static String normalizedStatus(RosterPlayer player) {
        String status = player.injuryStatus;
        return status == null ? "" : status.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isHealthy(String status) {
        return status.isEmpty() || "HEALTHY".equals(status);
    }

    private static List<String> names(List<RosterPlayer> players) {
        List<String> out = new ArrayList<>();
        for (RosterPlayer player : players) {
            out.add(player.displayName());
        }
        return out;
    }
}
