package com.hoopsbot.waiver;

import com.hoopsbot.config.Config;
import com.hoopsbot.lineup.SlotRules;
import com.hoopsbot.model.Assignment;
import com.hoopsbot.model.BenchCategory;
import com.hoopsbot.model.ComparableValue;
import com.hoopsbot.model.FreeAgentPlayer;
import com.hoopsbot.model.SlotAssignment;
import com.hoopsbot.model.SlotSpec;
import com.hoopsbot.model.ValuePhase;
import com.hoopsbot.model.WaiverSwap;
import com.hoopsbot.value.ValueModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds free agents worth more this week than a bench player or a low-confidence starter.
 *
 * <p>Targets are compared by {@link ValueModel#weeklyValue}; an untouchable target carries
 * its bonus, so no free agent beats it. Read-only: nothing in the assignment changes.
 *
 * <p>A free agent is considered only with a known window rank within {@code waiver.max_rank}
 * (30-day against starters, 14-day against the bench; platform rank when the window rank is
 * missing). Minutes and games played filter only when the snapshot carries them.
 */
public final class WaiverComparator {
    private static final Logger LOG = LogManager.getLogger(WaiverComparator.class);

    public static final int DEFAULT_MAX_RANK = 96;
    public static final double DEFAULT_MIN_MPG = 28.0;
    public static final int DEFAULT_MIN_GAMES_30 = 5;

    private final ValueModel valueModel;
    private final SlotRules rules;
    private final Set<String> disqualifyStatuses;
    private final boolean requirePositionFit;
    private final int maxSwaps;
    private final int maxRank;
    private final double minMinutes;
    private final int minGames30;

    public WaiverComparator(Config config) {
        this(
                new ValueModel(config),
                SlotRules.fromConfig(config),
                config.getList("waiver.disqualify_statuses"),
                config.getBoolean("waiver.require_position_fit", true),
                config.getInt("waiver.max_swaps", 10),
                config.getInt("waiver.max_rank", DEFAULT_MAX_RANK),
                config.getDouble("waiver.min_mpg", DEFAULT_MIN_MPG),
                config.getInt("waiver.min_games_30", DEFAULT_MIN_GAMES_30)
        );
    }

    public WaiverComparator(ValueModel valueModel, SlotRules rules, List<String> disqualifyStatuses,
                            boolean requirePositionFit, int maxSwaps) {
        this(valueModel, rules, disqualifyStatuses, requirePositionFit, maxSwaps,
                DEFAULT_MAX_RANK, DEFAULT_MIN_MPG, DEFAULT_MIN_GAMES_30);
    }

    public WaiverComparator(ValueModel valueModel, SlotRules rules, List<String> disqualifyStatuses,
                            boolean requirePositionFit, int maxSwaps,
                            int maxRank, double minMinutes, int minGames30) {
        this.valueModel = valueModel;
        this.rules = rules;
        this.disqualifyStatuses = new HashSet<>();
        for (String status : disqualifyStatuses) {
            this.disqualifyStatuses.add(status.trim().toUpperCase(Locale.ROOT));
        }
        this.requirePositionFit = requirePositionFit;
        this.maxSwaps = Math.max(0, maxSwaps);
        this.maxRank = maxRank;
        this.minMinutes = minMinutes;
        this.minGames30 = minGames30;
    }

    public List<WaiverSwap> findUpgrades(Assignment assignment, List<FreeAgentPlayer> freeAgents) {
        List<SlotAssignment> targets = new ArrayList<>(assignment.bench);
        targets.addAll(assignment.lowConfidenceActive());
        if (targets.isEmpty() || freeAgents == null || freeAgents.isEmpty()) {
            LOG.info("waiver scan skipped: targets={} freeAgents={}", targets.size(),
                    freeAgents == null ? 0 : freeAgents.size());
            return List.of();
        }

        int disqualified = 0;
        int negative = 0;
        int thinRole = 0;
        List<WaiverSwap> swaps = new ArrayList<>();
        for (FreeAgentPlayer freeAgent : freeAgents) {
            if (isDisqualified(freeAgent)) {
                disqualified++;
                continue;
            }
            Double score = freeAgent.categoryScore();
            if (score != null && score < 0.0) {
                negative++;
                continue;
            }
            if (!hasRotationRole(freeAgent)) {
                thinRole++;
                continue;
            }
            ComparableValue faValue = valueModel.weeklyValue(freeAgent);
            WaiverSwap best = null;
            for (SlotAssignment target : targets) {
                if (requirePositionFit && !fits(freeAgent, target)) {
                    continue;
                }
                if (!withinRank(freeAgent, target)) {
                    continue;
                }
                ComparableValue targetValue = valueModel.weeklyValue(target.player);
                if (faValue.compareTo(targetValue) <= 0) {
                    continue;
                }
                WaiverSwap swap = WaiverSwap.builder()
                        .freeAgent(freeAgent)
                        .replaces(target.player)
                        .valueDelta(faValue.effective - targetValue.effective)
                        .replacedSlotLabel(target.slotLabel)
                        .freeAgentValue(faValue)
                        .replacedValue(targetValue)
                        .build();
                if (best == null || swapOrder().compare(swap, best) < 0) {
                    best = swap;
                }
            }
            if (best != null) {
                swaps.add(best);
            }
        }

        swaps.sort(swapOrder());
        List<WaiverSwap> out = maxSwaps > 0 && swaps.size() > maxSwaps
                ? new ArrayList<>(swaps.subList(0, maxSwaps))
                : swaps;
        LOG.info("waiver scan: freeAgents={} disqualified={} negativeScore={} thinRole={} proposals={} kept={}",
                freeAgents.size(), disqualified, negative, thinRole, swaps.size(), out.size());
        return List.copyOf(out);
    }

    private boolean isDisqualified(FreeAgentPlayer freeAgent) {
        String status = freeAgent.getInjuryStatus();
        return status != null && disqualifyStatuses.contains(status.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Minutes and games filter only when known; zero or missing means the source had no data.
     */
    private boolean hasRotationRole(FreeAgentPlayer freeAgent) {
        Double minutes = freeAgent.minutesPerGame;
        if (minutes != null && minutes > 0.0 && minutes < minMinutes) {
            return false;
        }
        Integer games = freeAgent.gamesLast30;
        return games == null || games <= 0 || games >= minGames30;
    }

    private boolean withinRank(FreeAgentPlayer freeAgent, SlotAssignment target) {
        ValuePhase window = target.phase == null ? ValuePhase.FLEX : ValuePhase.STABLE;
        Integer rank = valueModel.fallbackRank(freeAgent, window);
        if (rank == null) {
            return freeAgent.categoryScore() != null;
        }
        return rank <= maxRank;
    }

    /**
     * A starter's replacement must be eligible for that slot; a bench replacement must share
     * a position or the G/F/C bench group.
     */
    private boolean fits(FreeAgentPlayer freeAgent, SlotAssignment target) {
        if (target.phase != null) {
            for (SlotSpec slot : rules.activeSlots()) {
                if (slot.label.equals(target.slotLabel) && slot.phase == target.phase) {
                    return slot.accepts(freeAgent);
                }
            }
            return freeAgent.playsAny(target.player.getEligiblePositions());
        }
        if (freeAgent.playsAny(target.player.getEligiblePositions())) {
            return true;
        }
        BenchCategory faCategory = BenchCategory.classify(freeAgent);
        return faCategory != null && faCategory == BenchCategory.classify(target.player);
    }

    private static Comparator<WaiverSwap> swapOrder() {
        Comparator<WaiverSwap> byDelta = Comparator.comparingDouble(swap -> swap.valueDelta);
        return byDelta.reversed()
                .thenComparing(swap -> swap.freeAgent.displayName())
                .thenComparing(swap -> swap.replaces.displayName());
    }
}
