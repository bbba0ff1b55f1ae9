package com.hoopsbot.lineup;

import com.hoopsbot.config.Config;
import com.hoopsbot.model.Assignment;
import com.hoopsbot.model.ComparableValue;
import com.hoopsbot.model.PoolPlayer;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.RosterStatus;
import com.hoopsbot.model.SlotAssignment;
import com.hoopsbot.model.SlotSpec;
import com.hoopsbot.model.ValuePhase;
import com.hoopsbot.value.ValueModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Greedy two-phase lineup fill.
 *
 * <p>STABLE slots are filled first with 30-day values, then FLEX slots with 14-day values.
 * Each phase walks its slots narrowest-first and gives every slot the best unassigned
 * eligible player. Candidates are tiered before value: playing today and not hard out, then
 * hard out but playing, then healthy without a game, then hard out without a game. Players on
 * the injured list only ever land in IL slots. Whatever is left
 * goes to the bench by STABLE value; players that fit nowhere are reported as overflow.
 */
public final class SlotAssigner {
    private static final Logger LOG = LogManager.getLogger(SlotAssigner.class);

    public static final String BENCH_LABEL = "BN";
    public static final String IL_LABEL = "IL";
    public static final int DEFAULT_LOW_CONFIDENCE_RANK = 60;
    public static final List<String> DEFAULT_HARD_OUT_STATUSES = List.of("INJ", "O", "NA");

    private final SlotRules rules;
    private final ValueModel valueModel;
    private final int lowConfidenceRank;
    private final Set<String> hardOutStatuses;

    public SlotAssigner(Config config) {
        this(
                SlotRules.fromConfig(config),
                new ValueModel(config),
                config.getInt("lineup.low_confidence_rank", DEFAULT_LOW_CONFIDENCE_RANK),
                config.getList("lineup.hard_out_statuses")
        );
    }

    public SlotAssigner(SlotRules rules, ValueModel valueModel, int lowConfidenceRank) {
        this(rules, valueModel, lowConfidenceRank, DEFAULT_HARD_OUT_STATUSES);
    }

    public SlotAssigner(SlotRules rules, ValueModel valueModel, int lowConfidenceRank, List<String> hardOutStatuses) {
        this.rules = rules;
        this.valueModel = valueModel;
        this.lowConfidenceRank = lowConfidenceRank;
        this.hardOutStatuses = new HashSet<>();
        for (String status : hardOutStatuses) {
            this.hardOutStatuses.add(status.trim().toUpperCase(Locale.ROOT));
        }
    }

    public SlotRules rules() {
        return rules;
    }

    public Assignment assign(List<RosterPlayer> roster) {
        List<RosterPlayer> players = roster == null ? List.of() : roster;
        Map<RosterPlayer, Boolean> used = new IdentityHashMap<>();

        List<RosterPlayer> candidates = new ArrayList<>();
        List<RosterPlayer> injuredList = new ArrayList<>();
        for (RosterPlayer player : players) {
            if (player == null) {
                continue;
            }
            if (player.currentStatus == RosterStatus.IL) {
                injuredList.add(player);
            } else {
                candidates.add(player);
            }
        }

        Map<SlotSpec, SlotAssignment> filled = new IdentityHashMap<>();
        for (ValuePhase phase : ValuePhase.values()) {
            for (SlotSpec slot : rules.fillOrder(phase)) {
                RosterPlayer best = pickBest(slot, candidates, used);
                if (best == null) {
                    filled.put(slot, emptySlot(slot));
                    continue;
                }
                used.put(best, Boolean.TRUE);
                filled.put(slot, SlotAssignment.builder()
                        .slotLabel(slot.label)
                        .slotIndex(slot.displayIndex)
                        .phase(phase)
                        .player(best)
                        .value(valueModel.computeValue(best, phase))
                        .lowConfidence(phase == ValuePhase.STABLE && isLowConfidence(best))
                        .build());
            }
        }

        List<SlotAssignment> active = new ArrayList<>();
        List<String> emptySlots = new ArrayList<>();
        for (SlotSpec slot : rules.activeSlots()) {
            SlotAssignment entry = filled.get(slot);
            if (entry == null) {
                entry = emptySlot(slot);
            }
            active.add(entry);
            if (entry.isEmpty()) {
                emptySlots.add(slot.label);
            }
        }

        List<RosterPlayer> overflow = new ArrayList<>();
        List<SlotAssignment> injured = new ArrayList<>();
        List<RosterPlayer> injuredSorted = sortedByStable(injuredList);
        for (RosterPlayer player : injuredSorted) {
            if (injured.size() < rules.ilSlots()) {
                injured.add(reserveSlot(IL_LABEL, injured.size(), player));
            } else {
                overflow.add(player);
            }
        }

        List<RosterPlayer> leftovers = new ArrayList<>();
        for (RosterPlayer player : candidates) {
            if (!used.containsKey(player)) {
                leftovers.add(player);
            }
        }
        List<SlotAssignment> bench = new ArrayList<>();
        for (RosterPlayer player : sortedByStable(leftovers)) {
            if (bench.size() < rules.benchSlots()) {
                bench.add(reserveSlot(BENCH_LABEL, bench.size(), player));
            } else {
                overflow.add(player);
            }
        }

        Assignment assignment = new Assignment(active, bench, injured, overflow, emptySlots);
        LOG.info("lineup assigned: active={}/{} bench={} il={} overflow={} lowConfidence={}",
                assignment.filledActiveCount(), active.size(), bench.size(), injured.size(),
                overflow.size(), assignment.lowConfidenceActive().size());
        if (!emptySlots.isEmpty()) {
            LOG.warn("no eligible player for active slots {}", emptySlots);
        }
        if (!overflow.isEmpty()) {
            LOG.warn("{} roster player(s) without bench or IL capacity", overflow.size());
        }
        return assignment;
    }

    /**
     * Flagged when the 30-day fallback rank is beyond the threshold, or when there is nothing
     * to value the player by.
     */
    public boolean isLowConfidence(PoolPlayer player) {
        Integer rank = valueModel.fallbackRank(player, ValuePhase.STABLE);
        if (rank == null) {
            return player.categoryScore() == null;
        }
        return rank > lowConfidenceRank;
    }

    private RosterPlayer pickBest(SlotSpec slot, List<RosterPlayer> candidates, Map<RosterPlayer, Boolean> used) {
        RosterPlayer best = null;
        int bestTier = Integer.MAX_VALUE;
        ComparableValue bestValue = null;
        for (RosterPlayer player : candidates) {
            if (used.containsKey(player) || !slot.accepts(player)) {
                continue;
            }
            int tier = availabilityTier(player);
            if (tier > bestTier) {
                continue;
            }
            ComparableValue value = valueModel.computeValue(player, slot.phase);
            if (best == null || tier < bestTier || isBetter(player, value, best, bestValue)) {
                best = player;
                bestTier = tier;
                bestValue = value;
            }
        }
        return best;
    }

    /**
     * 0 plays today, 1 hard out but plays today, 2 no game, 3 hard out with no game.
     */
    int availabilityTier(RosterPlayer player) {
        String status = player.injuryStatus == null ? "" : player.injuryStatus.trim().toUpperCase(Locale.ROOT);
        int tier = hardOutStatuses.contains(status) ? 1 : 0;
        return player.playsToday() ? tier : tier + 2;
    }

    private static boolean isBetter(PoolPlayer player, ComparableValue value, PoolPlayer incumbent, ComparableValue incumbentValue) {
        int cmp = value.compareTo(incumbentValue);
        if (cmp != 0) {
            return cmp > 0;
        }
        return nameOrder().compare(player, incumbent) < 0;
    }

    private List<RosterPlayer> sortedByStable(List<RosterPlayer> players) {
        Map<RosterPlayer, ComparableValue> values = new IdentityHashMap<>();
        for (RosterPlayer player : players) {
            values.put(player, valueModel.computeValue(player, ValuePhase.STABLE));
        }
        List<RosterPlayer> sorted = new ArrayList<>(players);
        Comparator<RosterPlayer> byValue = Comparator.comparing(values::get);
        sorted.sort(byValue.reversed().thenComparing(nameOrder()));
        return sorted;
    }

    private SlotAssignment reserveSlot(String label, int index, RosterPlayer player) {
        return SlotAssignment.builder()
                .slotLabel(label)
                .slotIndex(index)
                .player(player)
                .value(valueModel.computeValue(player, ValuePhase.STABLE))
                .build();
    }

    private static SlotAssignment emptySlot(SlotSpec slot) {
        return SlotAssignment.builder()
                .slotLabel(slot.label)
                .slotIndex(slot.displayIndex)
                .phase(slot.phase)
                .build();
    }

    static Comparator<PoolPlayer> nameOrder() {
        return Comparator.comparing(PoolPlayer::displayName).thenComparing(PoolPlayer::key);
    }
}
