package com.hoopsbot.lineup;

import com.hoopsbot.config.Config;
import com.hoopsbot.model.SlotSpec;
import com.hoopsbot.model.ValuePhase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Roster shape as configuration data.
 *
 * <pre>
 * lineup.slot.G=PG,SG,G          accepted positions per slot label, * for any
 * lineup.stable_slots=C,PG,SG,SF,PF
 * lineup.flex_slots=C,G,F,UTIL,UTIL
 * lineup.display_order=C,PG,SG,G,SF,PF,F,UTIL
 * lineup.bench_slots=3
 * lineup.il_slots=3
 * </pre>
 *
 * The fill order of each phase is derived here, once: narrowest accepted-position set
 * first, configured order among equals.
 */
public final class SlotRules {
    private static final Logger LOG = LogManager.getLogger(SlotRules.class);
    private static final String ANY = "*";

    private final List<SlotSpec> activeSlots;
    private final Map<ValuePhase, List<SlotSpec>> fillOrder;
    private final int benchSlots;
    private final int ilSlots;

    public SlotRules(Map<String, Set<String>> accepted, List<String> stable, List<String> flex,
                     List<String> displayOrder, int benchSlots, int ilSlots) {
        List<SlotSpec> specs = new ArrayList<>();
        for (String label : stable) {
            specs.add(new SlotSpec(label, acceptedFor(accepted, label), ValuePhase.STABLE, 0));
        }
        for (String label : flex) {
            specs.add(new SlotSpec(label, acceptedFor(accepted, label), ValuePhase.FLEX, 0));
        }

        List<SlotSpec> display = new ArrayList<>(specs);
        display.sort(Comparator.comparingInt(spec -> displayRank(displayOrder, spec.label)));
        List<SlotSpec> indexed = new ArrayList<>(display.size());
        for (int i = 0; i < display.size(); i++) {
            indexed.add(display.get(i).withDisplayIndex(i));
        }
        this.activeSlots = Collections.unmodifiableList(indexed);

        Map<ValuePhase, List<SlotSpec>> order = new EnumMap<>(ValuePhase.class);
        for (ValuePhase phase : ValuePhase.values()) {
            List<SlotSpec> phaseSlots = new ArrayList<>();
            // configured order, which the stable sort below keeps among equal widths
            for (SlotSpec spec : specs) {
                if (spec.phase == phase) {
                    phaseSlots.add(indexedTwin(indexed, spec, phaseSlots));
                }
            }
            phaseSlots.sort(Comparator.comparingInt(SlotSpec::width));
            order.put(phase, Collections.unmodifiableList(phaseSlots));
        }
        this.fillOrder = Collections.unmodifiableMap(order);
        this.benchSlots = Math.max(0, benchSlots);
        this.ilSlots = Math.max(0, ilSlots);
    }

    public static SlotRules fromConfig(Config config) {
        List<String> stable = upper(config.getList("lineup.stable_slots"));
        List<String> flex = upper(config.getList("lineup.flex_slots"));
        Map<String, Set<String>> accepted = new LinkedHashMap<>();
        Set<String> labels = new LinkedHashSet<>(stable);
        labels.addAll(flex);
        for (String label : labels) {
            List<String> positions = upper(config.getList("lineup.slot." + label));
            if (positions.isEmpty()) {
                LOG.warn("no lineup.slot.{} configured, treating {} as a single-position slot", label, label);
                accepted.put(label, Set.of(label));
            } else if (positions.contains(ANY)) {
                accepted.put(label, Set.of());
            } else {
                accepted.put(label, new LinkedHashSet<>(positions));
            }
        }
        return new SlotRules(
                accepted,
                stable,
                flex,
                upper(config.getList("lineup.display_order")),
                config.getInt("lineup.bench_slots", 3),
                config.getInt("lineup.il_slots", 3)
        );
    }

    public static SlotRules defaults() {
        return fromConfig(Config.defaultsOnly());
    }

    /**
     * Active slots in display order.
     */
    public List<SlotSpec> activeSlots() {
        return activeSlots;
    }

    public List<SlotSpec> fillOrder(ValuePhase phase) {
        return fillOrder.getOrDefault(phase, List.of());
    }

    public int benchSlots() {
        return benchSlots;
    }

    public int ilSlots() {
        return ilSlots;
    }

    private static SlotSpec indexedTwin(List<SlotSpec> indexed, SlotSpec spec, List<SlotSpec> taken) {
        for (SlotSpec candidate : indexed) {
            if (candidate.label.equals(spec.label) && candidate.phase == spec.phase && !taken.contains(candidate)) {
                return candidate;
            }
        }
        return spec;
    }

    private static Set<String> acceptedFor(Map<String, Set<String>> accepted, String label) {
        Set<String> positions = accepted.get(label);
        return positions == null ? Set.of(label) : positions;
    }

    private static int displayRank(List<String> displayOrder, String label) {
        int idx = displayOrder.indexOf(label);
        return idx < 0 ? Integer.MAX_VALUE : idx;
    }

    private static List<String> upper(List<String> values) {
        List<String> out = new ArrayList<>(values.size());
        for (String value : values) {
            out.add(value.toUpperCase(Locale.ROOT));
        }
        return out;
    }
}
