package com.hoopsbot.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One active lineup slot: its label, the positions it accepts (empty means any) and the
 * optimizer phase that fills it.
 */
public final class SlotSpec {
    public final String label;
    public final Set<String> accepts;
    public final ValuePhase phase;
    public final int displayIndex;

    public SlotSpec(String label, Set<String> accepts, ValuePhase phase, int displayIndex) {
        this.label = label == null ? "" : label;
        this.accepts = accepts == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(accepts));
        this.phase = phase;
        this.displayIndex = displayIndex;
    }

    public boolean acceptsAny() {
        return accepts.isEmpty();
    }

    /**
     * Size of the accepted-position set; an any-position slot is the widest possible.
     */
    public int width() {
        return acceptsAny() ? Integer.MAX_VALUE : accepts.size();
    }

    public boolean accepts(PoolPlayer player) {
        return player.playsAny(accepts);
    }

    public SlotSpec withDisplayIndex(int index) {
        return new SlotSpec(label, accepts, phase, index);
    }

    @Override
    public String toString() {
        return label + (acceptsAny() ? "[*]" : accepts.toString());
    }
}
