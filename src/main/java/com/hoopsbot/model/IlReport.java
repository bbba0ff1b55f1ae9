package com.hoopsbot.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IL suggestions for one run. {@code skippedMoves} are injured players that would need an
 * IL slot the roster no longer has.
 */
@Value
public final class IlReport {
    public final List<IlFlag> moveToIl;
    public final List<IlFlag> activateFromIl;
    public final List<RosterPlayer> skippedMoves;

    public IlReport(List<IlFlag> moveToIl, List<IlFlag> activateFromIl, List<RosterPlayer> skippedMoves) {
        this.moveToIl = moveToIl == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(moveToIl));
        this.activateFromIl = activateFromIl == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(activateFromIl));
        this.skippedMoves = skippedMoves == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(skippedMoves));
    }

    public static IlReport empty() {
        return new IlReport(List.of(), List.of(), List.of());
    }

    public boolean hasAlerts() {
        return !moveToIl.isEmpty() || !activateFromIl.isEmpty();
    }

    public List<String> actionLines() {
        List<String> out = new ArrayList<>();
        for (IlFlag flag : moveToIl) {
            out.add(flag.actionLine);
        }
        for (IlFlag flag : activateFromIl) {
            out.add(flag.actionLine);
        }
        return out;
    }
}
