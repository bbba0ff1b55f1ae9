package com.hoopsbot.model;

import java.util.Locale;

public enum RosterStatus {
    ACTIVE,
    BENCH,
    IL;

    /**
     * Platform slot labels map onto three states: IL/IL+ are injured-list slots, BN is bench,
     * anything else counts as active.
     */
    public static RosterStatus parse(String raw) {
        String token = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        switch (token) {
            case "IL":
            case "IL+":
            case "INJURED_LIST":
                return IL;
            case "BN":
            case "BENCH":
            case "":
                return BENCH;
            default:
                return ACTIVE;
        }
    }
}
