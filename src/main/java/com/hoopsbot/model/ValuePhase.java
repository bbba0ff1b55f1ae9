package com.hoopsbot.model;

/**
 * Optimizer pass. STABLE reads the longer 30-day window, FLEX the shorter 14-day window.
 */
public enum ValuePhase {
    STABLE,
    FLEX
}
