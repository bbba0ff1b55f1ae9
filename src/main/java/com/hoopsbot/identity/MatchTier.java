package com.hoopsbot.identity;

/**
 * Which matching tier resolved a name, or NONE.
 */
public enum MatchTier {
    EXACT,
    FUZZY,
    INITIAL,
    NONE
}
