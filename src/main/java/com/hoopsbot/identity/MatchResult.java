package com.hoopsbot.identity;

import com.hoopsbot.model.PoolPlayer;

import java.util.Optional;

/**
 * Outcome of {@link IdentityMatcher#match}. A NONE result carries no candidate; ambiguity
 * is reported through {@code note} only.
 */
public final class MatchResult<T extends PoolPlayer> {
    public final MatchTier tier;
    public final T candidate;
    public final int similarity;
    public final String note;

    private MatchResult(MatchTier tier, T candidate, int similarity, String note) {
        this.tier = tier == null ? MatchTier.NONE : tier;
        this.candidate = candidate;
        this.similarity = similarity;
        this.note = note == null ? "" : note;
    }

    public static <T extends PoolPlayer> MatchResult<T> exact(T candidate) {
        return new MatchResult<>(MatchTier.EXACT, candidate, 100, "");
    }

    public static <T extends PoolPlayer> MatchResult<T> fuzzy(T candidate, int similarity) {
        return new MatchResult<>(MatchTier.FUZZY, candidate, similarity, "");
    }

    public static <T extends PoolPlayer> MatchResult<T> initial(T candidate) {
        return new MatchResult<>(MatchTier.INITIAL, candidate, 0, "");
    }

    public static <T extends PoolPlayer> MatchResult<T> none(String note) {
        return new MatchResult<>(MatchTier.NONE, null, 0, note);
    }

    public boolean isMatched() {
        return tier != MatchTier.NONE && candidate != null;
    }

    public Optional<T> candidate() {
        return Optional.ofNullable(candidate);
    }

    @Override
    public String toString() {
        if (!isMatched()) {
            return "NONE" + (note.isEmpty() ? "" : "(" + note + ")");
        }
        return tier + "->" + candidate.displayName() + (tier == MatchTier.FUZZY ? "@" + similarity : "");
    }
}
