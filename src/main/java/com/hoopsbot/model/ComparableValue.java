package com.hoopsbot.model;

import lombok.Value;

import java.util.Locale;

/**
 * Ordering value for one player under one phase.
 *
 * <p>Exactly one of {@code primaryScore} and {@code fallbackRank} drives {@link #effective}:
 * a category score counts as-is, a rank counts negated so that higher is better everywhere.
 * {@code bonus} is added on top.
 */
@Value
public final class ComparableValue implements Comparable<ComparableValue> {
    public final ValueSource source;
    public final Double primaryScore;
    public final Integer fallbackRank;
    public final double bonus;
    public final double effective;

    public static ComparableValue ofScore(double score, double bonus) {
        return new ComparableValue(ValueSource.CATEGORY_SCORE, score, null, bonus, score + bonus);
    }

    public static ComparableValue ofRank(ValueSource source, int rank, double bonus) {
        return new ComparableValue(source, null, rank, bonus, bonus - rank);
    }

    public boolean isScored() {
        return source == ValueSource.CATEGORY_SCORE;
    }

    @Override
    public int compareTo(ComparableValue other) {
        return Double.compare(effective, other.effective);
    }

    public String describe() {
        String base = isScored()
                ? String.format(Locale.US, "score=%.2f", primaryScore)
                : source.name().toLowerCase(Locale.ROOT) + "=" + fallbackRank;
        if (bonus != 0.0) {
            return base + String.format(Locale.US, " bonus=%.0f", bonus);
        }
        return base;
    }
}
