package com.hoopsbot.value;

import com.hoopsbot.config.Config;
import com.hoopsbot.model.ComparableValue;
import com.hoopsbot.model.PoolPlayer;
import com.hoopsbot.model.ScoreRecord;
import com.hoopsbot.model.ValuePhase;
import com.hoopsbot.model.ValueSource;

/**
 * Turns the value signals of a player into one comparable number.
 *
 * <p>Tier chain, each used only when the previous is missing:
 * <ol>
 *   <li>category score</li>
 *   <li>30-day rank (STABLE) or 14-day rank (FLEX)</li>
 *   <li>platform average rank</li>
 *   <li>{@code value.missing_rank}, so a player with no data still orders deterministically</li>
 * </ol>
 * Untouchable players get {@code value.untouchable_bonus} on top. The bonus has to exceed any
 * natural spread between two players (scores stay within a few dozen points, ranks below
 * the missing-rank value).
 */
public final class ValueModel {
    public static final double DEFAULT_UNTOUCHABLE_BONUS = 10_000.0;
    public static final int DEFAULT_MISSING_RANK = 999;

    private final double untouchableBonus;
    private final int missingRank;

    public ValueModel(Config config) {
        this(
                config.getDouble("value.untouchable_bonus", DEFAULT_UNTOUCHABLE_BONUS),
                config.getInt("value.missing_rank", DEFAULT_MISSING_RANK)
        );
    }

    public ValueModel(double untouchableBonus, int missingRank) {
        this.untouchableBonus = Math.max(0.0, untouchableBonus);
        this.missingRank = Math.max(1, missingRank);
    }

    public ComparableValue computeValue(PoolPlayer player, ValuePhase phase) {
        double bonus = bonusFor(player);
        Double score = player.categoryScore();
        if (score != null) {
            return ComparableValue.ofScore(score, bonus);
        }
        return rankValue(player, phase, bonus);
    }

    /**
     * Per-game category score scaled by the games left this week. Players without a category
     * score fall back to their FLEX rank value, so the comparison direction stays the same.
     */
    public ComparableValue weeklyValue(PoolPlayer player) {
        double bonus = bonusFor(player);
        Double score = player.categoryScore();
        if (score != null) {
            int games = Math.max(0, player.getGamesRemainingThisWeek());
            return ComparableValue.ofScore(score * games, bonus);
        }
        return rankValue(player, ValuePhase.FLEX, bonus);
    }

    /**
     * Best-available rank for the phase: window rank, then platform rank; null when neither
     * is known.
     */
    public Integer fallbackRank(PoolPlayer player, ValuePhase phase) {
        ScoreRecord record = player.getScoreRecord();
        Integer window = null;
        if (record != null) {
            window = phase == ValuePhase.STABLE ? record.rank30d : record.rank14d;
        }
        if (isRank(window)) {
            return window;
        }
        Integer platform = player.getPlatformRank();
        return isRank(platform) ? platform : null;
    }

    private ComparableValue rankValue(PoolPlayer player, ValuePhase phase, double bonus) {
        ScoreRecord record = player.getScoreRecord();
        if (record != null) {
            Integer window = phase == ValuePhase.STABLE ? record.rank30d : record.rank14d;
            if (isRank(window)) {
                ValueSource source = phase == ValuePhase.STABLE ? ValueSource.RANK_30D : ValueSource.RANK_14D;
                return ComparableValue.ofRank(source, window, bonus);
            }
        }
        Integer platform = player.getPlatformRank();
        if (isRank(platform)) {
            return ComparableValue.ofRank(ValueSource.PLATFORM_RANK, platform, bonus);
        }
        return ComparableValue.ofRank(ValueSource.NONE, missingRank, bonus);
    }

    private double bonusFor(PoolPlayer player) {
        return player.isUntouchable() ? untouchableBonus : 0.0;
    }

    private static boolean isRank(Integer rank) {
        return rank != null && rank > 0;
    }
}
