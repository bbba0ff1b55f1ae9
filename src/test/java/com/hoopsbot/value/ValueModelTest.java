package com.hoopsbot.value;

import com.hoopsbot.model.ComparableValue;
import com.hoopsbot.model.FreeAgentPlayer;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.ValuePhase;
import com.hoopsbot.model.ValueSource;
import org.junit.jupiter.api.Test;

import static com.hoopsbot.model.PlayerFixtures.freeAgent;
import static com.hoopsbot.model.PlayerFixtures.ranked;
import static com.hoopsbot.model.PlayerFixtures.rostered;
import static com.hoopsbot.model.PlayerFixtures.scored;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueModelTest {

    private final ValueModel model = new ValueModel(10_000.0, 999);

    @Test
    void computeValue_shouldPreferCategoryScore() {
        RosterPlayer player = scored("Tyrese Haliburton", "PG", 5.2);

        ComparableValue value = model.computeValue(player, ValuePhase.STABLE);

        assertEquals(ValueSource.CATEGORY_SCORE, value.source);
        assertEquals(5.2, value.effective, 1e-9);
    }

    @Test
    void computeValue_shouldPickWindowRankByPhase() {
        RosterPlayer player = ranked("Josh Hart", "SG,SF", 55, 40, 70);

        ComparableValue stable = model.computeValue(player, ValuePhase.STABLE);
        ComparableValue flex = model.computeValue(player, ValuePhase.FLEX);

        assertEquals(ValueSource.RANK_30D, stable.source);
        assertEquals(-55.0, stable.effective, 1e-9);
        assertEquals(ValueSource.RANK_14D, flex.source);
        assertEquals(-40.0, flex.effective, 1e-9);
    }

    @Test
    void computeValue_shouldFallBackToPlatformRankThenMissingRank() {
        RosterPlayer platformOnly = ranked("Naz Reid", "PF,C", null, null, 100);
        RosterPlayer nothing = rostered("Mystery Rookie", "SF");

        ComparableValue platform = model.computeValue(platformOnly, ValuePhase.FLEX);
        ComparableValue missing = model.computeValue(nothing, ValuePhase.STABLE);

        assertEquals(ValueSource.PLATFORM_RANK, platform.source);
        assertEquals(-100.0, platform.effective, 1e-9);
        assertEquals(ValueSource.NONE, missing.source);
        assertEquals(-999.0, missing.effective, 1e-9);
        assertTrue(platform.compareTo(missing) > 0);
    }

    @Test
    void computeValue_shouldLetUntouchableWithScoreOneOutrankScoreHundred() {
        RosterPlayer untouchable = scored("Franchise Player", "C", 1.0).toBuilder().untouchable(true).build();
        RosterPlayer star = scored("Other Star", "C", 100.0);

        for (ValuePhase phase : ValuePhase.values()) {
            assertTrue(model.computeValue(untouchable, phase).compareTo(model.computeValue(star, phase)) > 0);
        }
    }

    @Test
    void computeValue_shouldLetUnscoredUntouchableOutrankScoredPlayer() {
        RosterPlayer untouchable = rostered("Injured Franchise", "C").toBuilder().untouchable(true).build();
        RosterPlayer star = scored("Other Star", "C", 100.0);

        assertTrue(model.computeValue(untouchable, ValuePhase.STABLE)
                .compareTo(model.computeValue(star, ValuePhase.STABLE)) > 0);
    }

    @Test
    void weeklyValue_shouldScaleScoreByGamesRemaining() {
        FreeAgentPlayer fourGames = freeAgent("Four Games", "SG", 2.0, 4);
        FreeAgentPlayer noGames = freeAgent("No Games", "SG", 2.0, 0);

        assertEquals(8.0, model.weeklyValue(fourGames).effective, 1e-9);
        assertEquals(0.0, model.weeklyValue(noGames).effective, 1e-9);
    }

    @Test
    void weeklyValue_shouldUseFlexRankWithoutScore() {
        RosterPlayer player = ranked("Josh Hart", "SG,SF", 55, 40, 70);

        ComparableValue weekly = model.weeklyValue(player);

        assertEquals(ValueSource.RANK_14D, weekly.source);
        assertEquals(-40.0, weekly.effective, 1e-9);
    }

    @Test
    void fallbackRank_shouldReturnNullWithoutAnyRank() {
        assertNull(model.fallbackRank(rostered("Mystery Rookie", "SF"), ValuePhase.STABLE));
        assertEquals(70, model.fallbackRank(ranked("Josh Hart", "SG,SF", null, 40, 70), ValuePhase.STABLE));
    }
}
