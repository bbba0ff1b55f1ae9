package com.hoopsbot.identity;

import com.hoopsbot.model.RosterPlayer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hoopsbot.model.PlayerFixtures.rostered;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentityMatcherTest {

    private final IdentityMatcher matcher = new IdentityMatcher(90);

    @Test
    void match_shouldResolveInitialSpellingsExactly() {
        RosterPlayer mccollum = rostered("CJ McCollum", "PG,SG");
        List<RosterPlayer> pool = List.of(rostered("Jrue Holiday", "PG"), mccollum);

        MatchResult<RosterPlayer> result = matcher.match("C.J. McCollum", pool);

        assertEquals(MatchTier.EXACT, result.tier);
        assertSame(mccollum, result.candidate);
        assertEquals(100, result.similarity);
    }

    @Test
    void match_shouldIgnoreGenerationalSuffix() {
        RosterPlayer jackson = rostered("Jaren Jackson Jr.", "PF,C");
        MatchResult<RosterPlayer> result = matcher.match("Jaren Jackson", List.of(jackson, rostered("Josh Hart", "SG")));

        assertTrue(result.isMatched());
        assertSame(jackson, result.candidate);
    }

    @Test
    void match_shouldFallBackToFuzzyForSmallTypos() {
        RosterPlayer mathurin = rostered("Bennedict Mathurin", "SG,SF");
        MatchResult<RosterPlayer> result = matcher.match("Benedict Mathurin", List.of(mathurin, rostered("Naz Reid", "C")));

        assertEquals(MatchTier.FUZZY, result.tier);
        assertSame(mathurin, result.candidate);
        assertTrue(result.similarity >= 90);
    }

    @Test
    void match_shouldUseLastNameAndInitialWhenUnique() {
        RosterPlayer nic = rostered("Nicolas Claxton", "C");
        MatchResult<RosterPlayer> result = matcher.match("Nic Claxton", List.of(nic, rostered("Nikola Vucevic", "C")));

        assertEquals(MatchTier.INITIAL, result.tier);
        assertSame(nic, result.candidate);
    }

    @Test
    void match_shouldReturnNoneWhenInitialTierIsAmbiguous() {
        List<RosterPlayer> pool = List.of(
                rostered("Jalen Williams", "SG,SF"),
                rostered("Jaylin Williams", "PF,C")
        );

        MatchResult<RosterPlayer> result = matcher.match("J. Williams", pool);

        assertEquals(MatchTier.NONE, result.tier);
        assertFalse(result.candidate().isPresent());
        assertTrue(result.note.startsWith("ambiguous"));
    }

    @Test
    void match_shouldReturnNoneForDuplicateExactKeys() {
        List<RosterPlayer> pool = List.of(
                rostered("Marcus Morris", "PF"),
                rostered("Marcus Morris Sr.", "PF")
        );

        MatchResult<RosterPlayer> result = matcher.match("Marcus Morris", pool);

        assertEquals(MatchTier.NONE, result.tier);
    }

    @Test
    void match_shouldReturnNoneForUnknownNameAndEmptyPool() {
        assertEquals(MatchTier.NONE, matcher.match("Unknown Prospect", List.of(rostered("Naz Reid", "C"))).tier);
        assertEquals("empty pool", matcher.match("Naz Reid", List.<RosterPlayer>of()).note);
    }

    @Test
    void match_shouldBeIdempotent() {
        List<RosterPlayer> pool = List.of(
                rostered("Jalen Williams", "SG,SF"),
                rostered("Jaylin Williams", "PF,C"),
                rostered("Jalen Brunson", "PG")
        );
        for (String name : List.of("Jalen Williams", "J. Williams", "Jalen Brunsen", "Nobody Here")) {
            MatchResult<RosterPlayer> first = matcher.match(name, pool);
            MatchResult<RosterPlayer> second = matcher.match(name, pool);
            assertEquals(first.tier, second.tier);
            assertSame(first.candidate, second.candidate);
            assertEquals(first.similarity, second.similarity);
        }
    }

    @Test
    void match_shouldRejectBlankSourceName() {
        assertThrows(InvalidNameException.class, () -> matcher.match(" ", List.of(rostered("Naz Reid", "C"))));
    }
}
