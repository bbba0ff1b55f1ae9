package com.hoopsbot.ingest;

import com.hoopsbot.model.FreeAgentPlayer;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.RosterStatus;
import com.hoopsbot.model.RunSnapshot;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotLoaderTest {

    // Monday, 2024-01-15 12:00 in New York
    private static final Clock MONDAY = Clock.fixed(Instant.parse("2024-01-15T17:00:00Z"), ZoneOffset.UTC);
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @TempDir
    Path tempDir;

    @Test
    void load_shouldParseSampleSnapshot() throws Exception {
        RunSnapshot snapshot = new SnapshotLoader(150, "", NEW_YORK, MONDAY).load(sample());

        assertEquals(14, snapshot.roster.size());
        assertEquals(3, snapshot.freeAgents.size());
        assertEquals(9, snapshot.scores.records().size());
        assertEquals(List.of("Nikola Jokic"), snapshot.untouchables);

        RosterPlayer jokic = byName(snapshot.roster, "Nikola Jokic");
        assertTrue(jokic.untouchable);
        assertEquals(RosterStatus.ACTIVE, jokic.currentStatus);
        assertEquals(3, jokic.gamesRemainingThisWeek);
        assertEquals(Integer.valueOf(1), jokic.platformRank);
        assertNull(jokic.gameToday);
        assertTrue(jokic.playsToday());

        RosterPlayer brogdon = byName(snapshot.roster, "Malcolm Brogdon");
        assertEquals(RosterStatus.BENCH, brogdon.currentStatus);
        assertEquals("O", brogdon.injuryStatus);
        assertEquals(2, brogdon.gamesRemainingThisWeek);

        assertEquals(RosterStatus.IL, byName(snapshot.roster, "Kristaps Porzingis").currentStatus);
        assertFalse(byName(snapshot.roster, "Anthony Davis").untouchable);
        assertEquals(4, snapshot.gamesRemainingByTeam.get("IND"));
    }

    @Test
    void load_shouldApplyUntouchablesOnlyOnConfiguredWeekday() throws Exception {
        RunSnapshot monday = new SnapshotLoader(150, "monday", NEW_YORK, MONDAY).load(sample());
        RunSnapshot friday = new SnapshotLoader(150, "FRIDAY", NEW_YORK, MONDAY).load(sample());

        assertTrue(byName(monday.roster, "Nikola Jokic").untouchable);
        assertFalse(byName(friday.roster, "Nikola Jokic").untouchable);
        assertTrue(friday.untouchables.isEmpty());
    }

    @Test
    void activeUntouchables_shouldIgnoreUnknownWeekday() {
        SnapshotLoader loader = new SnapshotLoader(150, "someday", NEW_YORK, MONDAY);

        assertTrue(loader.activeUntouchables(new JSONArray(List.of("Nikola Jokic"))).isEmpty());
    }

    @Test
    void activeUntouchables_shouldUseZoneForTheDate() {
        // 03:00 UTC Tuesday is still Monday evening in New York
        Clock lateMonday = Clock.fixed(Instant.parse("2024-01-16T03:00:00Z"), ZoneOffset.UTC);
        SnapshotLoader loader = new SnapshotLoader(150, "MONDAY", NEW_YORK, lateMonday);

        assertEquals(List.of("Nikola Jokic"), loader.activeUntouchables(new JSONArray(List.of("Nikola Jokic", " ", "..."))));
    }

    @Test
    void load_shouldCapFreeAgentsByPlatformRank() throws Exception {
        RunSnapshot snapshot = new SnapshotLoader(2, "", NEW_YORK, MONDAY).load(sample());

        List<String> names = new ArrayList<>();
        for (FreeAgentPlayer freeAgent : snapshot.freeAgents) {
            names.add(freeAgent.displayName());
        }
        assertEquals(List.of("Zion Williamson", "Bennedict Mathurin"), names);
    }

    @Test
    void parse_shouldSkipRecordsWithoutPositions() throws Exception {
        JSONObject root = new JSONObject()
                .put("roster", new JSONArray()
                        .put(new JSONObject().put("name", "Has Positions").put("positions", new JSONArray().put("pg")).put("status", "BN"))
                        .put(new JSONObject().put("name", "No Positions").put("positions", new JSONArray()))
                        .put("not an object"))
                .put("free_agents", new JSONArray()
                        .put(new JSONObject().put("name", "Free Nobody")));

        RunSnapshot snapshot = new SnapshotLoader(150, "", NEW_YORK, MONDAY).parse(tempDir.resolve("inline.json"), root);

        assertEquals(1, snapshot.roster.size());
        assertTrue(snapshot.roster.get(0).eligiblePositions.contains("PG"));
        assertEquals(0, snapshot.roster.get(0).gamesRemainingThisWeek);
        assertTrue(snapshot.freeAgents.isEmpty());
        assertTrue(snapshot.scores.isEmpty());
    }

    @Test
    void parse_shouldReadTodaysScheduleAndPlayingTime() throws Exception {
        JSONObject root = new JSONObject()
                .put("games_today", new JSONArray().put("den").put("BOS"))
                .put("roster", new JSONArray()
                        .put(new JSONObject().put("name", "Plays Tonight").put("positions", new JSONArray().put("C")).put("team", "DEN"))
                        .put(new JSONObject().put("name", "Rest Day").put("positions", new JSONArray().put("PG")).put("team", "LAL"))
                        .put(new JSONObject().put("name", "Late Addition").put("positions", new JSONArray().put("SF"))
                                .put("team", "LAL").put("has_game_today", true)))
                .put("free_agents", new JSONArray()
                        .put(new JSONObject().put("name", "Rotation Wing").put("positions", new JSONArray().put("SF"))
                                .put("mpg", 31.2).put("games_last_30", 11))
                        .put(new JSONObject().put("name", "No Minutes Data").put("positions", new JSONArray().put("PF"))
                                .put("mpg", 0.0)));

        RunSnapshot snapshot = new SnapshotLoader(150, "", NEW_YORK, MONDAY).parse(tempDir.resolve("inline.json"), root);

        assertEquals(Boolean.TRUE, byName(snapshot.roster, "Plays Tonight").gameToday);
        assertEquals(Boolean.FALSE, byName(snapshot.roster, "Rest Day").gameToday);
        assertFalse(byName(snapshot.roster, "Rest Day").playsToday());
        assertEquals(Boolean.TRUE, byName(snapshot.roster, "Late Addition").gameToday);

        FreeAgentPlayer wing = snapshot.freeAgents.get(0);
        assertEquals(31.2, wing.minutesPerGame, 1e-9);
        assertEquals(Integer.valueOf(11), wing.gamesLast30);
        FreeAgentPlayer unknown = snapshot.freeAgents.get(1);
        assertNull(unknown.minutesPerGame);
        assertNull(unknown.gamesLast30);
    }

    @Test
    void load_shouldRejectMalformedSnapshots() throws Exception {
        SnapshotLoader loader = new SnapshotLoader(150, "", NEW_YORK, MONDAY);
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{\"roster\": [", StandardCharsets.UTF_8);
        Path noRoster = tempDir.resolve("no_roster.json");
        Files.writeString(noRoster, "{\"free_agents\": []}", StandardCharsets.UTF_8);

        assertThrows(SnapshotException.class, () -> loader.load(broken));
        assertThrows(SnapshotException.class, () -> loader.load(noRoster));
        assertThrows(SnapshotException.class, () -> loader.load(tempDir.resolve("missing.json")));
    }

    private Path sample() throws URISyntaxException {
        return Paths.get(getClass().getResource("/snapshots/sample_snapshot.json").toURI());
    }

    private static RosterPlayer byName(List<RosterPlayer> roster, String name) {
        for (RosterPlayer player : roster) {
            if (player.displayName().equals(name)) {
                return player;
            }
        }
        throw new AssertionError("no roster player " + name);
    }
}
