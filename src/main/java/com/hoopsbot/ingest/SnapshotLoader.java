package com.hoopsbot.ingest;

import com.hoopsbot.config.Config;
import com.hoopsbot.identity.InvalidNameException;
import com.hoopsbot.identity.NameNormalizer;
import com.hoopsbot.model.FreeAgentPlayer;
import com.hoopsbot.model.PlayerIdentity;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.RosterStatus;
import com.hoopsbot.model.RunSnapshot;
import com.hoopsbot.model.ScoreLookup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads the run snapshot JSON.
 *
 * <p>Malformed files raise {@link SnapshotException}. Individual records with an unusable name
 * or no positions are skipped with a warning and the rest of the snapshot is kept.
 */
public final class SnapshotLoader {
    private static final Logger LOG = LogManager.getLogger(SnapshotLoader.class);

    private final int maxFreeAgents;
    private final String untouchablesWeekday;
    private final ZoneId zone;
    private final Clock clock;

    public SnapshotLoader(Config config, Clock clock) {
        this(
                config.getInt("snapshot.max_free_agents", 150),
                config.getString("untouchables.weekday", ""),
                ZoneId.of(config.getString("app.zone", "America/New_York")),
                clock
        );
    }

    public SnapshotLoader(int maxFreeAgents, String untouchablesWeekday, ZoneId zone, Clock clock) {
        this.maxFreeAgents = maxFreeAgents;
        this.untouchablesWeekday = untouchablesWeekday == null ? "" : untouchablesWeekday.trim();
        this.zone = zone;
        this.clock = clock;
    }

    public RunSnapshot load(Path file) throws SnapshotException {
        if (file == null || !Files.isRegularFile(file)) {
            throw new SnapshotException("snapshot file not found: " + file);
        }
        String body;
        try {
            body = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SnapshotException("failed to read snapshot " + file, e);
        }
        try {
            return parse(file, new JSONObject(body));
        } catch (JSONException e) {
            throw new SnapshotException("malformed snapshot " + file + ": " + e.getMessage(), e);
        }
    }

    RunSnapshot parse(Path source, JSONObject root) throws SnapshotException {
        JSONArray rosterRows = root.optJSONArray("roster");
        if (rosterRows == null) {
            throw new SnapshotException("snapshot has no 'roster' array: " + source);
        }

        Map<String, Integer> games = parseGames(root.optJSONObject("games_remaining_by_team"));
        Set<String> teamsToday = teamsPlayingToday(root.optJSONArray("games_today"));
        List<String> untouchables = activeUntouchables(root.optJSONArray("untouchables"));
        Set<String> untouchableKeys = new HashSet<>();
        for (String name : untouchables) {
            untouchableKeys.add(NameNormalizer.normalize(name));
        }

        List<RosterPlayer> roster = new ArrayList<>();
        for (int i = 0; i < rosterRows.length(); i++) {
            JSONObject row = rosterRows.optJSONObject(i);
            if (row == null) {
                LOG.warn("roster row {} is not an object, skipped", i);
                continue;
            }
            try {
                PlayerIdentity identity = PlayerIdentity.of(row.optString("name", ""));
                Set<String> positions = positions(row.optJSONArray("positions"));
                if (positions.isEmpty()) {
                    LOG.warn("roster player '{}' has no eligible positions, skipped", identity.displayName);
                    continue;
                }
                String team = team(row);
                roster.add(RosterPlayer.builder()
                        .identity(identity)
                        .eligiblePositions(positions)
                        .currentStatus(RosterStatus.parse(row.optString("status", "")))
                        .untouchable(untouchableKeys.contains(identity.normalizedKey))
                        .injuryStatus(injuryStatus(row))
                        .team(team)
                        .platformRank(ScoreRows.optPositiveInt(row, "platform_rank"))
                        .gamesRemainingThisWeek(games.getOrDefault(team, 0))
                        .gameToday(gameToday(row, team, teamsToday))
                        .build());
            } catch (InvalidNameException e) {
                LOG.warn("roster row {} skipped: {}", i, e.getMessage());
            }
        }

        List<FreeAgentPlayer> freeAgents = new ArrayList<>();
        JSONArray faRows = root.optJSONArray("free_agents");
        if (faRows != null) {
            for (int i = 0; i < faRows.length(); i++) {
                JSONObject row = faRows.optJSONObject(i);
                if (row == null) {
                    LOG.warn("free agent row {} is not an object, skipped", i);
                    continue;
                }
                try {
                    PlayerIdentity identity = PlayerIdentity.of(row.optString("name", ""));
                    Set<String> positions = positions(row.optJSONArray("positions"));
                    if (positions.isEmpty()) {
                        LOG.warn("free agent '{}' has no eligible positions, skipped", identity.displayName);
                        continue;
                    }
                    String team = team(row);
                    freeAgents.add(FreeAgentPlayer.builder()
                            .identity(identity)
                            .eligiblePositions(positions)
                            .injuryStatus(injuryStatus(row))
                            .team(team)
                            .platformRank(ScoreRows.optPositiveInt(row, "platform_rank"))
                            .gamesRemainingThisWeek(games.getOrDefault(team, 0))
                            .minutesPerGame(optMinutes(row))
                            .gamesLast30(ScoreRows.optPositiveInt(row, "games_last_30"))
                            .build());
                } catch (InvalidNameException e) {
                    LOG.warn("free agent row {} skipped: {}", i, e.getMessage());
                }
            }
        }
        freeAgents = capFreeAgents(freeAgents);

        ScoreLookup scores = ScoreLookup.of(ScoreRows.parse(root.optJSONArray("scores"), "snapshot"));

        LOG.info("snapshot {}: roster={} freeAgents={} scores={} untouchables={} teamsWithGames={} teamsToday={}",
                source, roster.size(), freeAgents.size(), scores.records().size(),
                untouchables.size(), games.size(), teamsToday == null ? "unknown" : teamsToday.size());
        return new RunSnapshot(source, roster, freeAgents, scores, untouchables, games);
    }

    /**
     * Untouchable names apply only on the configured weekday, in the configured zone. With no
     * weekday configured they always apply.
     */
    List<String> activeUntouchables(JSONArray names) {
        List<String> out = new ArrayList<>();
        if (names == null) {
            return out;
        }
        if (!untouchablesWeekday.isEmpty()) {
            DayOfWeek today = LocalDate.now(clock.withZone(zone)).getDayOfWeek();
            DayOfWeek wanted;
            try {
                wanted = DayOfWeek.valueOf(untouchablesWeekday.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOG.warn("untouchables.weekday '{}' is not a weekday, untouchables ignored", untouchablesWeekday);
                return out;
            }
            if (today != wanted) {
                LOG.info("untouchables apply on {} only, today is {}", wanted, today);
                return out;
            }
        }
        for (int i = 0; i < names.length(); i++) {
            String name = names.optString(i, "").trim();
            if (name.isEmpty()) {
                continue;
            }
            try {
                NameNormalizer.normalize(name);
                out.add(name);
            } catch (InvalidNameException e) {
                LOG.warn("untouchable entry {} skipped: {}", i, e.getMessage());
            }
        }
        return out;
    }

    private List<FreeAgentPlayer> capFreeAgents(List<FreeAgentPlayer> freeAgents) {
        if (maxFreeAgents <= 0 || freeAgents.size() <= maxFreeAgents) {
            return freeAgents;
        }
        List<FreeAgentPlayer> sorted = new ArrayList<>(freeAgents);
        sorted.sort(Comparator.comparing(
                (FreeAgentPlayer fa) -> fa.platformRank,
                Comparator.nullsLast(Comparator.naturalOrder())));
        LOG.info("free agents capped at {} of {} by platform rank", maxFreeAgents, freeAgents.size());
        return new ArrayList<>(sorted.subList(0, maxFreeAgents));
    }

    private static Map<String, Integer> parseGames(JSONObject node) {
        Map<String, Integer> out = new TreeMap<>();
        if (node == null) {
            return out;
        }
        for (String team : node.keySet()) {
            int count = node.optInt(team, 0);
            out.put(team.trim().toUpperCase(Locale.ROOT), Math.max(0, count));
        }
        return out;
    }

    /**
     * Null when the snapshot carries no schedule for today.
     */
    private static Set<String> teamsPlayingToday(JSONArray node) {
        if (node == null) {
            return null;
        }
        Set<String> out = new HashSet<>();
        for (int i = 0; i < node.length(); i++) {
            String team = node.optString(i, "").trim().toUpperCase(Locale.ROOT);
            if (!team.isEmpty()) {
                out.add(team);
            }
        }
        return out;
    }

    private static Boolean gameToday(JSONObject row, String team, Set<String> teamsToday) {
        if (row.has("has_game_today") && !row.isNull("has_game_today")) {
            return row.optBoolean("has_game_today", false);
        }
        if (teamsToday == null) {
            return null;
        }
        return !team.isEmpty() && teamsToday.contains(team);
    }

    private static Set<String> positions(JSONArray node) {
        Set<String> out = new LinkedHashSet<>();
        if (node == null) {
            return out;
        }
        for (int i = 0; i < node.length(); i++) {
            String position = node.optString(i, "").trim().toUpperCase(Locale.ROOT);
            if (!position.isEmpty()) {
                out.add(position);
            }
        }
        return out;
    }

    private static String team(JSONObject row) {
        return row.optString("team", "").trim().toUpperCase(Locale.ROOT);
    }

    private static Double optMinutes(JSONObject row) {
        if (!row.has("mpg") || row.isNull("mpg")) {
            return null;
        }
        double value = row.optDouble("mpg", 0.0);
        return value > 0.0 ? value : null;
    }

    private static String injuryStatus(JSONObject row) {
        return row.optString("injury_status", "").trim().toUpperCase(Locale.ROOT);
    }
}
