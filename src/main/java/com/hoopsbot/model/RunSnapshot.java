package com.hoopsbot.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one run reads, already parsed. Untouchable flags are applied to the roster.
 */
@Value
public final class RunSnapshot {
    public final Path source;
    public final List<RosterPlayer> roster;
    public final List<FreeAgentPlayer> freeAgents;
    public final ScoreLookup scores;
    public final List<String> untouchables;
    public final Map<String, Integer> gamesRemainingByTeam;

    public RunSnapshot(
            Path source,
            List<RosterPlayer> roster,
            List<FreeAgentPlayer> freeAgents,
            ScoreLookup scores,
            List<String> untouchables,
            Map<String, Integer> gamesRemainingByTeam
    ) {
        this.source = source;
        this.roster = roster == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(roster));
        this.freeAgents = freeAgents == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(freeAgents));
        this.scores = scores == null ? ScoreLookup.of(List.of()) : scores;
        this.untouchables = untouchables == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(untouchables));
        this.gamesRemainingByTeam = gamesRemainingByTeam == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(gamesRemainingByTeam));
    }

    public RunSnapshot withScores(ScoreLookup replacement) {
        return new RunSnapshot(source, roster, freeAgents, replacement, untouchables, gamesRemainingByTeam);
    }
}
