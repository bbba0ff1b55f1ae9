package com.hoopsbot.model;

import com.hoopsbot.identity.MatchTier;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Result of one lineup run, handed unchanged to the report and the mailer.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class LineupRunOutcome {
    public final LocalDate runDate;
    public final Path snapshotPath;
    public final List<String> untouchables;
    public final Assignment assignment;
    public final List<WaiverSwap> swaps;
    public final IlReport ilReport;
    public final BenchShape benchShape;
    public final List<String> alerts;
    public final List<String> unmatchedSourceNames;
    public final List<RosterPlayer> unscoredRoster;
    public final Map<MatchTier, Integer> matchTierCounts;
    public final int freeAgentsConsidered;
}
