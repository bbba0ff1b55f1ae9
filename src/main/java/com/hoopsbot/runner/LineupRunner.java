package com.hoopsbot.runner;

import com.hoopsbot.config.Config;
import com.hoopsbot.core.RunTelemetry;
import com.hoopsbot.identity.IdentityMatcher;
import com.hoopsbot.identity.ScoreLinker;
import com.hoopsbot.ingest.ScoreCache;
import com.hoopsbot.ingest.SnapshotException;
import com.hoopsbot.ingest.SnapshotLoader;
import com.hoopsbot.lineup.BenchShapeCheck;
import com.hoopsbot.lineup.SlotAssigner;
import com.hoopsbot.model.Assignment;
import com.hoopsbot.model.BenchShape;
import com.hoopsbot.model.IlReport;
import com.hoopsbot.model.LineupRunOutcome;
import com.hoopsbot.model.RunSnapshot;
import com.hoopsbot.model.ScoreLookup;
import com.hoopsbot.model.WaiverSwap;
import com.hoopsbot.output.AlertBuilder;
import com.hoopsbot.roster.IlAdvisor;
import com.hoopsbot.waiver.WaiverComparator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * One daily pass: load the snapshot, link scores, assign the lineup, then derive IL moves,
 * waiver swaps and alerts. Reporting and mail are left to the caller.
 */
public final class LineupRunner {
    private static final Logger LOG = LogManager.getLogger(LineupRunner.class);

    private final SnapshotLoader loader;
    private final ScoreCache scoreCache;
    private final ScoreLinker linker;
    private final SlotAssigner assigner;
    private final BenchShapeCheck benchShapeCheck;
    private final IlAdvisor ilAdvisor;
    private final WaiverComparator waiverComparator;
    private final AlertBuilder alertBuilder;
    private final ZoneId zone;
    private final Clock clock;
    private final RunTelemetry telemetry;

    public LineupRunner(Config config, Clock clock, RunTelemetry telemetry) {
        this(
                new SnapshotLoader(config, clock),
                config.getBoolean("scores.cache.enabled", true) ? new ScoreCache(config, clock) : null,
                new ScoreLinker(new IdentityMatcher(config)),
                new SlotAssigner(config),
                new BenchShapeCheck(config),
                new IlAdvisor(config),
                new WaiverComparator(config),
                new AlertBuilder(),
                ZoneId.of(config.getString("app.zone", "America/New_York")),
                clock,
                telemetry
        );
    }

    public LineupRunner(
            SnapshotLoader loader,
            ScoreCache scoreCache,
            ScoreLinker linker,
            SlotAssigner assigner,
            BenchShapeCheck benchShapeCheck,
            IlAdvisor ilAdvisor,
            WaiverComparator waiverComparator,
            AlertBuilder alertBuilder,
            ZoneId zone,
            Clock clock,
            RunTelemetry telemetry
    ) {
        this.loader = loader;
        this.scoreCache = scoreCache;
        this.linker = linker;
        this.assigner = assigner;
        this.benchShapeCheck = benchShapeCheck;
        this.ilAdvisor = ilAdvisor;
        this.waiverComparator = waiverComparator;
        this.alertBuilder = alertBuilder;
        this.zone = zone;
        this.clock = clock;
        this.telemetry = telemetry;
    }

    public LineupRunOutcome run(Path snapshotPath) throws SnapshotException {
        telemetryStart(RunTelemetry.STEP_LOAD);
        RunSnapshot snapshot;
        try {
            snapshot = loader.load(snapshotPath);
        } catch (SnapshotException e) {
            telemetryEnd(RunTelemetry.STEP_LOAD, 0, 0, 1, e.getMessage());
            throw e;
        }
        if (scoreCache != null) {
            ScoreLookup scores = scoreCache.resolve(snapshot.scores);
            snapshot = snapshot.withScores(scores);
        }
        telemetryEnd(RunTelemetry.STEP_LOAD, 1, snapshot.roster.size() + snapshot.freeAgents.size(), 0);
        return run(snapshot);
    }

    public LineupRunOutcome run(RunSnapshot snapshot) {
        LocalDate runDate = LocalDate.now(clock.withZone(zone));
        LOG.info("lineup run {} roster={} freeAgents={}", runDate, snapshot.roster.size(), snapshot.freeAgents.size());

        telemetryStart(RunTelemetry.STEP_MATCH);
        ScoreLinker.LinkResult linked = linker.link(snapshot.roster, snapshot.freeAgents, snapshot.scores);
        telemetryEnd(RunTelemetry.STEP_MATCH, snapshot.scores.records().size(), linked.matchedCount(), 0,
                "unmatched=" + linked.unmatchedSourceNames.size());
        if (telemetry != null) {
            telemetry.setMatchStats(snapshot.roster.size(), snapshot.scores.records().size(), linked.matchedCount());
        }

        telemetryStart(RunTelemetry.STEP_ASSIGN);
        Assignment assignment = assigner.assign(linked.roster);
        BenchShape benchShape = benchShapeCheck.check(assignment.benchPlayers());
        telemetryEnd(RunTelemetry.STEP_ASSIGN, linked.roster.size(), assignment.filledActiveCount(), 0,
                assignment.emptySlots.isEmpty() ? "" : "empty=" + assignment.emptySlots);

        telemetryStart(RunTelemetry.STEP_IL);
        IlReport ilReport = ilAdvisor.review(linked.roster, assignment);
        telemetryEnd(RunTelemetry.STEP_IL, linked.roster.size(),
                ilReport.moveToIl.size() + ilReport.activateFromIl.size(), 0);

        telemetryStart(RunTelemetry.STEP_WAIVER);
        List<WaiverSwap> swaps = waiverComparator.findUpgrades(assignment, linked.freeAgents);
        telemetryEnd(RunTelemetry.STEP_WAIVER, linked.freeAgents.size(), swaps.size(), 0);

        List<String> alerts = alertBuilder.build(assignment, ilReport, benchShape, linked.unscoredRoster);
        LOG.info("lineup run {} done: swaps={} alerts={}", runDate, swaps.size(), alerts.size());

        return LineupRunOutcome.builder()
                .runDate(runDate)
                .snapshotPath(snapshot.source)
                .untouchables(snapshot.untouchables)
                .assignment(assignment)
                .swaps(swaps)
                .ilReport(ilReport)
                .benchShape(benchShape)
                .alerts(List.copyOf(alerts))
                .unmatchedSourceNames(linked.unmatchedSourceNames)
                .unscoredRoster(linked.unscoredRoster)
                .matchTierCounts(linked.tierCounts)
                .freeAgentsConsidered(linked.freeAgents.size())
                .build();
    }

    private void telemetryStart(String stepName) {
        if (telemetry == null) {
            return;
        }
        telemetry.startStep(stepName);
    }

    private void telemetryEnd(String stepName, long itemsIn, long itemsOut, long errorCount) {
        telemetryEnd(stepName, itemsIn, itemsOut, errorCount, "");
    }

    private void telemetryEnd(String stepName, long itemsIn, long itemsOut, long errorCount, String optionalNote) {
        if (telemetry == null) {
            return;
        }
        telemetry.endStep(stepName, itemsIn, itemsOut, errorCount, optionalNote);
    }
}
