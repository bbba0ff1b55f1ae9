package com.hoopsbot.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T17:00:00Z"), ZoneOffset.UTC);

    @Test
    void endStep_shouldAccumulateCountsAndNotes() {
        RunTelemetry telemetry = new RunTelemetry(" ", CLOCK);

        telemetry.startStep("match");
        telemetry.endStep("match", 9, 8, 0, "unmatched=1");
        telemetry.startStep(RunTelemetry.STEP_MATCH);
        telemetry.endStep(RunTelemetry.STEP_MATCH, 1, 1, 2, "unmatched=1");

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();
        assertEquals(1, records.size());
        RunTelemetry.StepRecord match = records.get(0);
        assertEquals("MATCH", match.name());
        assertEquals(10, match.itemsIn());
        assertEquals(9, match.itemsOut());
        assertEquals(2, match.errorCount());
        assertEquals("unmatched=1", match.optionalNote());
        assertEquals(2, telemetry.errorsTotal());
        assertEquals("manual", telemetry.trigger());
    }

    @Test
    void getSummary_shouldListStepsInOrder() {
        RunTelemetry telemetry = new RunTelemetry("dry-run", CLOCK);
        telemetry.setMatchStats(14, 9, 8);
        telemetry.startStep(RunTelemetry.STEP_LOAD);
        telemetry.endStep(RunTelemetry.STEP_LOAD, 1, 17, 0);
        telemetry.startStep(RunTelemetry.STEP_ASSIGN);
        telemetry.endStep(RunTelemetry.STEP_ASSIGN, 14, 10, 0, "empty=[C]");
        telemetry.incrementErrors(1);
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.startsWith("trigger=dry-run\n"));
        assertTrue(summary.contains("total_elapsed_ms=0\n"));
        assertTrue(summary.contains("roster_size=14\n"));
        assertTrue(summary.contains("score_rows=9 matched=8\n"));
        assertTrue(summary.contains("errors_total=1\n"));
        assertTrue(summary.indexOf("  LOAD ") < summary.indexOf("  ASSIGN "));
        assertTrue(summary.endsWith("note=empty=[C]"));
    }
}
