package com.hoopsbot.output;

import com.hoopsbot.identity.MatchTier;
import com.hoopsbot.model.Assignment;
import com.hoopsbot.model.BenchCategory;
import com.hoopsbot.model.BenchShape;
import com.hoopsbot.model.IlReport;
import com.hoopsbot.model.LineupRunOutcome;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.SlotAssignment;
import com.hoopsbot.model.ValuePhase;
import com.hoopsbot.model.WaiverSwap;
import com.hoopsbot.value.ValueModel;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.hoopsbot.model.PlayerFixtures.freeAgent;
import static com.hoopsbot.model.PlayerFixtures.rosterBuilder;
import static com.hoopsbot.model.PlayerFixtures.scored;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineupReportBuilderTest {

    private final ValueModel valueModel = new ValueModel(10_000.0, 999);
    private final LineupReportBuilder builder = new LineupReportBuilder();

    @TempDir
    Path tempDir;

    @Test
    void buildSubject_shouldCountAlerts() {
        assertEquals("[HoopsBot] Lineup 2024-01-15 (1 alert)", builder.buildSubject("[HoopsBot]", outcome(List.of("check IL"))));
        assertEquals("Lineup 2024-01-15", builder.buildSubject(" ", outcome(List.of())));
    }

    @Test
    void buildText_shouldRenderEverySection() {
        String text = builder.buildText(outcome(List.of("check IL")));

        assertTrue(text.startsWith("HoopsBot lineup report 2024-01-15\n"));
        assertTrue(text.contains("ALERTS\n  ! check IL\n"));
        assertTrue(text.contains("UNTOUCHABLES\n  Star Center\n"));
        assertTrue(text.contains("  C     Star Center                C          score=8.00 bonus=10000 UNTOUCHABLE\n"));
        assertTrue(text.contains("  PG    (empty)\n"));
        assertTrue(text.contains("BENCH  [G: 1/1 (OK)]\n"));
        assertTrue(text.contains("INJURED LIST\n  (empty)\n"));
        assertTrue(text.contains("WAIVER WIRE (4 free agents checked)\n"));
        assertTrue(text.contains("   1. Add Pickup Guard (score=6.00), drop Bench Guard [BN] (score=3.00): +3.00\n"));
        assertTrue(text.endsWith("MATCHING\n  exact=2 fuzzy=1 initial=0 unmatched=1\n"));
    }

    @Test
    void buildText_shouldOmitEmptyAlertSection() {
        String text = builder.buildText(outcome(List.of()));

        assertTrue(!text.contains("ALERTS"));
    }

    @Test
    void writeReport_shouldWriteTextAndDebugJson() throws Exception {
        LineupRunOutcome outcome = outcome(List.of("check IL"));

        Path report = builder.writeReport(tempDir.resolve("outputs"), outcome);

        assertEquals("lineup_20240115.txt", report.getFileName().toString());
        assertEquals(builder.buildText(outcome), Files.readString(report, StandardCharsets.UTF_8));
        JSONObject debug = new JSONObject(Files.readString(tempDir.resolve("outputs/report_debug.json"), StandardCharsets.UTF_8));
        assertEquals(1, debug.getInt("active_filled"));
        assertEquals(1, debug.getInt("swap_count"));
        assertEquals("PG", debug.getJSONArray("empty_slots").getString(0));
    }

    private LineupRunOutcome outcome(List<String> alerts) {
        RosterPlayer star = rosterBuilder("Star Center", "C")
                .untouchable(true)
                .scoreRecord(scored("Star Center", "C", 8.0).scoreRecord)
                .build();
        RosterPlayer benchGuard = scored("Bench Guard", "PG", 1.0);
        SlotAssignment center = SlotAssignment.builder()
                .slotLabel("C").slotIndex(0).phase(ValuePhase.STABLE)
                .player(star).value(valueModel.computeValue(star, ValuePhase.STABLE))
                .build();
        SlotAssignment emptyPoint = SlotAssignment.builder()
                .slotLabel("PG").slotIndex(1).phase(ValuePhase.STABLE)
                .build();
        SlotAssignment bench = SlotAssignment.builder()
                .slotLabel("BN").slotIndex(0)
                .player(benchGuard).value(valueModel.computeValue(benchGuard, ValuePhase.STABLE))
                .build();
        Assignment assignment = new Assignment(List.of(center, emptyPoint), List.of(bench), List.of(), List.of(), List.of("PG"));

        WaiverSwap swap = WaiverSwap.builder()
                .freeAgent(freeAgent("Pickup Guard", "PG", 2.0, 3))
                .replaces(benchGuard)
                .valueDelta(3.0)
                .replacedSlotLabel("BN")
                .freeAgentValue(valueModel.weeklyValue(freeAgent("Pickup Guard", "PG", 2.0, 3)))
                .replacedValue(valueModel.weeklyValue(benchGuard))
                .build();

        return LineupRunOutcome.builder()
                .runDate(LocalDate.of(2024, 1, 15))
                .snapshotPath(tempDir.resolve("snapshot.json"))
                .untouchables(List.of("Star Center"))
                .assignment(assignment)
                .swaps(List.of(swap))
                .ilReport(IlReport.empty())
                .benchShape(new BenchShape(Map.of(BenchCategory.G, 1), Map.of(BenchCategory.G, 1), true, "G: 1/1 (OK)"))
                .alerts(alerts)
                .unmatchedSourceNames(List.of("Unknown Prospect"))
                .unscoredRoster(List.of())
                .matchTierCounts(Map.of(MatchTier.EXACT, 2, MatchTier.FUZZY, 1))
                .freeAgentsConsidered(4)
                .build();
    }
}
