package com.hoopsbot.output;

import com.hoopsbot.identity.MatchTier;
import com.hoopsbot.model.IlFlag;
import com.hoopsbot.model.LineupRunOutcome;
import com.hoopsbot.model.RosterPlayer;
import com.hoopsbot.model.SlotAssignment;
import com.hoopsbot.model.WaiverSwap;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text daily report. The text depends only on the outcome, so identical runs render
 * identical reports.
 */
public final class LineupReportBuilder {
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String RULE = "-".repeat(60);

    public String buildSubject(String prefix, LineupRunOutcome outcome) {
        String head = prefix == null || prefix.isBlank() ? "" : prefix.trim() + " ";
        int alerts = outcome.alerts == null ? 0 : outcome.alerts.size();
        return head + "Lineup " + outcome.runDate + (alerts > 0 ? " (" + alerts + " alert" + (alerts == 1 ? "" : "s") + ")" : "");
    }

    public String buildText(LineupRunOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append("HoopsBot lineup report ").append(outcome.runDate).append('\n');
        sb.append(RULE).append('\n');

        if (!outcome.alerts.isEmpty()) {
            sb.append("ALERTS\n");
            for (String alert : outcome.alerts) {
                sb.append("  ! ").append(alert).append('\n');
            }
            sb.append('\n');
        }

        if (!outcome.untouchables.isEmpty()) {
            sb.append("UNTOUCHABLES\n");
            sb.append("  ").append(String.join(", ", outcome.untouchables)).append("\n\n");
        }

        sb.append("ACTIVE LINEUP\n");
        for (SlotAssignment entry : outcome.assignment.active) {
            appendSlot(sb, entry);
        }
        sb.append('\n');

        sb.append("BENCH");
        if (outcome.benchShape != null) {
            sb.append("  [").append(outcome.benchShape.description).append(']');
        }
        sb.append('\n');
        if (outcome.assignment.bench.isEmpty()) {
            sb.append("  (empty)\n");
        }
        for (SlotAssignment entry : outcome.assignment.bench) {
            appendSlot(sb, entry);
        }
        sb.append('\n');

        sb.append("INJURED LIST\n");
        if (outcome.assignment.injured.isEmpty()) {
            sb.append("  (empty)\n");
        }
        for (SlotAssignment entry : outcome.assignment.injured) {
            appendSlot(sb, entry);
        }
        for (IlFlag flag : outcome.ilReport.activateFromIl) {
            sb.append("  > ").append(flag.actionLine).append('\n');
        }
        for (IlFlag flag : outcome.ilReport.moveToIl) {
            sb.append("  > ").append(flag.actionLine).append('\n');
        }
        if (!outcome.assignment.overflow.isEmpty()) {
            sb.append("  overflow: ").append(names(outcome.assignment.overflow)).append('\n');
        }
        sb.append('\n');

        sb.append("WAIVER WIRE (").append(outcome.freeAgentsConsidered).append(" free agents checked)\n");
        if (outcome.swaps.isEmpty()) {
            sb.append("  No upgrades found.\n");
        }
        for (int i = 0; i < outcome.swaps.size(); i++) {
            WaiverSwap swap = outcome.swaps.get(i);
            sb.append(String.format(Locale.US, "  %2d. %s\n", i + 1, swap.describe()));
        }
        sb.append('\n');

        sb.append("MATCHING\n");
        sb.append(String.format(Locale.US, "  exact=%d fuzzy=%d initial=%d unmatched=%d\n",
                tier(outcome, MatchTier.EXACT),
                tier(outcome, MatchTier.FUZZY),
                tier(outcome, MatchTier.INITIAL),
                outcome.unmatchedSourceNames.size()));
        return sb.toString();
    }

    public Path writeReport(Path reportDir, LineupRunOutcome outcome) throws IOException {
        Files.createDirectories(reportDir);
        Path report = reportDir.resolve("lineup_" + FILE_DATE.format(outcome.runDate) + ".txt");
        Files.writeString(report, buildText(outcome), StandardCharsets.UTF_8);

        JSONObject debug = new JSONObject();
        debug.put("run_date", outcome.runDate.toString());
        debug.put("active_filled", outcome.assignment.filledActiveCount());
        debug.put("empty_slots", outcome.assignment.emptySlots);
        debug.put("bench_count", outcome.assignment.bench.size());
        debug.put("il_count", outcome.assignment.injured.size());
        debug.put("swap_count", outcome.swaps.size());
        debug.put("alert_count", outcome.alerts.size());
        debug.put("unmatched_score_rows", outcome.unmatchedSourceNames.size());
        Files.writeString(reportDir.resolve("report_debug.json"), debug.toString(2), StandardCharsets.UTF_8);
        return report;
    }

    private static void appendSlot(StringBuilder sb, SlotAssignment entry) {
        if (entry.isEmpty()) {
            sb.append(String.format(Locale.US, "  %-5s %s\n", entry.slotLabel, "(empty)"));
            return;
        }
        RosterPlayer player = entry.player;
        StringBuilder line = new StringBuilder();
        line.append(String.format(Locale.US, "  %-5s %-26s %-10s %s",
                entry.slotLabel,
                player.displayName(),
                String.join("/", player.eligiblePositions),
                entry.value.describe()));
        if (player.injuryStatus != null && !player.injuryStatus.isEmpty()) {
            line.append(" [").append(player.injuryStatus).append(']');
        }
        if (player.untouchable) {
            line.append(" UNTOUCHABLE");
        }
        if (entry.lowConfidence) {
            line.append(" LOW_CONFIDENCE");
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }

    private static int tier(LineupRunOutcome outcome, MatchTier tier) {
        return outcome.matchTierCounts == null ? 0 : outcome.matchTierCounts.getOrDefault(tier, 0);
    }

    private static String names(List<RosterPlayer> players) {
        StringBuilder sb = new StringBuilder();
        for (RosterPlayer player : players) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(player.displayName());
        }
        return sb.toString();
    }
}
