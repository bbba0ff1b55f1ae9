package com.hoopsbot.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step timings and counters for one lineup run, printed as a summary at the end.
 */
public final class RunTelemetry {
    public static final String STEP_LOAD = "LOAD";
    public static final String STEP_MATCH = "MATCH";
    public static final String STEP_ASSIGN = "ASSIGN";
    public static final String STEP_WAIVER = "WAIVER";
    public static final String STEP_IL = "IL";
    public static final String STEP_REPORT = "REPORT";
    public static final String STEP_MAIL_SEND = "MAIL_SEND";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String trigger;
    private final Clock clock;
    private final Instant startedAt;
    private Instant finishedAt;

    private int rosterSize;
    private int scoreRows;
    private int matchedRows;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String trigger, Clock clock) {
        this.trigger = blankTo(trigger, "manual");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
    }

    public String trigger() {
        return trigger;
    }

    public void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public void endStep(String name, long itemsIn, long itemsOut, long errorCount, String optionalNote) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        stat.elapsedMs += elapsedMs;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, optionalNote);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public void setMatchStats(int rosterSize, int scoreRows, int matchedRows) {
        this.rosterSize = Math.max(0, rosterSize);
        this.scoreRows = Math.max(0, scoreRows);
        this.matchedRows = Math.max(0, matchedRows);
    }

    public void incrementErrors(int count) {
        if (count > 0) {
            errorsTotal += count;
        }
    }

    public int errorsTotal() {
        return errorsTotal;
    }

    public void finish() {
        if (finishedAt == null) {
            finishedAt = clock.instant();
        }
    }

    public List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.optionalNote));
        }
        return out;
    }

    public String getSummary() {
        Instant end = finishedAt == null ? clock.instant() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("roster_size=").append(rosterSize).append('\n');
        sb.append("score_rows=").append(scoreRows).append(" matched=").append(matchedRows).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote);
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private static void appendNote(StepStat stat, String optionalNote) {
        if (optionalNote == null || optionalNote.trim().isEmpty()) {
            return;
        }
        String note = optionalNote.trim();
        if (stat.optionalNote.isEmpty()) {
            stat.optionalNote = note;
        } else if (!stat.optionalNote.contains(note)) {
            stat.optionalNote = stat.optionalNote + "; " + note;
        }
    }

    private static String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
