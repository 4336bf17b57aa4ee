package com.staybot.core;

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
 * Step timings and item counts for one agent pass.
 */
public final class RunTelemetry {
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_FILTER = "FILTER";
    public static final String STEP_UPSERT = "UPSERT";
    public static final String STEP_NEW_ITEMS = "NEW_ITEMS";
    public static final String STEP_PRICE_DROPS = "PRICE_DROPS";
    public static final String STEP_NOTIFY = "NOTIFY";
    public static final String STEP_RECORD = "RECORD";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String passName;
    private final String trigger;
    private final Clock clock;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String passName, String trigger, Clock clock) {
        this.passName = blankTo(passName, "search");
        this.trigger = blankTo(trigger, "manual");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
    }

    public synchronized String passName() {
        return passName;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Deque<Long> stack = stepStartsNanos.get(key);
        long startedNanos = stack == null || stack.isEmpty() ? 0L : stack.pop();
        if (startedNanos > 0L) {
            stat.elapsedMs += Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        }
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        errorsTotal += (int) Math.max(0L, errorCount);
        if (note != null && !note.isBlank() && !stat.note.contains(note.trim())) {
            stat.note = stat.note.isEmpty() ? note.trim() : stat.note + "; " + note.trim();
        }
    }

    public synchronized void incrementErrors(int count) {
        if (count > 0) {
            errorsTotal += count;
        }
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = clock.instant();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? clock.instant() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.note));
        }
        return out;
    }

    /**
     * Single-line summary for the pass log.
     */
    public synchronized String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("pass=").append(passName)
                .append(" trigger=").append(trigger)
                .append(" started_at=").append(ISO.format(startedAt))
                .append(" total_elapsed_ms=").append(totalElapsedMs())
                .append(" errors_total=").append(errorsTotal)
                .append(" steps=[");
        boolean first = true;
        for (StepStat stat : steps.values()) {
            if (!first) {
                sb.append(", ");
            }
            first = false;
            sb.append(String.format(Locale.US, "%s ms=%d in=%d out=%d err=%d",
                    stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount));
            if (!stat.note.isEmpty()) {
                sb.append(" note=").append(stat.note);
            }
        }
        return sb.append(']').toString();
    }

    private String sanitizeStepName(String name) {
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
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount, String note) {
    }
}
