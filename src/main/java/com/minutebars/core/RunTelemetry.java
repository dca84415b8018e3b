package com.minutebars.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step timings and item counts of a single backfill run.
 */
public final class RunTelemetry {
    public static final String STEP_PLAN = "PLAN";
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_CLEAN = "CLEAN";
    public static final String STEP_PERSIST = "PERSIST";
    public static final String STEP_PAUSE = "PAUSE";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final Clock clock;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Long> stepStartsNanos = new LinkedHashMap<>();

    public RunTelemetry(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.startedAt = this.clock.instant();
    }

    public void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.put(key, System.nanoTime());
    }

    public void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Long startedNanos = stepStartsNanos.remove(key);
        if (startedNanos != null) {
            stat.elapsedNanos += Math.max(0L, System.nanoTime() - startedNanos);
        }
        stat.calls++;
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        errorsTotal += (int) Math.max(0L, errorCount);
    }

    public void finish() {
        if (finishedAt == null) {
            finishedAt = clock.instant();
        }
    }

    public int errorsTotal() {
        return errorsTotal;
    }

    public List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(
                    stat.name,
                    stat.calls,
                    stat.elapsedNanos / 1_000_000L,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
        }
        return out;
    }

    public String getSummary() {
        Instant end = finishedAt == null ? clock.instant() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepRecord step : stepRecords()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s calls=%d elapsed_ms=%d in=%d out=%d err=%d",
                    step.name(),
                    step.calls(),
                    step.elapsedMs(),
                    step.itemsIn(),
                    step.itemsOut(),
                    step.errorCount()
            )).append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static final class StepStat {
        private final String name;
        private long calls;
        private long elapsedNanos;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long calls,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount
    ) {
    }
}
