package com.minutebars.runner;

import com.minutebars.core.RunTelemetry;
import com.minutebars.data.FetchResult;
import com.minutebars.data.MarketDataException;
import com.minutebars.data.MarketDataSource;
import com.minutebars.db.BarPersister;
import com.minutebars.db.PersistResult;
import com.minutebars.model.BackfillSummary;
import com.minutebars.model.SymbolReport;
import com.minutebars.model.SymbolStatus;
import com.minutebars.model.SyncPlan;
import com.minutebars.model.SyncWindow;
import com.minutebars.quality.CleanResult;
import com.minutebars.quality.QualityFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one backfill pass: for each symbol, in order, plan, fetch, clean, persist and count.
 *
 * <p>Symbols are processed strictly one at a time. A symbol whose watermark already covers today is
 * counted as skipped and costs no request and no pause. Every other symbol is followed by the
 * inter-symbol pause when another symbol comes after it. Fetch and storage failures are absorbed
 * per symbol; {@link #run} itself does not throw. An interrupt ends the pass after the current
 * symbol, and the summary covers the symbols processed so far.
 */
public final class BackfillRunner implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BackfillRunner.class);

    private final MarketDataSource source;
    private final SyncPlanner planner;
    private final QualityFilter filter;
    private final BarPersister persister;
    private final Duration interSymbolDelay;
    private final Pause pause;
    private final Clock clock;
    private RunTelemetry telemetry;

    public BackfillRunner(
            MarketDataSource source,
            SyncPlanner planner,
            QualityFilter filter,
            BarPersister persister,
            Duration interSymbolDelay,
            Pause pause,
            Clock clock
    ) {
        this.source = source;
        this.planner = planner;
        this.filter = filter;
        this.persister = persister;
        this.interSymbolDelay = interSymbolDelay == null ? Duration.ZERO : interSymbolDelay;
        this.pause = pause == null ? Pause.SLEEP : pause;
        this.clock = clock == null ? Clock.systemDefaultZone() : clock;
    }

    public BackfillSummary run(List<String> symbols) {
        List<String> ordered = symbols == null ? List.of() : symbols;
        telemetry = new RunTelemetry(clock);
        LocalDate today = LocalDate.now(clock);
        log.info("Starting market data backfill: {} symbols, today={}", ordered.size(), today);

        List<SymbolReport> reports = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            String symbol = ordered.get(i);
            log.info("[{}/{}] Processing {}...", i + 1, ordered.size(), symbol);
            SymbolReport report = processSymbol(symbol, today);
            reports.add(report);
            if (report.status() != SymbolStatus.ALREADY_CURRENT && i < ordered.size() - 1) {
                pauseBeforeNextSymbol();
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Backfill interrupted, stopping after {} of {} symbols", i + 1, ordered.size());
                break;
            }
        }

        telemetry.finish();
        BackfillSummary summary = new BackfillSummary(reports);
        log.info("Backfill complete! Total rows inserted: {}", summary.insertedCount);
        log.info("Summary: {}", summary.summaryText());
        log.info("Telemetry:\n{}", telemetry.getSummary());
        return summary;
    }

    public RunTelemetry telemetry() {
        return telemetry;
    }

    private SymbolReport processSymbol(String symbol, LocalDate today) {
        telemetry.startStep(RunTelemetry.STEP_PLAN);
        SyncPlan plan = planner.plan(symbol, today);
        telemetry.endStep(RunTelemetry.STEP_PLAN, 1, plan.alreadyCurrent ? 0 : 1, 0);
        if (plan.alreadyCurrent) {
            log.info("{} already current (watermark {}), skipping", symbol, plan.watermark);
            return SymbolReport.alreadyCurrent(symbol);
        }
        SyncWindow window = plan.window;
        log.info("{} {} window={}", symbol, plan.initialBackfill() ? "initial backfill" : "incremental", window);

        FetchResult fetched = fetch(symbol, window);
        if (fetched.failed()) {
            return new SymbolReport(symbol, SymbolStatus.FETCH_FAILED, window, 0, 0, 0, 0,
                    fetched.errorCategory + ": " + fetched.error);
        }

        telemetry.startStep(RunTelemetry.STEP_CLEAN);
        CleanResult cleaned = filter.clean(fetched.bars, symbol);
        telemetry.endStep(RunTelemetry.STEP_CLEAN, cleaned.inputCount, cleaned.bars.size(), 0);
        if (cleaned.removed() > 0) {
            log.info("{} validated {} of {} rows, removed {} ({})",
                    symbol, cleaned.bars.size(), cleaned.inputCount, cleaned.removed(), cleaned.removedText());
        }

        PersistResult persisted = persist(symbol, cleaned);
        SymbolStatus status;
        if (!persisted.committed) {
            status = SymbolStatus.PERSIST_FAILED;
        } else if (fetched.status == FetchResult.Status.EMPTY) {
            status = SymbolStatus.EMPTY;
        } else {
            status = SymbolStatus.SYNCED;
        }
        log.info("Inserted {} rows for {} ({})", persisted.inserted, symbol, persisted);
        return new SymbolReport(
                symbol,
                status,
                window,
                fetched.bars.size(),
                cleaned.bars.size(),
                cleaned.removed(),
                persisted.inserted,
                persisted.error
        );
    }

    private FetchResult fetch(String symbol, SyncWindow window) {
        telemetry.startStep(RunTelemetry.STEP_FETCH);
        FetchResult result;
        try {
            result = FetchResult.success(source.fetch(symbol, window.fromDate(), window.toDate()));
            log.info("Fetched {} rows for {}", result.bars.size(), symbol);
        } catch (MarketDataException e) {
            log.error("Failed to fetch {} [{}]: {}", symbol, e.category(), e.getMessage());
            result = FetchResult.failed(e.getMessage(), e.category());
        } catch (RuntimeException e) {
            log.error("Failed to fetch {}: {}", symbol, e.getMessage(), e);
            result = FetchResult.failed(String.valueOf(e.getMessage()), "other");
        }
        telemetry.endStep(RunTelemetry.STEP_FETCH, 1, result.bars.size(), result.failed() ? 1 : 0);
        return result;
    }

    private PersistResult persist(String symbol, CleanResult cleaned) {
        telemetry.startStep(RunTelemetry.STEP_PERSIST);
        PersistResult result;
        try {
            result = persister.persist(cleaned.bars);
        } catch (RuntimeException e) {
            log.error("Insert failed for {}: {}", symbol, e.getMessage(), e);
            result = PersistResult.rolledBack(cleaned.bars.size(), String.valueOf(e.getMessage()));
        }
        telemetry.endStep(RunTelemetry.STEP_PERSIST, cleaned.bars.size(), result.inserted,
                result.committed ? result.failedRows : 1);
        return result;
    }

    private void pauseBeforeNextSymbol() {
        telemetry.startStep(RunTelemetry.STEP_PAUSE);
        try {
            pause.await(interSymbolDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Rate-limit pause interrupted");
        }
        telemetry.endStep(RunTelemetry.STEP_PAUSE, 0, 0, 0);
    }

    @Override
    public void close() throws Exception {
        if (persister instanceof AutoCloseable) {
            ((AutoCloseable) persister).close();
        }
    }
}
