package com.minutebars.runner;

import com.minutebars.db.WatermarkStore;
import com.minutebars.model.SyncPlan;
import com.minutebars.model.SyncWindow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Chooses the fetch window of a symbol from its watermark.
 *
 * <p>No watermark: {@code [today - initialDays, today]}. Watermark {@code W}: {@code [W + 1, today]},
 * or "already current" once {@code W + 1} is after today. An unreadable watermark is treated as absent.
 */
public final class SyncPlanner {
    private static final Logger log = LogManager.getLogger(SyncPlanner.class);

    private final WatermarkStore watermarks;
    private final int initialDays;

    public SyncPlanner(WatermarkStore watermarks, int initialDays) {
        this.watermarks = watermarks;
        this.initialDays = Math.max(0, initialDays);
    }

    public SyncPlan plan(String symbol, LocalDate today) {
        Optional<LocalDate> watermark = readWatermark(symbol);
        if (watermark.isEmpty()) {
            return SyncPlan.initialBackfill(new SyncWindow(today.minusDays(initialDays), today));
        }
        LocalDate from = watermark.get().plusDays(1);
        if (from.isAfter(today)) {
            return SyncPlan.alreadyCurrent(watermark.get());
        }
        return SyncPlan.incremental(new SyncWindow(from, today), watermark.get());
    }

    private Optional<LocalDate> readWatermark(String symbol) {
        try {
            Optional<LocalDate> watermark = watermarks.latestDate(symbol);
            return watermark == null ? Optional.empty() : watermark;
        } catch (SQLException | RuntimeException e) {
            log.warn("Watermark unreadable for {}, planning initial backfill: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}
