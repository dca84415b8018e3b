package com.minutebars.model;

import java.time.LocalDate;

/**
 * Result of planning one symbol: either a window to fetch or "already current".
 */
public final class SyncPlan {
    public final SyncWindow window;
    public final LocalDate watermark;
    public final boolean alreadyCurrent;

    private SyncPlan(SyncWindow window, LocalDate watermark, boolean alreadyCurrent) {
        this.window = window;
        this.watermark = watermark;
        this.alreadyCurrent = alreadyCurrent;
    }

    public static SyncPlan initialBackfill(SyncWindow window) {
        return new SyncPlan(window, null, false);
    }

    public static SyncPlan incremental(SyncWindow window, LocalDate watermark) {
        return new SyncPlan(window, watermark, false);
    }

    public static SyncPlan alreadyCurrent(LocalDate watermark) {
        return new SyncPlan(null, watermark, true);
    }

    public boolean initialBackfill() {
        return !alreadyCurrent && watermark == null;
    }

    @Override
    public String toString() {
        if (alreadyCurrent) {
            return "ALREADY_CURRENT(watermark=" + watermark + ")";
        }
        return (watermark == null ? "BACKFILL " : "INCREMENTAL ") + window;
    }
}
