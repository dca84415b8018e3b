package com.minutebars.model;

import java.time.LocalDate;

/**
 * Inclusive date range to request from the provider for one symbol.
 */
public record SyncWindow(LocalDate fromDate, LocalDate toDate) {
    public SyncWindow {
        if (fromDate == null || toDate == null) {
            throw new IllegalArgumentException("window bounds must not be null");
        }
        if (fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("window from " + fromDate + " is after to " + toDate);
        }
    }

    @Override
    public String toString() {
        return fromDate + ".." + toDate;
    }
}
