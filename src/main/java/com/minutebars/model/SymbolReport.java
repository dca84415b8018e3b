package com.minutebars.model;

/**
 * Per-symbol counts for one backfill pass.
 */
public record SymbolReport(
        String symbol,
        SymbolStatus status,
        SyncWindow window,
        int fetched,
        int validated,
        int removed,
        int inserted,
        String error
) {
    public SymbolReport {
        status = status == null ? SymbolStatus.EMPTY : status;
        error = error == null ? "" : error;
    }

    public static SymbolReport alreadyCurrent(String symbol) {
        return new SymbolReport(symbol, SymbolStatus.ALREADY_CURRENT, null, 0, 0, 0, 0, "");
    }
}
