package com.minutebars.model;

import java.util.List;
import java.util.Locale;

/**
 * Totals of one orchestrator pass over the symbol list.
 */
public final class BackfillSummary {
    public final int validatedCount;
    public final int insertedCount;
    public final int skippedCount;
    public final int fetchedCount;
    public final int removedCount;
    public final int failedSymbols;
    public final List<SymbolReport> symbols;

    public BackfillSummary(List<SymbolReport> reports) {
        this.symbols = reports == null ? List.of() : List.copyOf(reports);
        int validated = 0;
        int inserted = 0;
        int skipped = 0;
        int fetched = 0;
        int removed = 0;
        int failed = 0;
        for (SymbolReport report : symbols) {
            validated += report.validated();
            inserted += report.inserted();
            fetched += report.fetched();
            removed += report.removed();
            if (report.status() == SymbolStatus.ALREADY_CURRENT) {
                skipped++;
            }
            if (report.status() == SymbolStatus.FETCH_FAILED || report.status() == SymbolStatus.PERSIST_FAILED) {
                failed++;
            }
        }
        this.validatedCount = validated;
        this.insertedCount = inserted;
        this.skippedCount = skipped;
        this.fetchedCount = fetched;
        this.removedCount = removed;
        this.failedSymbols = failed;
    }

    public String summaryText() {
        return String.format(
                Locale.US,
                "symbols=%d fetched=%d validated=%d removed=%d inserted=%d skipped=%d failed_symbols=%d",
                symbols.size(),
                fetchedCount,
                validatedCount,
                removedCount,
                insertedCount,
                skippedCount,
                failedSymbols
        );
    }
}
