package com.minutebars.db;

/**
 * Outcome of persisting one symbol's batch.
 */
public final class PersistResult {
    public final int attempted;
    public final int inserted;
    public final int alreadyPresent;
    public final int failedRows;
    public final boolean committed;
    public final String error;

    private PersistResult(int attempted, int inserted, int failedRows, boolean committed, String error) {
        this.attempted = Math.max(0, attempted);
        this.inserted = Math.max(0, inserted);
        this.failedRows = Math.max(0, failedRows);
        this.alreadyPresent = committed ? Math.max(0, this.attempted - this.inserted - this.failedRows) : 0;
        this.committed = committed;
        this.error = error == null ? "" : error;
    }

    public static PersistResult nothing() {
        return new PersistResult(0, 0, 0, true, "");
    }

    public static PersistResult committed(int attempted, int inserted, int failedRows) {
        return new PersistResult(attempted, inserted, failedRows, true, "");
    }

    /**
     * The whole batch was rolled back; nothing is credited.
     */
    public static PersistResult rolledBack(int attempted, String error) {
        return new PersistResult(attempted, 0, 0, false, error);
    }

    @Override
    public String toString() {
        return "attempted=" + attempted + " inserted=" + inserted + " already_present=" + alreadyPresent
                + " failed_rows=" + failedRows + (committed ? "" : " ROLLED_BACK error=" + error);
    }
}
