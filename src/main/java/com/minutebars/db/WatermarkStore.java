package com.minutebars.db;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Latest calendar date with at least one persisted bar, derived from the stored rows themselves.
 */
public interface WatermarkStore {

    Optional<LocalDate> latestDate(String symbol) throws SQLException;
}
