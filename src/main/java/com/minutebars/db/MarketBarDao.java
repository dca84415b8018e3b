package com.minutebars.db;

import com.minutebars.db.mybatis.MarketBarMapper;
import com.minutebars.db.mybatis.MarketBarRow;
import com.minutebars.db.mybatis.MyBatisSupport;
import com.minutebars.model.ValidatedBar;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bar store over the run's single connection.
 *
 * <p>Writes are insert-if-absent keyed by (symbol, bar_time); the table's unique constraint is the
 * idempotency backstop. Each {@link #persist} call is one transaction. Rows go in as multi-row
 * chunks, each under a savepoint; a chunk that fails is replayed row by row so one bad row is
 * skipped without aborting the rest.
 */
public final class MarketBarDao implements WatermarkStore, BarPersister, AutoCloseable {
    private static final Logger log = LogManager.getLogger(MarketBarDao.class);

    private final Connection connection;
    private final SqlSession session;
    private final MarketBarMapper mapper;
    private final int chunkSize;

    public MarketBarDao(Connection connection, int chunkSize) {
        this.connection = connection;
        this.session = MyBatisSupport.openSession(connection);
        this.mapper = session.getMapper(MarketBarMapper.class);
        this.chunkSize = Math.max(1, chunkSize);
    }

    @Override
    public Optional<LocalDate> latestDate(String symbol) throws SQLException {
        try {
            return Optional.ofNullable(mapper.selectLatestTradeDate(symbol));
        } catch (PersistenceException e) {
            throw asSqlException(e);
        }
    }

    public long countBars(String symbol) throws SQLException {
        try {
            return mapper.countBars(symbol);
        } catch (PersistenceException e) {
            throw asSqlException(e);
        }
    }

    public List<MarketBarRow> loadBars(String symbol) throws SQLException {
        try {
            return mapper.selectBars(symbol);
        } catch (PersistenceException e) {
            throw asSqlException(e);
        }
    }

    @Override
    public PersistResult persist(List<ValidatedBar> bars) {
        if (bars == null || bars.isEmpty()) {
            return PersistResult.nothing();
        }
        String symbol = bars.get(0).symbol;
        boolean previousAutoCommit;
        try {
            previousAutoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            log.error("Insert failed for {}: cannot open transaction: {}", symbol, e.getMessage());
            return PersistResult.rolledBack(bars.size(), e.getMessage());
        }

        try {
            int inserted = 0;
            int failedRows = 0;
            for (int from = 0; from < bars.size(); from += chunkSize) {
                List<ValidatedBar> chunk = bars.subList(from, Math.min(bars.size(), from + chunkSize));
                int[] outcome = insertChunk(symbol, chunk);
                inserted += outcome[0];
                failedRows += outcome[1];
            }
            connection.commit();
            return PersistResult.committed(bars.size(), inserted, failedRows);
        } catch (SQLException | PersistenceException e) {
            rollback(symbol);
            log.error("Insert failed for {}, batch of {} rolled back: {}", symbol, bars.size(), e.getMessage());
            return PersistResult.rolledBack(bars.size(), e.getMessage());
        } finally {
            restoreAutoCommit(previousAutoCommit);
        }
    }

    /**
     * @return {inserted, failed rows}
     */
    private int[] insertChunk(String symbol, List<ValidatedBar> chunk) throws SQLException {
        List<MarketBarRow> rows = new ArrayList<>(chunk.size());
        for (ValidatedBar bar : chunk) {
            rows.add(toRow(bar));
        }
        Savepoint savepoint = connection.setSavepoint();
        try {
            int inserted = mapper.insertAllIfAbsent(rows);
            connection.releaseSavepoint(savepoint);
            return new int[]{inserted, 0};
        } catch (PersistenceException e) {
            connection.rollback(savepoint);
            log.warn("Bulk insert of {} rows for {} failed, isolating rows: {}", rows.size(), symbol, rootMessage(e));
        }

        int inserted = 0;
        int failed = 0;
        for (MarketBarRow row : rows) {
            Savepoint rowSavepoint = connection.setSavepoint();
            try {
                inserted += mapper.insertIfAbsent(row);
                connection.releaseSavepoint(rowSavepoint);
            } catch (PersistenceException e) {
                connection.rollback(rowSavepoint);
                failed++;
                log.warn("Skipped row for {} at {}: {}", row.getSymbol(), row.getBarTime(), rootMessage(e));
            }
        }
        return new int[]{inserted, failed};
    }

    @Override
    public void close() throws SQLException {
        try {
            session.close();
        } finally {
            connection.close();
        }
    }

    private static MarketBarRow toRow(ValidatedBar bar) {
        return MarketBarRow.builder()
                .symbol(bar.symbol)
                .barTime(bar.barTime)
                .tradeDate(bar.tradeDate)
                .openPrice(bar.open)
                .highPrice(bar.high)
                .lowPrice(bar.low)
                .closePrice(bar.close)
                .volume(bar.volume)
                .build();
    }

    private void rollback(String symbol) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed for {}: {}", symbol, e.getMessage());
        }
    }

    private void restoreAutoCommit(boolean previous) {
        try {
            if (!connection.isClosed() && connection.getAutoCommit() != previous) {
                connection.setAutoCommit(previous);
            }
        } catch (SQLException e) {
            log.warn("failed to restore auto-commit: {}", e.getMessage());
        }
    }

    private static SQLException asSqlException(PersistenceException e) {
        Throwable cause = e.getCause();
        if (cause instanceof SQLException) {
            return (SQLException) cause;
        }
        return new SQLException(e.getMessage(), e);
    }

    private static String rootMessage(Throwable t) {
        Throwable current = t;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message == null ? current.getClass().getSimpleName() : message.replaceAll("\\s+", " ").trim();
    }
}
