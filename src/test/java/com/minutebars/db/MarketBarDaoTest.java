package com.minutebars.db;

import com.minutebars.db.mybatis.MarketBarRow;
import com.minutebars.model.ValidatedBar;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketBarDaoTest {
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private String url;
    private MarketBarDao dao;

    @BeforeEach
    void setUp() throws SQLException {
        url = H2Databases.newUrl();
        dao = new MarketBarDao(H2Databases.openMigrated(url), 2);
    }

    @AfterEach
    void tearDown() throws SQLException {
        dao.close();
    }

    @Test
    void persistShouldBeIdempotentAcrossRuns() throws Exception {
        List<ValidatedBar> bars = List.of(
                bar("AAPL", "2024-03-14T09:30", 170.0),
                bar("AAPL", "2024-03-14T09:31", 170.2),
                bar("AAPL", "2024-03-14T09:32", 170.4)
        );

        PersistResult first = dao.persist(bars);
        PersistResult second = dao.persist(bars);

        assertTrue(first.committed);
        assertEquals(3, first.inserted);
        assertTrue(second.committed);
        assertEquals(0, second.inserted);
        assertEquals(3, second.alreadyPresent);
        assertEquals(3L, dao.countBars("AAPL"));
    }

    @Test
    void persistShouldInsertOnlyNewRowsOfOverlappingBatch() throws Exception {
        dao.persist(List.of(bar("MSFT", "2024-03-14T09:30", 410.0)));

        PersistResult result = dao.persist(List.of(
                bar("MSFT", "2024-03-14T09:30", 410.0),
                bar("MSFT", "2024-03-14T09:31", 410.5),
                bar("MSFT", "2024-03-14T09:32", 411.0)
        ));

        assertEquals(2, result.inserted);
        assertEquals(1, result.alreadyPresent);
        assertEquals(3L, dao.countBars("MSFT"));
    }

    @Test
    void rowRejectedByStorageShouldBeSkippedWithoutLosingTheRest() throws Exception {
        PersistResult result = dao.persist(List.of(
                bar("AAPL", "2024-03-14T09:30", 170.0),
                bar("SYMBOLTOOLONG", "2024-03-14T09:30", 1.0),
                bar("AAPL", "2024-03-14T09:31", 170.1)
        ));

        assertTrue(result.committed);
        assertEquals(2, result.inserted);
        assertEquals(1, result.failedRows);
        assertEquals(2L, dao.countBars("AAPL"));
        assertEquals(0L, dao.countBars("SYMBOLTOOLONG"));
    }

    @Test
    void commitFailureShouldRollBackTheWholeBatch() throws Exception {
        Connection raw = DriverManager.getConnection(url, "sa", "");
        Connection failingCommit = (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                (proxy, method, args) -> {
                    if ("commit".equals(method.getName())) {
                        throw new SQLException("commit refused");
                    }
                    try {
                        return method.invoke(raw, args);
                    } catch (InvocationTargetException e) {
                        throw e.getTargetException();
                    }
                });

        try (MarketBarDao failing = new MarketBarDao(failingCommit, 500)) {
            PersistResult result = failing.persist(List.of(
                    bar("NVDA", "2024-03-14T09:30", 880.0),
                    bar("NVDA", "2024-03-14T09:31", 881.0)
            ));

            assertFalse(result.committed);
            assertEquals(0, result.inserted);
            assertEquals(0, result.alreadyPresent);
            assertTrue(result.error.contains("commit refused"));
        }
        assertEquals(0L, dao.countBars("NVDA"));
    }

    @Test
    void watermarkShouldFollowTheLatestStoredDate() throws Exception {
        assertEquals(Optional.empty(), dao.latestDate("AAPL"));

        dao.persist(List.of(
                bar("AAPL", "2024-03-14T15:59", 171.0),
                bar("AAPL", "2024-03-15T09:30", 172.0)
        ));
        assertEquals(Optional.of(LocalDate.of(2024, 3, 15)), dao.latestDate("AAPL"));

        dao.persist(List.of(bar("AAPL", "2024-03-01T10:00", 165.0)));
        assertEquals(Optional.of(LocalDate.of(2024, 3, 15)), dao.latestDate("AAPL"));
        assertEquals(Optional.empty(), dao.latestDate("MSFT"));
    }

    @Test
    void loadBarsShouldReturnStoredValuesInTimeOrder() throws Exception {
        List<ValidatedBar> bars = new ArrayList<>();
        bars.add(bar("AMD", "2024-03-14T09:31", 180.25));
        bars.add(bar("AMD", "2024-03-14T09:30", 180.0));
        dao.persist(bars);

        List<MarketBarRow> rows = dao.loadBars("AMD");

        assertEquals(2, rows.size());
        assertEquals(bars.get(1).barTime.toInstant(), rows.get(0).getBarTime().toInstant());
        assertEquals(LocalDate.of(2024, 3, 14), rows.get(0).getTradeDate());
        assertEquals(180.25, rows.get(1).getClosePrice(), 1e-9);
        assertEquals(1_000L, rows.get(1).getVolume());
    }

    @Test
    void emptyBatchShouldBeANoOp() {
        PersistResult result = dao.persist(List.of());

        assertTrue(result.committed);
        assertEquals(0, result.attempted);
        assertEquals(0, result.inserted);
    }

    private static ValidatedBar bar(String symbol, String localTime, double close) {
        OffsetDateTime barTime = LocalDateTime.parse(localTime).atZone(NEW_YORK).toOffsetDateTime();
        return new ValidatedBar(symbol, barTime, barTime.toLocalDate(), close, close + 0.5, close - 0.5, close, 1_000L);
    }
}
