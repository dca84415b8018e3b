package com.minutebars.app;

import com.minutebars.db.BarPersister;
import com.minutebars.db.PersistResult;
import com.minutebars.model.ValidatedBar;
import com.minutebars.quality.QualityFilter;
import com.minutebars.runner.BackfillRunner;
import com.minutebars.runner.SyncPlanner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackfillApplicationTest {

    @TempDir
    Path workDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final BackfillApplication app = new BackfillApplication(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));

    @Test
    void helpShouldPrintUsageAndSucceed() {
        int exit = app.run(new String[]{"--help"}, Map.of(), workDir);

        assertEquals(BackfillApplication.EXIT_OK, exit);
        String usage = out.toString(StandardCharsets.UTF_8);
        assertTrue(usage.contains("--symbols"));
        assertTrue(usage.contains("--initial-days"));
        assertTrue(usage.contains("--status"));
    }

    @Test
    void unknownOptionShouldBeAUsageError() {
        int exit = app.run(new String[]{"--bogus"}, Map.of(), workDir);

        assertEquals(BackfillApplication.EXIT_USAGE, exit);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("ERROR"));
    }

    @Test
    void missingCredentialsShouldBeAConfigurationError() {
        int exit = app.run(new String[]{"-s", "AAPL"}, Map.of("DB_HOST", "localhost"), workDir);

        assertEquals(BackfillApplication.EXIT_USAGE, exit);
        String message = err.toString(StandardCharsets.UTF_8);
        assertTrue(message.contains("FMP_API_KEY"));
        assertTrue(message.contains("DB_PASSWORD"));
    }

    @Test
    void badInitialDaysShouldBeAConfigurationError() {
        Map<String, String> env = Map.of(
                "FMP_API_KEY", "key",
                "DB_HOST", "localhost",
                "DB_NAME", "market",
                "DB_USER", "loader",
                "DB_PASSWORD", "pw");

        int exit = app.run(new String[]{"--initial-days", "many"}, env, workDir);

        assertEquals(BackfillApplication.EXIT_USAGE, exit);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("backfill.initial_days"));
    }

    @Test
    void unexpectedRunFailureShouldExitFatal() {
        Clock broken = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneId.of("America/New_York");
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                throw new IllegalStateException("clock unavailable");
            }
        };
        ClosablePersister persister = new ClosablePersister(false);

        int exit = app.runBackfill(runner(persister, broken), List.of("AAPL"));

        assertEquals(BackfillApplication.EXIT_FATAL, exit);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("clock unavailable"));
        assertTrue(persister.closed);
    }

    @Test
    void closeFailureShouldNotFailACompletedRun() {
        ClosablePersister persister = new ClosablePersister(true);
        Clock clock = Clock.fixed(Instant.parse("2024-03-15T20:00:00Z"), ZoneId.of("America/New_York"));

        int exit = app.runBackfill(runner(persister, clock), List.of("AAPL"));

        assertEquals(BackfillApplication.EXIT_OK, exit);
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Backfill complete: symbols=1"));
        assertTrue(persister.closed);
    }

    @Test
    void missingConfigFileShouldBeAConfigurationError() {
        int exit = app.run(new String[]{"-c", "nope.properties"}, Map.of(), workDir);

        assertEquals(BackfillApplication.EXIT_USAGE, exit);
    }

    private static BackfillRunner runner(ClosablePersister persister, Clock clock) {
        return new BackfillRunner(
                (symbol, from, to) -> List.of(),
                new SyncPlanner(symbol -> Optional.empty(), 30),
                new QualityFilter(ZoneId.of("America/New_York")),
                persister,
                Duration.ZERO,
                duration -> {
                },
                clock);
    }

    private static final class ClosablePersister implements BarPersister, AutoCloseable {
        private final boolean failOnClose;
        boolean closed;

        private ClosablePersister(boolean failOnClose) {
            this.failOnClose = failOnClose;
        }

        @Override
        public PersistResult persist(List<ValidatedBar> bars) {
            return PersistResult.nothing();
        }

        @Override
        public void close() throws SQLException {
            closed = true;
            if (failOnClose) {
                throw new SQLException("connection already closed");
            }
        }
    }
}
