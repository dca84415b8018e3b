package com.minutebars.app;

import com.minutebars.config.BackfillSettings;
import com.minutebars.config.Config;
import com.minutebars.data.FmpMarketDataSource;
import com.minutebars.db.Database;
import com.minutebars.db.MarketBarDao;
import com.minutebars.db.MigrationRunner;
import com.minutebars.model.BackfillSummary;
import com.minutebars.quality.QualityFilter;
import com.minutebars.runner.BackfillRunner;
import com.minutebars.runner.Pause;
import com.minutebars.runner.SyncPlanner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class BackfillApplication {
    private static final Logger log = LogManager.getLogger(BackfillApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    public BackfillApplication() {
        this(System.out, System.err);
    }

    BackfillApplication(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exit = new BackfillApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        return run(args, System.getenv(), Path.of(".").toAbsolutePath().normalize());
    }

    int run(String[] args, Map<String, String> env, Path workingDir) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args == null ? new String[0] : args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            printHelp(options);
            return EXIT_OK;
        }

        BackfillSettings settings;
        try {
            Path configFile = cmd.hasOption("config") ? workingDir.resolve(cmd.getOptionValue("config")) : null;
            Config config = Config.load(workingDir, configFile, env);
            applyOverrides(cmd, config);
            settings = BackfillSettings.from(config);
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_USAGE;
        }
        log.info("Settings: {}", settings);

        Connection connection;
        try {
            Database database = new Database(settings.db);
            connection = database.connect();
            log.info("Database connection established: {}", database.maskedJdbcUrl());
        } catch (SQLException | IllegalArgumentException e) {
            log.error("Database connection failed: {}", e.getMessage());
            err.println("FATAL: " + e.getMessage());
            return EXIT_FATAL;
        }

        MarketBarDao dao;
        try {
            new MigrationRunner().run(connection);
            dao = new MarketBarDao(connection, settings.db.insertChunkSize);
        } catch (SQLException | RuntimeException e) {
            log.error("Table creation failed: {}", e.getMessage());
            err.println("FATAL: " + e.getMessage());
            closeQuietly(connection);
            return EXIT_FATAL;
        }

        if (cmd.hasOption("status")) {
            try (MarketBarDao store = dao) {
                printStatus(store, settings);
                return EXIT_OK;
            } catch (SQLException e) {
                log.error("Status query failed: {}", e.getMessage());
                err.println("FATAL: " + e.getMessage());
                return EXIT_FATAL;
            }
        }

        BackfillRunner runner = new BackfillRunner(
                new FmpMarketDataSource(settings),
                new SyncPlanner(dao, settings.initialBackfillDays),
                new QualityFilter(settings.marketZone),
                dao,
                settings.interSymbolDelay,
                Pause.SLEEP,
                Clock.system(settings.marketZone)
        );
        return runBackfill(runner, settings.symbols);
    }

    int runBackfill(BackfillRunner runner, List<String> symbols) {
        BackfillSummary summary;
        try {
            summary = runner.run(symbols);
        } catch (RuntimeException e) {
            log.error("Backfill aborted: {}", e.getMessage(), e);
            err.println("FATAL: " + e.getMessage());
            closeRunner(runner);
            return EXIT_FATAL;
        }
        closeRunner(runner);
        out.println("Backfill complete: " + summary.summaryText());
        return EXIT_OK;
    }

    private void closeRunner(BackfillRunner runner) {
        try {
            runner.close();
        } catch (Exception e) {
            log.warn("Failed to close database connection: {}", e.getMessage());
        }
    }

    private void printStatus(MarketBarDao dao, BackfillSettings settings) throws SQLException {
        LocalDate today = LocalDate.now(settings.marketZone);
        out.println("symbol     watermark   rows        state");
        for (String symbol : settings.symbols) {
            Optional<LocalDate> watermark = dao.latestDate(symbol);
            long rows = dao.countBars(symbol);
            String state = watermark.isEmpty()
                    ? "no data"
                    : (watermark.get().isBefore(today) ? "behind" : "current");
            out.printf("%-10s %-11s %-11d %s%n", symbol, watermark.map(LocalDate::toString).orElse("-"), rows, state);
        }
    }

    private void applyOverrides(CommandLine cmd, Config config) {
        if (cmd.hasOption("symbols")) {
            config.override("backfill.symbols", cmd.getOptionValue("symbols"));
        }
        if (cmd.hasOption("initial-days")) {
            config.override("backfill.initial_days", cmd.getOptionValue("initial-days"));
        }
        if (cmd.hasOption("delay-ms")) {
            config.override("backfill.inter_symbol_delay_ms", cmd.getOptionValue("delay-ms"));
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("s").longOpt("symbols").hasArg().argName("A,B,C")
                .desc("Symbols to process, in order (default: built-in 50-symbol list)").build());
        options.addOption(Option.builder("d").longOpt("initial-days").hasArg().argName("N")
                .desc("Days to load for a symbol with no stored data (default 30)").build());
        options.addOption(Option.builder().longOpt("delay-ms").hasArg().argName("MS")
                .desc("Pause between symbols in milliseconds (default 500)").build());
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("FILE")
                .desc("Properties file read instead of ./" + Config.FILE_NAME).build());
        options.addOption(Option.builder().longOpt("status")
                .desc("Print each symbol's stored watermark and exit without fetching").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }

    private void printHelp(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        PrintWriter writer = new PrintWriter(out);
        formatter.printHelp(writer, formatter.getWidth(), "minutebars", null, options,
                formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
        writer.flush();
    }

    private void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close database connection: {}", e.getMessage());
        }
    }
}
