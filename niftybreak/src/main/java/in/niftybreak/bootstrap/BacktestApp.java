package in.niftybreak.bootstrap;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.config.StrategyConfigLoader;
import in.niftybreak.service.backtest.BacktestDriver;
import in.niftybreak.service.backtest.BacktestReport;
import in.niftybreak.service.backtest.BacktestResult;
import in.niftybreak.service.backtest.HistoricalBar;
import in.niftybreak.service.backtest.HistoricalBarCsvReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Backtest command line.
 *
 * Usage: --data file.csv [--start yyyy-MM-dd] [--end yyyy-MM-dd] [--out dir] [--parallel n]
 *
 * Exit codes: 0 success, 1 bad arguments or unreadable input, 2 unexpected failure.
 */
public final class BacktestApp {
    private static final Logger log = LoggerFactory.getLogger(BacktestApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT = 1;
    static final int EXIT_FAILURE = 2;

    private static final String USAGE =
        "Usage: BacktestApp --data <csv> [--start yyyy-MM-dd] [--end yyyy-MM-dd] [--out <dir>] [--parallel <n>]";
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Supplier<StrategyConfig> configSource;
    private final PrintStream out;

    public BacktestApp() {
        this(() -> new StrategyConfigLoader().load(), System.out);
    }

    BacktestApp(Supplier<StrategyConfig> configSource, PrintStream out) {
        this.configSource = configSource;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new BacktestApp().run(args));
    }

    public int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            out.println(USAGE);
            return EXIT_INPUT;
        }

        try {
            StrategyConfig config = configSource.get();
            List<String> errors = config.validate();
            if (!errors.isEmpty()) {
                log.error("❌ INVALID CONFIG: {}", errors);
                return EXIT_INPUT;
            }

            List<HistoricalBar> bars;
            try {
                bars = new HistoricalBarCsvReader(config.zone()).read(options.data());
            } catch (IOException | IllegalArgumentException e) {
                log.error("Cannot read backtest data {}: {}", options.data(), e.getMessage());
                return EXIT_INPUT;
            }

            BacktestResult result = new BacktestDriver(config)
                .run(bars, options.start(), options.end(), options.parallel());

            BacktestReport report = new BacktestReport(config.zone());
            Files.createDirectories(options.outDir());
            String stamp = LocalDateTime.now(config.zone()).format(FILE_STAMP);
            Path tradesFile = options.outDir().resolve("backtest_trades_" + stamp + ".csv");
            Path summaryFile = options.outDir().resolve("backtest_summary_" + stamp + ".json");
            report.writeTradesCsv(result, tradesFile);
            report.writeSummaryJson(result, summaryFile);

            out.print(report.summaryTable(result));
            log.info("Trades written to {}", tradesFile);
            log.info("Summary written to {}", summaryFile);
            return EXIT_OK;
        } catch (IOException | RuntimeException e) {
            log.error("Backtest failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    record Options(Path data, LocalDate start, LocalDate end, Path outDir, int parallel) {

        static Options parse(String[] args) {
            Path data = null;
            LocalDate start = null;
            LocalDate end = null;
            Path outDir = Path.of(".");
            int parallel = 1;

            for (int i = 0; i < args.length; i++) {
                String flag = args[i];
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + flag);
                }
                String value = args[++i];
                switch (flag) {
                    case "--data" -> data = Path.of(value);
                    case "--start" -> start = date(flag, value);
                    case "--end" -> end = date(flag, value);
                    case "--out" -> outDir = Path.of(value);
                    case "--parallel" -> parallel = positive(flag, value);
                    default -> throw new IllegalArgumentException("Unknown option " + flag);
                }
            }

            if (data == null) {
                throw new IllegalArgumentException("--data is required");
            }
            if (start != null && end != null && start.isAfter(end)) {
                throw new IllegalArgumentException("--start " + start + " is after --end " + end);
            }
            return new Options(data, start, end, outDir, parallel);
        }

        private static LocalDate date(String flag, String value) {
            try {
                return LocalDate.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(flag + " expects yyyy-MM-dd, got " + value, e);
            }
        }

        private static int positive(String flag, String value) {
            try {
                int n = Integer.parseInt(value);
                if (n < 1) {
                    throw new IllegalArgumentException(flag + " must be at least 1, got " + value);
                }
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " expects a number, got " + value, e);
            }
        }
    }
}
