package in.niftybreak.bootstrap;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.service.backtest.BacktestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the backtest command line.
 *
 * Tests:
 * - Argument parsing and exit codes
 * - Report files written on success
 * - Invalid configuration and unreadable input
 */
class BacktestAppTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();

    private BacktestApp app(StrategyConfig config) {
        return new BacktestApp(() -> config, new PrintStream(console, true, StandardCharsets.UTF_8));
    }

    private Path dataFile() throws IOException {
        Path data = tmp.resolve("data.csv");
        BacktestFixtures.writeCsv(data, BacktestFixtures.singleStopOutDay(DAY));
        return data;
    }

    private List<Path> outputs(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.sorted().toList();
        }
    }

    @Test
    void testSuccessfulRunWritesReports() throws IOException {
        Path out = tmp.resolve("reports");

        int code = app(StrategyConfig.defaults()).run(new String[] {
            "--data", dataFile().toString(), "--out", out.toString(), "--parallel", "2"});

        assertEquals(BacktestApp.EXIT_OK, code);
        List<Path> files = outputs(out);
        assertEquals(2, files.size());
        assertTrue(files.get(0).getFileName().toString().startsWith("backtest_summary_"));
        assertTrue(files.get(1).getFileName().toString().startsWith("backtest_trades_"));
        String trades = Files.readString(files.get(1));
        assertTrue(trades.contains("CALL_20240115_101000_105"), trades);
        assertFalse(console.toString(StandardCharsets.UTF_8).isBlank(), "Summary printed");
    }

    @Test
    void testMissingDataFlag() {
        int code = app(StrategyConfig.defaults()).run(new String[] {"--out", tmp.toString()});

        assertEquals(BacktestApp.EXIT_INPUT, code);
        assertTrue(console.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void testUnreadableDataFile() {
        int code = app(StrategyConfig.defaults()).run(new String[] {
            "--data", tmp.resolve("missing.csv").toString(), "--out", tmp.toString()});

        assertEquals(BacktestApp.EXIT_INPUT, code);
    }

    @Test
    void testInvalidConfigRefused() throws IOException {
        StrategyConfig bad = StrategyConfig.builder().lotSize(0).build();

        int code = app(bad).run(new String[] {"--data", dataFile().toString(), "--out", tmp.toString()});

        assertEquals(BacktestApp.EXIT_INPUT, code);
    }

    @Test
    void testOptionsParsing() {
        BacktestApp.Options options = BacktestApp.Options.parse(new String[] {
            "--data", "bars.csv", "--start", "2024-01-01", "--end", "2024-01-31", "--parallel", "4"});

        assertEquals(Path.of("bars.csv"), options.data());
        assertEquals(LocalDate.of(2024, 1, 1), options.start());
        assertEquals(LocalDate.of(2024, 1, 31), options.end());
        assertEquals(Path.of("."), options.outDir());
        assertEquals(4, options.parallel());
    }

    @Test
    void testOptionsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> BacktestApp.Options.parse(new String[] {"--data", "a.csv", "--bogus", "x"}));
        assertThrows(IllegalArgumentException.class,
            () -> BacktestApp.Options.parse(new String[] {"--data"}));
        assertThrows(IllegalArgumentException.class,
            () -> BacktestApp.Options.parse(new String[] {"--data", "a.csv", "--parallel", "0"}));
        assertThrows(IllegalArgumentException.class,
            () -> BacktestApp.Options.parse(new String[] {"--data", "a.csv", "--start", "15-01-2024"}));
        assertThrows(IllegalArgumentException.class, () -> BacktestApp.Options.parse(new String[] {
            "--data", "a.csv", "--start", "2024-02-01", "--end", "2024-01-01"}));
    }
}
