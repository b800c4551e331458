package in.niftybreak.persistence;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.TradeRecord;
import in.niftybreak.domain.model.TradeSide;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CsvPersistenceSink and the CSV row formats.
 *
 * Tests:
 * - Per-day file naming with a single header
 * - Candle row round trip through the stored format
 * - Trade row layout
 * - Writes after close are ignored
 */
class CsvPersistenceSinkTest {

    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);
    // 10:00 IST
    private static final Instant T = Instant.parse("2024-01-15T04:30:00Z");

    @TempDir
    Path dir;

    private static TradeRecord trade() {
        return new TradeRecord("CALL_20240115_101000_105", DAY, TradeSide.CALL, "NIFTY2411821300CE", 75,
            T.plusSeconds(600), new BigDecimal("105"), T.plusSeconds(900), new BigDecimal("80"),
            ExitReason.SL_HIT, new BigDecimal("-1875"), new BigDecimal("80"), new BigDecimal("80"), new BigDecimal("105"));
    }

    @Test
    void testCandlesAppendedUnderOneHeader() throws IOException {
        CsvPersistenceSink sink = new CsvPersistenceSink(dir, IST);
        sink.onCandle(Candle.of("256265", TimeframeType.MINUTE_5, T, 21500, 21510, 21490, 21505));
        sink.onCandle(Candle.of("256265", TimeframeType.MINUTE_5, T.plusSeconds(300), 21505, 21520, 21500, 21515));
        sink.close();

        Path file = dir.resolve("candles_5min_256265_2024-01-15.csv");
        List<String> lines = Files.readAllLines(file);

        assertEquals(3, lines.size());
        assertEquals(CandleCsvFormat.HEADER, lines.get(0));
        assertTrue(lines.get(1).startsWith("2024-01-15T10:00:00+05:30,"));
    }

    @Test
    void testTradeLogWritten() throws IOException {
        CsvPersistenceSink sink = new CsvPersistenceSink(dir, IST);
        sink.onTrade(trade());
        sink.close();

        List<String> lines = Files.readAllLines(dir.resolve("trades_2024-01-15.csv"));

        assertEquals(TradeCsvFormat.HEADER, lines.get(0));
        assertEquals("CALL_20240115_101000_105,2024-01-15,CALL,NIFTY2411821300CE,75,"
            + "2024-01-15 10:10:00,105,2024-01-15 10:15:00,80,SL_HIT,-1875,80,80,105", lines.get(1));
    }

    @Test
    void testWritesAfterCloseIgnored() {
        CsvPersistenceSink sink = new CsvPersistenceSink(dir, IST);
        sink.close();

        sink.onTrade(trade());

        assertFalse(Files.exists(dir.resolve("trades_2024-01-15.csv")));
    }

    @Test
    void testStoredCandleParsesBack() {
        Candle candle = Candle.of("C1", TimeframeType.MINUTE_1, T, 105.5, 107, 104, 106.25);

        Optional<Candle> parsed = CandleCsvFormat.parse(CandleCsvFormat.format(candle, IST), "C1", TimeframeType.MINUTE_1);

        assertTrue(parsed.isPresent());
        assertEquals(T, parsed.get().windowStart());
        assertEquals(0, parsed.get().close().compareTo(new BigDecimal("106.25")));
        assertTrue(CandleCsvFormat.parse("garbage,1,2", "C1", TimeframeType.MINUTE_1).isEmpty());
        assertTrue(CandleCsvFormat.parse("2024-01-15T10:00:00+05:30,a,b,c,d", "C1", TimeframeType.MINUTE_1).isEmpty());
    }

    @Test
    void testFileNamePattern() {
        assertEquals("candles_1min_C1_2024-01-15.csv", CandleCsvFormat.fileName(TimeframeType.MINUTE_1, "C1", DAY));
    }
}
