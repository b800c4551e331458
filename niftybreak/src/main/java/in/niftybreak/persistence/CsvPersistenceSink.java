package in.niftybreak.persistence;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Per-day CSV files under the data directory, written on one background
 * thread:
 * - candles_1min_<instrument>_<date>.csv, candles_5min_<instrument>_<date>.csv
 * - trades_<date>.csv
 *
 * A header is written when a file is created. Write failures are logged
 * and never reach the caller.
 */
public final class CsvPersistenceSink implements PersistenceSink {
    private static final Logger log = LoggerFactory.getLogger(CsvPersistenceSink.class);

    private final Path dataDir;
    private final ZoneId zone;
    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "csv-persistence");
        t.setDaemon(true);
        return t;
    });

    public CsvPersistenceSink(Path dataDir, ZoneId zone) {
        this.dataDir = dataDir;
        this.zone = zone;
    }

    @Override
    public void onCandle(Candle candle) {
        LocalDate date = candle.windowStart().atZone(zone).toLocalDate();
        Path file = dataDir.resolve(CandleCsvFormat.fileName(candle.timeframe(), candle.instrumentId(), date));
        submit(file, CandleCsvFormat.HEADER, CandleCsvFormat.format(candle, zone));
    }

    @Override
    public void onTrade(TradeRecord trade) {
        Path file = dataDir.resolve("trades_" + trade.date() + ".csv");
        submit(file, TradeCsvFormat.HEADER, TradeCsvFormat.format(trade, zone));
    }

    private void submit(Path file, String header, String row) {
        try {
            writer.execute(() -> append(file, header, row));
        } catch (RejectedExecutionException e) {
            log.warn("Persistence closed, row for {} not written", file.getFileName());
        }
    }

    private void append(Path file, String header, String row) {
        try {
            Files.createDirectories(file.getParent());
            boolean created = !Files.exists(file);
            try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                if (created) {
                    w.write(header);
                    w.newLine();
                }
                w.write(row);
                w.newLine();
            }
        } catch (IOException e) {
            log.error("Failed to write {}: {}", file, e.getMessage());
        }
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Persistence writer did not drain within 5s");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
