package in.niftybreak.infrastructure.history;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.persistence.CandleCsvFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Historical bars from the candle files written by CsvPersistenceSink.
 * Used when no broker history API is configured (mock data phase).
 */
public final class StoredCandleHistoricalProvider implements HistoricalDataProvider {
    private static final Logger log = LoggerFactory.getLogger(StoredCandleHistoricalProvider.class);

    private final Path dataDir;
    private final ZoneId zone;

    public StoredCandleHistoricalProvider(Path dataDir, ZoneId zone) {
        this.dataDir = dataDir;
        this.zone = zone;
    }

    @Override
    public CompletableFuture<List<Candle>> fetch(String instrumentId, Instant from, Instant to, TimeframeType timeframe) {
        try {
            return CompletableFuture.completedFuture(read(instrumentId, from, to, timeframe));
        } catch (UncheckedIOException e) {
            return CompletableFuture.failedFuture(e.getCause());
        }
    }

    private List<Candle> read(String instrumentId, Instant from, Instant to, TimeframeType timeframe) {
        List<Candle> result = new ArrayList<>();
        LocalDate last = to.atZone(zone).toLocalDate();
        for (LocalDate d = from.atZone(zone).toLocalDate(); !d.isAfter(last); d = d.plusDays(1)) {
            Path file = dataDir.resolve(CandleCsvFormat.fileName(timeframe, instrumentId, d));
            if (!Files.isReadable(file)) {
                log.debug("No stored candles at {}", file);
                continue;
            }
            try {
                List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
                for (int i = 1; i < lines.size(); i++) {
                    Optional<Candle> candle = CandleCsvFormat.parse(lines.get(i), instrumentId, timeframe);
                    candle.filter(c -> !c.windowStart().isBefore(from) && c.windowStart().isBefore(to))
                        .ifPresent(result::add);
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        result.sort(Comparator.comparing(Candle::windowStart));
        log.info("Loaded {} stored {} bars for {} [{}, {})", result.size(), timeframe.getLabel(), instrumentId, from, to);
        return result;
    }
}
