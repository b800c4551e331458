package in.niftybreak.persistence;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Row format of the per-day candle files.
 *
 * candles_1min_<instrument>_<yyyy-MM-dd>.csv:
 * timestamp,open,high,low,close with timestamp as ISO offset date-time.
 */
public final class CandleCsvFormat {
    private static final Logger log = LoggerFactory.getLogger(CandleCsvFormat.class);

    public static final String HEADER = "timestamp,open,high,low,close";

    private CandleCsvFormat() {
    }

    public static String fileName(TimeframeType timeframe, String instrumentId, LocalDate date) {
        return "candles_" + timeframe.getLabel() + "_" + instrumentId + "_" + date + ".csv";
    }

    public static String format(Candle candle, ZoneId zone) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(candle.windowStart().atZone(zone)) + ","
            + candle.open().toPlainString() + ","
            + candle.high().toPlainString() + ","
            + candle.low().toPlainString() + ","
            + candle.close().toPlainString();
    }

    public static Optional<Candle> parse(String line, String instrumentId, TimeframeType timeframe) {
        String[] f = line.split(",", -1);
        if (f.length < 5) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Candle(instrumentId, timeframe,
                OffsetDateTime.parse(f[0].trim()).toInstant(),
                new BigDecimal(f[1].trim()), new BigDecimal(f[2].trim()),
                new BigDecimal(f[3].trim()), new BigDecimal(f[4].trim())));
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("Skipping malformed candle row '{}': {}", line, e.getMessage());
            return Optional.empty();
        }
    }
}
