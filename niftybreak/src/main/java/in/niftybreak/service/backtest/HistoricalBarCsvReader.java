package in.niftybreak.service.backtest;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the backtest dataset.
 *
 * Columns: datetime, nifty_open, nifty_high, nifty_low, nifty_close,
 * call_open, call_high, call_low, call_close, put_open, put_high, put_low, put_close.
 * datetime is exchange-local "yyyy-MM-dd HH:mm[:ss]", ISO local, or ISO with offset.
 */
public final class HistoricalBarCsvReader {
    private static final Logger log = LoggerFactory.getLogger(HistoricalBarCsvReader.class);

    public static final String INDEX_ID = "INDEX";
    public static final String CALL_ID = "CALL";
    public static final String PUT_ID = "PUT";

    private static final List<String> COLUMNS = List.of(
        "datetime",
        "nifty_open", "nifty_high", "nifty_low", "nifty_close",
        "call_open", "call_high", "call_low", "call_close",
        "put_open", "put_high", "put_low", "put_close");

    private static final DateTimeFormatter SECONDS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter MINUTES = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final ZoneId zone;

    public HistoricalBarCsvReader(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * Read all rows, sorted by timestamp. Malformed rows are skipped with a warning.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if required columns are missing
     */
    public List<HistoricalBar> read(Path file) throws IOException {
        List<HistoricalBar> bars = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new IllegalArgumentException("Empty data file: " + file);
            }
            Map<String, Integer> columns = header(headerLine);

            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    bars.add(parseLine(line.split(",", -1), columns));
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("Skipping line {} of {}: {}", lineNumber, file.getFileName(), e.getMessage());
                }
            }
        }
        bars.sort((a, b) -> a.timestamp().compareTo(b.timestamp()));
        log.info("Loaded {} bars from {} ({} skipped)", bars.size(), file, skipped);
        return bars;
    }

    private static Map<String, Integer> header(String headerLine) {
        Map<String, Integer> columns = new HashMap<>();
        String[] names = headerLine.split(",", -1);
        for (int i = 0; i < names.length; i++) {
            columns.put(names[i].trim().toLowerCase(Locale.ROOT).replace("\uFEFF", ""), i);
        }
        List<String> missing = new ArrayList<>();
        for (String col : COLUMNS) {
            if (!columns.containsKey(col)) {
                missing.add(col);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Data file missing columns: " + missing
                + " (expected " + String.join(",", COLUMNS) + ")");
        }
        return columns;
    }

    private HistoricalBar parseLine(String[] parts, Map<String, Integer> columns) {
        Instant ts = parseTimestamp(value(parts, columns, "datetime"));
        Instant minute = TimeframeType.MINUTE_1.floor(ts);
        Candle index = candle(INDEX_ID, "nifty", minute, parts, columns);
        if (index == null) {
            throw new IllegalArgumentException("index OHLC missing");
        }
        return new HistoricalBar(minute, index,
            candle(CALL_ID, "call", minute, parts, columns),
            candle(PUT_ID, "put", minute, parts, columns));
    }

    private static Candle candle(String id, String prefix, Instant minute, String[] parts, Map<String, Integer> columns) {
        String o = value(parts, columns, prefix + "_open");
        String h = value(parts, columns, prefix + "_high");
        String l = value(parts, columns, prefix + "_low");
        String c = value(parts, columns, prefix + "_close");
        if (o.isEmpty() || h.isEmpty() || l.isEmpty() || c.isEmpty()) {
            return null;
        }
        return new Candle(id, TimeframeType.MINUTE_1, minute,
            new BigDecimal(o), new BigDecimal(h), new BigDecimal(l), new BigDecimal(c));
    }

    private static String value(String[] parts, Map<String, Integer> columns, String name) {
        int idx = columns.get(name);
        return idx < parts.length ? parts[idx].trim() : "";
    }

    Instant parseTimestamp(String raw) {
        String text = raw.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("datetime missing");
        }
        try {
            int t = text.indexOf('T');
            if (t < 0) {
                DateTimeFormatter f = text.length() <= 16 ? MINUTES : SECONDS;
                return LocalDateTime.parse(text, f).atZone(zone).toInstant();
            }
            String time = text.substring(t);
            if (time.endsWith("Z") || time.contains("+") || time.contains("-")) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparseable datetime: " + text, e);
        }
    }
}
