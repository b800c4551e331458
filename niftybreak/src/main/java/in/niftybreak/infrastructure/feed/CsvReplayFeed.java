package in.niftybreak.infrastructure.feed;

import in.niftybreak.domain.data.Tick;
import in.niftybreak.infrastructure.common.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Mock market feed for paper trading without broker data.
 *
 * Replays a CSV of timestamp,token,price rows against today's session: each
 * row is emitted when the wall clock reaches its time of day, stamped with
 * today's date. Rows already in the past are skipped and rows for tokens not
 * subscribed at that moment are dropped. Without a replay file the feed
 * connects and stays silent.
 */
public final class CsvReplayFeed implements MarketFeed {
    private static final Logger log = LoggerFactory.getLogger(CsvReplayFeed.class);

    private static final Duration MAX_LATENESS = Duration.ofMinutes(1);

    private final Path file;
    private final ZoneId zone;
    private final Clock clock;
    private final Sleeper sleeper;
    private final TickListener listener;
    private final SubscriptionBook subscriptions = new SubscriptionBook();

    private volatile boolean connected = false;
    private volatile Thread replayThread;

    public CsvReplayFeed(Path file, ZoneId zone, TickListener listener) {
        this(file, zone, Clock.system(zone), Sleeper.SYSTEM, listener);
    }

    public CsvReplayFeed(Path file, ZoneId zone, Clock clock, Sleeper sleeper, TickListener listener) {
        this.file = file;
        this.zone = zone;
        this.clock = clock;
        this.sleeper = sleeper;
        this.listener = listener;
    }

    @Override
    public synchronized void connect() {
        if (connected) {
            return;
        }
        connected = true;
        if (file == null || !Files.isReadable(file)) {
            log.info("[REPLAY] No replay file ({}), mock feed stays silent", file);
            return;
        }
        Thread t = new Thread(this::replay, "csv-replay-feed");
        t.setDaemon(true);
        replayThread = t;
        t.start();
        log.info("[REPLAY] Replaying ticks from {}", file);
    }

    @Override
    public void subscribe(Collection<String> tokens) {
        List<String> added = subscriptions.add(tokens);
        if (!added.isEmpty()) {
            log.info("[REPLAY] Subscribed {} token(s): {}", added.size(), added);
        }
    }

    @Override
    public synchronized void disconnect() {
        connected = false;
        Thread t = replayThread;
        replayThread = null;
        if (t != null) {
            t.interrupt();
        }
        log.info("[REPLAY] Disconnected");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    void replay() {
        List<Row> rows;
        try {
            rows = readRows(file);
        } catch (IOException e) {
            log.error("[REPLAY] Cannot read {}: {}", file, e.getMessage(), e);
            return;
        }

        LocalDate today = LocalDate.now(clock.withZone(zone));
        int emitted = 0;
        for (Row row : rows) {
            if (!connected) {
                break;
            }
            Instant due = LocalDateTime.of(today, row.timeOfDay()).atZone(zone).toInstant();
            Instant now = clock.instant();
            if (due.isBefore(now.minus(MAX_LATENESS))) {
                continue;
            }
            if (due.isAfter(now)) {
                try {
                    sleeper.sleep(Duration.between(now, due));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            if (subscriptions.contains(row.token())) {
                listener.onTick(new Tick(row.token(), row.price(), due));
                emitted++;
            }
        }
        log.info("[REPLAY] Replay finished, {} tick(s) emitted", emitted);
    }

    static List<Row> readRows(Path file) throws IOException {
        List<Row> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            int lineNo = 1;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                String[] fields = line.split(",", -1);
                if (fields.length < 3) {
                    log.warn("[REPLAY] Line {}: expected timestamp,token,price", lineNo);
                    continue;
                }
                try {
                    LocalTime time = LocalDateTime.parse(fields[0].trim().replace(' ', 'T')).toLocalTime();
                    rows.add(new Row(time, fields[1].trim(), new BigDecimal(fields[2].trim())));
                } catch (DateTimeParseException | NumberFormatException e) {
                    log.warn("[REPLAY] Line {} skipped: {}", lineNo, e.getMessage());
                }
            }
        }
        rows.sort(Comparator.comparing(Row::timeOfDay));
        return rows;
    }

    record Row(LocalTime timeOfDay, String token, BigDecimal price) {}
}
