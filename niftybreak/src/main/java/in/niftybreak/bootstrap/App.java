package in.niftybreak.bootstrap;

import in.niftybreak.config.ConnectionSettings;
import in.niftybreak.config.StrategyConfig;
import in.niftybreak.config.StrategyConfigLoader;
import in.niftybreak.config.TradingPhase;
import in.niftybreak.infrastructure.feed.CsvReplayFeed;
import in.niftybreak.infrastructure.feed.KiteTickerFeed;
import in.niftybreak.infrastructure.feed.MarketFeed;
import in.niftybreak.infrastructure.history.HistoricalDataProvider;
import in.niftybreak.infrastructure.history.KiteHistoricalProvider;
import in.niftybreak.infrastructure.history.StoredCandleHistoricalProvider;
import in.niftybreak.infrastructure.instrument.CsvInstrumentRepository;
import in.niftybreak.persistence.CsvPersistenceSink;
import in.niftybreak.persistence.PersistenceSink;
import in.niftybreak.service.candle.CandleAggregator;
import in.niftybreak.service.candle.HistoryBackfiller;
import in.niftybreak.service.candle.LatestPriceCache;
import in.niftybreak.service.candle.SessionClock;
import in.niftybreak.service.candle.TickPipeline;
import in.niftybreak.service.execution.HttpOrderSink;
import in.niftybreak.service.execution.OrderSink;
import in.niftybreak.service.execution.PaperOrderSink;
import in.niftybreak.service.live.LiveTradeExecutor;
import in.niftybreak.service.live.LiveTradingLoop;
import in.niftybreak.service.strategy.StrikeSelector;
import in.niftybreak.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Live engine entry point.
 *
 * Wiring by phase:
 * - 1: CSV replay feed, stored-candle history, paper orders
 * - 2: Kite ticker and history, paper orders
 * - 3: Kite ticker and history, HTTP order signals
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== NIFTY Breakout Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        StrategyConfig config = new StrategyConfigLoader().load();
        ConnectionSettings connection = ConnectionSettings.fromEnv();
        StartupConfigValidator.validate(config, connection);

        TradingPhase phase = config.phase();
        ZoneId zone = config.zone();
        Clock wallClock = Clock.system(zone);
        SessionClock sessionClock = new SessionClock(config);

        // ═══════════════════════════════════════════════════════════════
        // Instruments
        // ═══════════════════════════════════════════════════════════════
        CsvInstrumentRepository instruments =
            CsvInstrumentRepository.load(Path.of(connection.instrumentsCsvPath()), config.underlying());
        String indexToken = instruments.indexToken().orElseThrow(() -> new IllegalStateException(
            "No " + config.underlying() + " index row in " + connection.instrumentsCsvPath()));
        log.info("✓ {} instruments loaded, index token {}", instruments.size(), indexToken);

        // ═══════════════════════════════════════════════════════════════
        // Market data
        // ═══════════════════════════════════════════════════════════════
        CandleAggregator aggregator = new CandleAggregator();
        LatestPriceCache prices = new LatestPriceCache();
        TickPipeline pipeline = new TickPipeline(aggregator, prices, sessionClock,
            Env.getInt("TICK_QUEUE_CAPACITY", 10_000));
        pipeline.start();

        MarketFeed feed;
        HistoricalDataProvider history;
        if (phase.usesRealData()) {
            feed = new KiteTickerFeed(connection.kiteApiKey(), connection.kiteAccessToken(), pipeline::offer, wallClock);
            history = new KiteHistoricalProvider(connection.kiteApiKey(), connection.kiteAccessToken(), zone);
        } else {
            Path replay = connection.replayFile().isBlank() ? null : Path.of(connection.replayFile());
            feed = new CsvReplayFeed(replay, zone, pipeline::offer);
            history = new StoredCandleHistoricalProvider(Path.of(connection.dataDir()), zone);
        }
        HistoryBackfiller backfiller = new HistoryBackfiller(history, aggregator);

        // ═══════════════════════════════════════════════════════════════
        // Orders and persistence
        // ═══════════════════════════════════════════════════════════════
        OrderSink orderSink = phase.placesRealOrders()
            ? new HttpOrderSink(connection.orderApiBaseUrl(), connection.orderApiKey())
            : new PaperOrderSink();
        LiveTradeExecutor executor = new LiveTradeExecutor(orderSink, Duration.ofSeconds(config.orderTimeoutSeconds()));
        PersistenceSink persistence = new CsvPersistenceSink(Path.of(connection.dataDir()), zone);

        LiveTradingLoop loop = new LiveTradingLoop(config, sessionClock, aggregator, prices, feed, backfiller,
            new StrikeSelector(instruments, config), executor, persistence, indexToken);

        // ═══════════════════════════════════════════════════════════════
        // Start
        // ═══════════════════════════════════════════════════════════════
        feed.connect();
        loop.start(wallClock.instant());

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "control-loop");
            t.setDaemon(false);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> loop.tick(wallClock.instant()), 1, 1, TimeUnit.SECONDS);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loop.shutdown(wallClock.instant());
            feed.disconnect();
            pipeline.stop();
            if (orderSink instanceof HttpOrderSink) {
                ((HttpOrderSink) orderSink).shutdown();
            }
            persistence.close();
            log.info("Shutdown complete");
        }, "shutdown-hook"));

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("Engine running: phase {} ({}), timezone {}", phase.code(), phase.description(), zone);
        log.info("═══════════════════════════════════════════════════════════════");
    }
}
