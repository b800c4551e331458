package in.niftybreak.service.backtest;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.domain.model.BandSet;
import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.Position;
import in.niftybreak.domain.model.TradeRecord;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.infrastructure.instrument.InstrumentLookup;
import in.niftybreak.service.candle.CandleAggregator;
import in.niftybreak.service.candle.SessionClock;
import in.niftybreak.service.strategy.CandleSlice;
import in.niftybreak.service.strategy.SimulatedExecution;
import in.niftybreak.service.strategy.StrikeSelection;
import in.niftybreak.service.strategy.StrikeSelector;
import in.niftybreak.service.strategy.TradingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Backtest Replay Driver.
 *
 * Per trading day:
 * 1. fold the day's 1-minute bars into a fresh CandleAggregator (no callbacks)
 * 2. zip the completed 5-minute candles of index and legs into slices
 * 3. reference bands from the 1-minute reference window
 * 4. strike selection against a synthetic instrument master (the dataset
 *    already carries the traded legs)
 * 5. feed the slices to a TradingSession with immediate fills
 *
 * Days are independent and may run in parallel; results are merged in date order.
 */
public final class BacktestDriver {
    private static final Logger log = LoggerFactory.getLogger(BacktestDriver.class);

    private final StrategyConfig config;
    private final SessionClock clock;

    public BacktestDriver(StrategyConfig config) {
        this.config = config;
        this.clock = new SessionClock(config);
    }

    /**
     * Run every day in [start, end] (either bound may be null).
     *
     * @param parallelism number of days processed concurrently (1 = sequential)
     */
    public BacktestResult run(List<HistoricalBar> bars, LocalDate start, LocalDate end, int parallelism) {
        Map<LocalDate, List<HistoricalBar>> byDate = groupByDate(bars, start, end);
        log.info("Backtest over {} day(s) ({} bars), parallelism={}", byDate.size(), bars.size(), parallelism);

        List<DayOutcome> outcomes = parallelism > 1
            ? runParallel(byDate, parallelism)
            : runSequential(byDate);

        List<LocalDate> traded = new ArrayList<>();
        List<BacktestResult.SkippedDay> skipped = new ArrayList<>();
        List<TradeRecord> trades = new ArrayList<>();
        for (DayOutcome outcome : outcomes) {
            if (outcome.skipReason() != null) {
                skipped.add(new BacktestResult.SkippedDay(outcome.date(), outcome.skipReason()));
            } else {
                traded.add(outcome.date());
                trades.addAll(outcome.trades());
            }
        }

        BacktestSummary summary = BacktestSummary.of(trades);
        log.info("Backtest complete: {} day(s) traded, {} skipped, {} trade(s), total pnl {}",
            traded.size(), skipped.size(), summary.totalTrades(), summary.totalPnl());
        return new BacktestResult(traded, skipped, trades, summary);
    }

    private List<DayOutcome> runSequential(Map<LocalDate, List<HistoricalBar>> byDate) {
        List<DayOutcome> outcomes = new ArrayList<>();
        byDate.forEach((date, dayBars) -> outcomes.add(runDay(date, dayBars)));
        return outcomes;
    }

    private List<DayOutcome> runParallel(Map<LocalDate, List<HistoricalBar>> byDate, int parallelism) {
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "backtest-day-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<DayOutcome>> futures = new ArrayList<>();
            byDate.forEach((date, dayBars) -> futures.add(pool.submit(() -> runDay(date, dayBars))));

            List<DayOutcome> outcomes = new ArrayList<>();
            for (Future<DayOutcome> f : futures) {
                outcomes.add(f.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Backtest interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Backtest day failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // One day
    // ═══════════════════════════════════════════════════════════════════════

    DayOutcome runDay(LocalDate date, List<HistoricalBar> dayBars) {
        CandleAggregator aggregator = new CandleAggregator();
        for (HistoricalBar bar : dayBars) {
            if (!clock.isWithinSession(bar.timestamp())) {
                continue;
            }
            ingest(aggregator, bar.index());
            ingest(aggregator, bar.call());
            ingest(aggregator, bar.put());
        }
        aggregator.closeAll();

        List<CandleSlice> slices = buildSlices(aggregator);
        if (slices.size() < config.minSlicesPerDay()) {
            String reason = "only " + slices.size() + " slice(s), need " + config.minSlicesPerDay();
            log.info("Skipping {}: {}", date, reason);
            return DayOutcome.skipped(date, reason);
        }

        TradingSession session = new TradingSession(config, clock, date, new SimulatedExecution(),
            trade -> log.debug("Backtest trade closed: {}", trade.tradeId()));

        Instant refStart = clock.referenceStart(date);
        Instant refEnd = clock.referenceEnd(date);
        List<Candle> indexWindow = aggregator.getWindow(
            HistoricalBarCsvReader.INDEX_ID, refStart, refEnd, TimeframeType.MINUTE_1);
        Optional<BandSet> bands = session.bands().computeFinal(
            indexWindow,
            aggregator.getWindow(HistoricalBarCsvReader.CALL_ID, refStart, refEnd, TimeframeType.MINUTE_1),
            aggregator.getWindow(HistoricalBarCsvReader.PUT_ID, refStart, refEnd, TimeframeType.MINUTE_1));
        if (bands.isEmpty()) {
            session.bands().computeProvisional(indexWindow);
            log.warn("{}: reference window incomplete, entries will be blocked", date);
        }

        BigDecimal spot = spotAt(aggregator, clock.strikeSelection(date));
        if (spot != null) {
            StrikeSelector selector = new StrikeSelector(new DatasetLegs(config.underlying(), config.lotSize()), config);
            session.setSelection(selector.select(spot, date));
        } else {
            log.warn("{}: no index price before strike selection time", date);
            session.setSelection(new StrikeSelection(null, null, null, null));
        }

        for (CandleSlice slice : slices) {
            session.onSlice(slice);
        }
        closeAtEndOfData(session, slices);

        log.info("{}: {} slice(s), {} trade(s), pnl {}", date, slices.size(), session.trades().size(), session.dailyPnl());
        return new DayOutcome(date, session.trades(), null);
    }

    private static void ingest(CandleAggregator aggregator, Candle bar) {
        if (bar != null) {
            aggregator.ingestHistoricalBar(bar, false);
        }
    }

    private static List<CandleSlice> buildSlices(CandleAggregator aggregator) {
        Map<Instant, Candle> calls = byWindow(aggregator.getCompleted(HistoricalBarCsvReader.CALL_ID, TimeframeType.MINUTE_5));
        Map<Instant, Candle> puts = byWindow(aggregator.getCompleted(HistoricalBarCsvReader.PUT_ID, TimeframeType.MINUTE_5));

        List<CandleSlice> slices = new ArrayList<>();
        for (Candle index : aggregator.getCompleted(HistoricalBarCsvReader.INDEX_ID, TimeframeType.MINUTE_5)) {
            Instant w = index.windowStart();
            slices.add(new CandleSlice(w, index, calls.get(w), puts.get(w)));
        }
        return slices;
    }

    private static Map<Instant, Candle> byWindow(List<Candle> candles) {
        Map<Instant, Candle> map = new HashMap<>();
        for (Candle c : candles) {
            map.put(c.windowStart(), c);
        }
        return map;
    }

    /**
     * Close of the last index minute before the given instant.
     */
    private static BigDecimal spotAt(CandleAggregator aggregator, Instant at) {
        List<Candle> before = aggregator.getWindow(HistoricalBarCsvReader.INDEX_ID, Instant.EPOCH, at, TimeframeType.MINUTE_1);
        return before.isEmpty() ? null : before.get(before.size() - 1).close();
    }

    /**
     * A position still open when the data runs out is closed at the last leg
     * close, the same as a hard exit.
     */
    private void closeAtEndOfData(TradingSession session, List<CandleSlice> slices) {
        Optional<Position> open = session.position();
        if (open.isEmpty()) {
            return;
        }
        TradeSide side = open.get().side();
        for (int i = slices.size() - 1; i >= 0; i--) {
            Candle leg = slices.get(i).leg(side);
            if (leg != null) {
                log.info("{}: data ended with {} open, closing at {}", session.date(), open.get().tradeId(), leg.close());
                session.forceExit(leg.close(), ExitReason.HARD_EXIT, slices.get(slices.size() - 1).windowEnd());
                return;
            }
        }
        log.error("{}: position {} open at end of data and no {} price known", session.date(), open.get().tradeId(), side);
    }

    private Map<LocalDate, List<HistoricalBar>> groupByDate(List<HistoricalBar> bars, LocalDate start, LocalDate end) {
        Map<LocalDate, List<HistoricalBar>> byDate = new TreeMap<>();
        for (HistoricalBar bar : bars) {
            LocalDate date = clock.dateOf(bar.timestamp());
            if ((start != null && date.isBefore(start)) || (end != null && date.isAfter(end))) {
                continue;
            }
            byDate.computeIfAbsent(date, d -> new ArrayList<>()).add(bar);
        }
        return byDate;
    }

    record DayOutcome(LocalDate date, List<TradeRecord> trades, String skipReason) {
        static DayOutcome skipped(LocalDate date, String reason) {
            return new DayOutcome(date, List.of(), reason);
        }
    }

    /**
     * Instrument master for datasets that carry one call and one put series:
     * every strike resolves, to the dataset's CALL or PUT instrument id.
     */
    static final class DatasetLegs implements InstrumentLookup {
        private final String underlying;
        private final int lotSize;

        DatasetLegs(String underlying, int lotSize) {
            this.underlying = underlying;
            this.lotSize = lotSize;
        }

        @Override
        public Optional<OptionContract> find(BigDecimal strike, TradeSide side, LocalDate expiry) {
            String token = side == TradeSide.CALL ? HistoricalBarCsvReader.CALL_ID : HistoricalBarCsvReader.PUT_ID;
            String symbol = underlying + strike.stripTrailingZeros().toPlainString() + side.optionType();
            return Optional.of(new OptionContract(symbol, token, strike, side, expiry, lotSize));
        }

        @Override
        public Optional<LocalDate> nearestExpiry(LocalDate onOrAfter) {
            return Optional.of(onOrAfter);
        }

        @Override
        public Optional<String> indexToken() {
            return Optional.of(HistoricalBarCsvReader.INDEX_ID);
        }
    }
}
