package in.niftybreak.service.live;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.Position;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.infrastructure.feed.MarketFeed;
import in.niftybreak.persistence.PersistenceSink;
import in.niftybreak.service.candle.CandleAggregator;
import in.niftybreak.service.candle.HistoryBackfiller;
import in.niftybreak.service.candle.LatestPriceCache;
import in.niftybreak.service.candle.SessionClock;
import in.niftybreak.service.strategy.CandleSlice;
import in.niftybreak.service.strategy.StrikeSelection;
import in.niftybreak.service.strategy.StrikeSelector;
import in.niftybreak.service.strategy.TradeExecutor;
import in.niftybreak.service.strategy.TradingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Live control loop, driven once per second by the scheduler.
 *
 * Per tick:
 * 1. day rollover (fresh session, aggregator and slice state)
 * 2. finalize candles whose window has ended, move 5-minute completions
 *    into the slice assembler
 * 3. provisional reference band at the end of the reference window
 * 4. strike selection: subscribe and backfill the legs, final bands,
 *    oscillator history from the backfilled leg candles. While the final
 *    bands cannot be computed the backfill of the instruments missing
 *    reference data is repeated once a minute.
 * 5. loss limit and wall-clock hard exit, both before any slice so that a
 *    slice released on this tick cannot open a position after them
 * 6. released slices to the trading session
 * 7. retry of a pending exit
 *
 * Ticks are ingested on the pipeline thread; everything strategy related
 * happens on the caller of tick().
 */
public final class LiveTradingLoop {
    private static final Logger log = LoggerFactory.getLogger(LiveTradingLoop.class);
    private static final Duration BAND_BACKFILL_RETRY = Duration.ofMinutes(1);

    private final StrategyConfig config;
    private final SessionClock clock;
    private final CandleAggregator aggregator;
    private final LatestPriceCache prices;
    private final MarketFeed feed;
    private final HistoryBackfiller backfiller;
    private final StrikeSelector selector;
    private final TradeExecutor executor;
    private final PersistenceSink persistence;
    private final String indexToken;

    private final Queue<Candle> completedFiveMinute = new ConcurrentLinkedQueue<>();
    private final SliceAssembler assembler;

    private TradingSession session;
    private boolean provisionalDone;
    private boolean selectionDone;
    private boolean finalBandDone;
    private Instant nextBandBackfillAt;

    public LiveTradingLoop(StrategyConfig config, SessionClock clock, CandleAggregator aggregator,
                           LatestPriceCache prices, MarketFeed feed, HistoryBackfiller backfiller,
                           StrikeSelector selector, TradeExecutor executor, PersistenceSink persistence,
                           String indexToken) {
        this.config = config;
        this.clock = clock;
        this.aggregator = aggregator;
        this.prices = prices;
        this.feed = feed;
        this.backfiller = backfiller;
        this.selector = selector;
        this.executor = executor;
        this.persistence = persistence;
        this.indexToken = indexToken;
        this.assembler = new SliceAssembler(Duration.ofSeconds(config.sliceGraceSeconds()), this::completedCandle);
        this.assembler.setIndex(indexToken);

        aggregator.addListener(TimeframeType.MINUTE_1, persistence::onCandle);
        aggregator.addListener(TimeframeType.MINUTE_5, candle -> {
            persistence.onCandle(candle);
            completedFiveMinute.add(candle);
        });
    }

    /**
     * Subscribe the index and, when starting after the open, backfill it
     * from market start.
     */
    public void start(Instant now) {
        ensureSession(now);
        feed.subscribe(List.of(indexToken));
        LocalDate date = clock.dateOf(now);
        Instant open = clock.sessionStart(date);
        if (now.isAfter(open) && now.isBefore(clock.sessionEnd(date))) {
            log.info("Started after market open, backfilling index from {}", open);
            backfiller.backfill(indexToken, open, now);
        }
    }

    public void tick(Instant now) {
        try {
            ensureSession(now);
            aggregator.finalizeStale(now);
            drainCompletions();

            LocalDate date = session.date();
            if (!provisionalDone && !now.isBefore(clock.referenceEnd(date))) {
                provisionalDone = session.bands().computeProvisional(
                    aggregator.getWindow(indexToken, clock.referenceStart(date), clock.referenceEnd(date),
                        TimeframeType.MINUTE_1)).isPresent();
            }
            if (!selectionDone && !now.isBefore(clock.strikeSelection(date))) {
                selectStrikes(now);
            }
            if (selectionDone && !finalBandDone) {
                computeFinalBands(date, now);
            }

            boolean lossLimit = session.isLossLimitReached();
            boolean pastHardExit = !now.isBefore(clock.hardExit(date));
            if (pastHardExit && session.position().isPresent()) {
                exitAtLatestPrice(ExitReason.HARD_EXIT, now);
            }
            boolean entriesAllowed = !pastHardExit && !lossLimit;

            for (CandleSlice slice : assembler.drain(now)) {
                session.onSlice(slice, entriesAllowed);
            }

            Optional<Position> open = session.position();
            if (open.isPresent() && open.get().hasPendingExit()) {
                session.retryPendingExit(latestLegPrice(open.get()), now);
            }
        } catch (RuntimeException e) {
            log.error("Control loop tick at {} failed: {}", now, e.getMessage(), e);
        }
    }

    /**
     * Close any open position (shutdown hook).
     */
    public void shutdown(Instant now) {
        if (session != null && session.position().isPresent()) {
            log.warn("Shutdown with open position {}", session.position().get().tradeId());
            exitAtLatestPrice(ExitReason.SHUTDOWN, now);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Steps
    // ═══════════════════════════════════════════════════════════════════════

    private void ensureSession(Instant now) {
        LocalDate today = clock.dateOf(now);
        if (session != null && session.date().equals(today)) {
            return;
        }
        if (session != null) {
            session.position().ifPresent(p ->
                log.error("Day rollover with position {} still open", p.tradeId()));
            log.info("Day {} closed: {} trade(s), pnl {}", session.date(), session.trades().size(), session.dailyPnl());
        }
        aggregator.clear();
        completedFiveMinute.clear();
        assembler.reset();
        provisionalDone = false;
        selectionDone = false;
        finalBandDone = false;
        nextBandBackfillAt = null;
        session = new TradingSession(config, clock, today, executor, persistence::onTrade);
        log.info("Trading session for {} ({})", today, clock.isWeekend(today) ? "weekend, no market" : "market day");
    }

    private void drainCompletions() {
        Candle c;
        while ((c = completedFiveMinute.poll()) != null) {
            assembler.add(c);
        }
    }

    private void selectStrikes(Instant now) {
        Optional<BigDecimal> spot = prices.price(indexToken).or(this::lastIndexClose);
        if (spot.isEmpty()) {
            log.warn("No index price yet at strike selection time, retrying next tick");
            return;
        }
        LocalDate date = session.date();
        StrikeSelection selection = selector.select(spot.get(), date);
        session.setSelection(selection);
        selectionDone = true;
        if (!selection.isComplete()) {
            return;
        }

        String callToken = selection.call().token();
        String putToken = selection.put().token();
        feed.subscribe(List.of(callToken, putToken));
        assembler.setLegs(callToken, putToken);

        Instant from = clock.sessionStart(date);
        backfiller.backfill(callToken, from, now);
        backfiller.backfill(putToken, from, now);
        nextBandBackfillAt = now.plus(BAND_BACKFILL_RETRY);
    }

    private void computeFinalBands(LocalDate date, Instant now) {
        StrikeSelection selection = session.selection();
        if (selection == null || !selection.isComplete()) {
            return;
        }
        Instant refStart = clock.referenceStart(date);
        Instant refEnd = clock.referenceEnd(date);
        String callToken = selection.call().token();
        String putToken = selection.put().token();
        finalBandDone = session.bands().computeFinal(
            aggregator.getWindow(indexToken, refStart, refEnd, TimeframeType.MINUTE_1),
            aggregator.getWindow(callToken, refStart, refEnd, TimeframeType.MINUTE_1),
            aggregator.getWindow(putToken, refStart, refEnd, TimeframeType.MINUTE_1)).isPresent();
        if (finalBandDone) {
            session.seedLegHistory(TradeSide.CALL, aggregator.getCompleted(callToken, TimeframeType.MINUTE_5));
            session.seedLegHistory(TradeSide.PUT, aggregator.getCompleted(putToken, TimeframeType.MINUTE_5));
            return;
        }
        if (nextBandBackfillAt != null && now.isBefore(nextBandBackfillAt)) {
            return;
        }
        nextBandBackfillAt = now.plus(BAND_BACKFILL_RETRY);
        Instant from = clock.sessionStart(date);
        for (String token : List.of(indexToken, callToken, putToken)) {
            if (aggregator.getWindow(token, refStart, refEnd, TimeframeType.MINUTE_1).isEmpty()) {
                log.warn("No reference window data for {}, backfilling again from {}", token, from);
                backfiller.backfill(token, from, now);
            }
        }
    }

    private Optional<BigDecimal> lastIndexClose() {
        List<Candle> recent = aggregator.getRecent(indexToken, TimeframeType.MINUTE_1, 1);
        return recent.isEmpty() ? Optional.empty() : Optional.of(recent.get(0).close());
    }

    private void exitAtLatestPrice(ExitReason reason, Instant now) {
        Position position = session.position().orElse(null);
        if (position == null) {
            return;
        }
        BigDecimal price = latestLegPrice(position);
        if (price == null) {
            log.error("{} due for {} but no price is known for {}", reason, position.tradeId(),
                position.contract().symbol());
            return;
        }
        session.forceExit(price, reason, now);
    }

    private BigDecimal latestLegPrice(Position position) {
        OptionContract contract = position.contract();
        return prices.price(contract.token()).orElse(null);
    }

    private Optional<Candle> completedCandle(String instrumentId, Instant windowStart) {
        List<Candle> found = aggregator.getWindow(instrumentId, windowStart,
            windowStart.plus(TimeframeType.MINUTE_5.getDuration()), TimeframeType.MINUTE_5);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public TradingSession session() {
        return session;
    }
}
