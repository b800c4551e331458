package in.niftybreak.service.strategy;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.BandSet;
import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.Position;
import in.niftybreak.domain.model.ReferenceBand;
import in.niftybreak.domain.model.TradeRecord;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.service.candle.SessionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Trading Session - the strategy state machine for one trading day.
 *
 * Shared by the backtest driver and the live loop: both feed CandleSlices
 * in window order and get the same entries and exits. Per slice:
 * 1. record leg closes (oscillator history)
 * 2. Entry Detector on the index candle; an entry is taken only if the
 *    slice ends before the hard-exit time, the caller has not closed entries,
 *    the daily loss limit is not reached, the band is FINAL and the leg
 *    candle exists
 * 3. if a position was already open and the slice ends at or after the
 *    hard-exit time: hard exit at the leg close, nothing else is evaluated
 * 4. otherwise stop-loss advance with the leg close, then hit check with
 *    the leg low
 * 5. oscillator retracement exit
 *
 * A slice is processed when its window has ended, so the slice ending at
 * the hard-exit time is the last one seen before the live wall-clock exit.
 *
 * Public methods are synchronized: the live shutdown hook may force an exit
 * from another thread.
 */
public final class TradingSession {
    private static final Logger log = LoggerFactory.getLogger(TradingSession.class);
    private static final DateTimeFormatter TRADE_ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StrategyConfig config;
    private final SessionClock clock;
    private final LocalDate date;
    private final TradeExecutor executor;
    private final Consumer<TradeRecord> tradeListener;

    private final ReferenceBandCalculator bands = new ReferenceBandCalculator();
    private final EntryDetector detector;
    private final StopLossManager stopLoss;
    private final OscillatorExitTracker oscillator;

    private final Map<TradeSide, Deque<BigDecimal>> legCloses = new EnumMap<>(TradeSide.class);
    private final Map<TradeSide, Instant> lastLegWindow = new EnumMap<>(TradeSide.class);
    private final List<TradeRecord> trades = new ArrayList<>();

    private StrikeSelection selection;
    private Position position;
    private BigDecimal maxPrice;
    private BigDecimal dailyPnl = BigDecimal.ZERO;
    private boolean lossLimitLogged = false;

    public TradingSession(StrategyConfig config, SessionClock clock, LocalDate date,
                          TradeExecutor executor, Consumer<TradeRecord> tradeListener) {
        this.config = config;
        this.clock = clock;
        this.date = date;
        this.executor = executor;
        this.tradeListener = tradeListener;
        this.detector = new EntryDetector(clock);
        this.stopLoss = new StopLossManager(config.trailingIncrement());
        this.oscillator = new OscillatorExitTracker(config.rsiExitDrop());
        for (TradeSide side : TradeSide.values()) {
            legCloses.put(side, new ArrayDeque<>());
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Setup
    // ═══════════════════════════════════════════════════════════════════════

    public synchronized void setSelection(StrikeSelection selection) {
        this.selection = selection;
    }

    public ReferenceBandCalculator bands() {
        return bands;
    }

    /**
     * Seed oscillator history with completed leg candles (live start after
     * backfill). Candles at or before the last recorded window are ignored.
     */
    public synchronized void seedLegHistory(TradeSide side, List<Candle> candles) {
        for (Candle c : candles) {
            recordLegClose(side, c);
        }
        log.info("Seeded {} {} closes for the oscillator", legCloses.get(side).size(), side);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Per-slice processing
    // ═══════════════════════════════════════════════════════════════════════

    public synchronized void onSlice(CandleSlice slice) {
        onSlice(slice, true);
    }

    /**
     * @param entriesAllowed false when the caller has already closed new
     *                       entries for this tick (wall-clock hard exit or
     *                       loss limit evaluated first)
     */
    public synchronized void onSlice(CandleSlice slice, boolean entriesAllowed) {
        recordLegClose(TradeSide.CALL, slice.call());
        recordLegClose(TradeSide.PUT, slice.put());

        boolean pastHardExit = !slice.windowEnd().isBefore(clock.hardExit(date));
        boolean enteredNow = false;
        boolean hadPosition = position != null;

        BandSet bandSet = bands.current();
        if (slice.index() == null) {
            log.warn("Slice {} has no index candle, entry check skipped", slice.windowStart());
        } else if (bandSet == null) {
            log.debug("No reference band yet at {}, entry check skipped", slice.windowStart());
        } else {
            Optional<TradeSide> signal = detector.onCandle(slice.index(), bandSet.index());
            if (signal.isPresent()) {
                enteredNow = tryEnter(signal.get(), slice, bandSet, pastHardExit, entriesAllowed);
            }
        }

        if (!hadPosition || enteredNow || position == null) {
            return;
        }

        if (position.hasPendingExit()) {
            Candle leg = slice.leg(position.side());
            retryPendingExit(leg == null ? null : leg.close(), slice.windowEnd());
            return;
        }

        Candle leg = slice.leg(position.side());
        if (pastHardExit) {
            BigDecimal price = leg != null ? leg.close() : lastLegClose(position.side());
            if (price == null) {
                log.error("Hard exit due at {} but no {} price is known", slice.windowEnd(), position.side());
                return;
            }
            closePosition(price, ExitReason.HARD_EXIT, slice.windowEnd());
            return;
        }

        if (leg != null) {
            maxPrice = maxPrice.max(leg.high());
            stopLoss.advance(leg.close());
            if (stopLoss.checkHit(leg.low())) {
                closePosition(stopLoss.currentStop(), ExitReason.SL_HIT, slice.windowEnd());
                return;
            }

            BigDecimal rsi = RsiCalculator.latest(new ArrayList<>(legCloses.get(position.side())), config.rsiPeriod());
            if (rsi == null) {
                log.debug("Oscillator undefined for {} at {} (history={})",
                    position.side(), slice.windowStart(), legCloses.get(position.side()).size());
            } else if (oscillator.update(rsi)) {
                closePosition(leg.close(), ExitReason.RSI_EXIT, slice.windowEnd());
                return;
            }
        } else {
            log.warn("No {} candle for window {}, position management skipped",
                position.side(), slice.windowStart());
        }
    }

    private boolean tryEnter(TradeSide side, CandleSlice slice, BandSet bandSet,
                             boolean pastHardExit, boolean entriesAllowed) {
        String blocked = entryBlockReason(side, slice, bandSet, pastHardExit, entriesAllowed);
        if (blocked != null) {
            log.info("{} signal at {} not taken: {}", side, slice.windowStart(), blocked);
            detector.abortEntry();
            return false;
        }

        Candle leg = slice.leg(side);
        OptionContract contract = selection.leg(side);
        int qty = contract.lotSize() > 0 ? contract.lotSize() : config.lotSize();
        BigDecimal price = leg.close();
        Instant at = slice.windowEnd();
        String tradeId = tradeId(side, at, price);

        ExecutionResult result = executor.enter(tradeId, side, contract, qty, price, at);
        if (!result.filled()) {
            log.error("Entry {} {} @ {} not filled: {}", tradeId, contract.symbol(), price, result.message());
            detector.abortEntry();
            return false;
        }

        BigDecimal fill = result.price();
        ReferenceBand legBand = bandSet.leg(side);
        position = new Position(tradeId, side, contract, fill, at, qty, null);
        maxPrice = fill;
        stopLoss.initialize(fill, legBand.support(), legBand.mid(), legBand.resistance());
        oscillator.reset();
        log.info("ENTERED {} {} x{} @ {} (trade {})", side, contract.symbol(), qty, fill, tradeId);
        return true;
    }

    private String entryBlockReason(TradeSide side, CandleSlice slice, BandSet bandSet,
                                    boolean pastHardExit, boolean entriesAllowed) {
        if (pastHardExit) {
            return "hard-exit time reached";
        }
        if (!entriesAllowed) {
            return "new entries closed for this tick";
        }
        if (isLossLimitReached()) {
            return "daily loss limit reached (pnl=" + dailyPnl + ")";
        }
        if (!bandSet.isFinal()) {
            return "reference band is still provisional";
        }
        if (selection == null || !selection.isComplete()) {
            return "strike selection incomplete";
        }
        if (slice.leg(side) == null) {
            return "no " + side + " candle for the window";
        }
        return null;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Exits
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Close the open position now (wall-clock hard exit, shutdown, manual).
     *
     * @return true if a position was closed
     */
    public synchronized boolean forceExit(BigDecimal price, ExitReason reason, Instant at) {
        if (position == null) {
            return false;
        }
        if (position.hasPendingExit()) {
            return retryPendingExit(price, at);
        }
        closePosition(price, reason, at);
        return position == null;
    }

    /**
     * Re-send a failed exit order.
     *
     * @param currentPrice latest leg price, or null to reuse the price of the failed attempt
     * @return true if the position is now closed
     */
    public synchronized boolean retryPendingExit(BigDecimal currentPrice, Instant at) {
        if (position == null || !position.hasPendingExit()) {
            return false;
        }
        Position.PendingExit pending = position.pendingExit();
        BigDecimal price = currentPrice != null ? currentPrice : pending.price();
        log.info("Retrying {} exit for {} @ {}", pending.reason(), position.tradeId(), price);
        closePosition(price, pending.reason(), at);
        return position == null;
    }

    private void closePosition(BigDecimal price, ExitReason reason, Instant at) {
        ExecutionResult result = executor.exit(position, price, reason, at);
        if (!result.filled()) {
            log.error("Exit {} ({}) @ {} not confirmed: {}. Position stays open.",
                position.tradeId(), reason, price, result.message());
            position = position.withPendingExit(new Position.PendingExit(reason, price, at));
            return;
        }

        BigDecimal exitPrice = result.price();
        BigDecimal pnl = exitPrice.subtract(position.entryPrice()).multiply(BigDecimal.valueOf(position.qty()));
        dailyPnl = dailyPnl.add(pnl);

        TradeRecord record = new TradeRecord(
            position.tradeId(), date, position.side(), position.contract().symbol(), position.qty(),
            position.entryTime(), position.entryPrice(), at, exitPrice, reason, pnl,
            stopLoss.initialStop(), stopLoss.currentStop(), maxPrice.max(exitPrice));
        trades.add(record);

        log.info("EXITED {} {} @ {} ({}), pnl={}, daily pnl={}",
            position.side(), position.contract().symbol(), exitPrice, reason, pnl, dailyPnl);

        position = null;
        maxPrice = null;
        stopLoss.reset();
        oscillator.reset();
        detector.notifyClosed();

        try {
            tradeListener.accept(record);
        } catch (RuntimeException e) {
            log.warn("Trade listener failed for {}: {}", record.tradeId(), e.getMessage(), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // State
    // ═══════════════════════════════════════════════════════════════════════

    public synchronized boolean isLossLimitReached() {
        boolean reached = dailyPnl.abs().compareTo(config.dailyLossLimit()) >= 0;
        if (reached && !lossLimitLogged) {
            lossLimitLogged = true;
            log.warn("Daily loss limit reached: pnl={} limit={}. No further entries today.",
                dailyPnl, config.dailyLossLimit());
        }
        return reached;
    }

    private void recordLegClose(TradeSide side, Candle candle) {
        if (candle == null) {
            return;
        }
        Instant last = lastLegWindow.get(side);
        if (last != null && !candle.windowStart().isAfter(last)) {
            return;
        }
        lastLegWindow.put(side, candle.windowStart());
        Deque<BigDecimal> closes = legCloses.get(side);
        closes.addLast(candle.close());
        while (closes.size() > config.rsiLookback()) {
            closes.removeFirst();
        }
    }

    private BigDecimal lastLegClose(TradeSide side) {
        Deque<BigDecimal> closes = legCloses.get(side);
        return closes.isEmpty() ? null : closes.peekLast();
    }

    private String tradeId(TradeSide side, Instant at, BigDecimal price) {
        return side + "_" + TRADE_ID_TIME.format(at.atZone(clock.zone())) + "_" + price.stripTrailingZeros().toPlainString();
    }

    public LocalDate date() {
        return date;
    }

    public synchronized Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    public synchronized BigDecimal dailyPnl() {
        return dailyPnl;
    }

    public synchronized List<TradeRecord> trades() {
        return Collections.unmodifiableList(new ArrayList<>(trades));
    }

    public synchronized StrikeSelection selection() {
        return selection;
    }

    public EntryDetector detector() {
        return detector;
    }

    public StopLossManager stopLoss() {
        return stopLoss;
    }
}
