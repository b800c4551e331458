package in.niftybreak.service.candle;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Candle Aggregator - build 1-minute and 5-minute candles per instrument.
 *
 * Sources:
 * - Live ticks (ingestTick): both timeframes are built independently from the
 *   same tick stream.
 * - Historical 1-minute bars (ingestHistoricalBar): appended directly as
 *   completed 1-minute candles and OHLC-merged into the 5-minute bucket.
 *
 * All per-instrument state sits behind one lock. Completions are collected
 * while the lock is held and dispatched to listeners after it is released,
 * in registration order, so a listener can read windows without deadlocking.
 *
 * Live ticks for a window at or before the last finalized window of that
 * series are dropped with a warning. Historical bars fill any minute that was
 * never finalized, in window order. A finalized candle is never mutated.
 *
 * Partial candles built only from a backfill without callbacks stay silent:
 * when they are finalized later (next bucket, stale sweep) they are recorded
 * as completed but never dispatched. A live tick on the partial makes it a
 * regular live candle again.
 */
public final class CandleAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<SeriesKey, Series> series = new HashMap<>();
    private final Map<TimeframeType, List<CandleListener>> listeners = new EnumMap<>(TimeframeType.class);

    public CandleAggregator() {
        for (TimeframeType tf : TimeframeType.values()) {
            listeners.put(tf, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Register a completion listener for a timeframe.
     */
    public void addListener(TimeframeType timeframe, CandleListener listener) {
        listeners.get(timeframe).add(listener);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Ingestion
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Ingest one live tick into the 1-minute and 5-minute series.
     */
    public void ingestTick(String instrumentId, BigDecimal price, Instant ts) {
        List<Candle> completed = new ArrayList<>();
        lock.lock();
        try {
            for (TimeframeType tf : TimeframeType.values()) {
                applyTick(seriesFor(instrumentId, tf), price, ts, completed);
            }
        } finally {
            lock.unlock();
        }
        dispatch(completed);
    }

    private void applyTick(Series s, BigDecimal price, Instant ts, List<Candle> out) {
        Instant bucket = s.key.timeframe.floor(ts);

        if (s.lastFinalized != null && !bucket.isAfter(s.lastFinalized)) {
            log.warn("Dropping late tick for {} {}: window {} already finalized (last={})",
                s.key.instrumentId, s.key.timeframe.getLabel(), bucket, s.lastFinalized);
            return;
        }

        PartialCandle partial = s.live;
        if (partial == null) {
            s.live = PartialCandle.fromPrice(bucket, price, ts);
            return;
        }

        if (bucket.isAfter(partial.start)) {
            finalizeLive(s, out);
            s.live = PartialCandle.fromPrice(bucket, price, ts);
        } else if (bucket.isBefore(partial.start)) {
            log.warn("Dropping out-of-order tick for {} {}: window {} before current {}",
                s.key.instrumentId, s.key.timeframe.getLabel(), bucket, partial.start);
        } else {
            partial.update(price, ts);
        }
    }

    /**
     * Ingest one historical 1-minute bar (backfill).
     *
     * The bar becomes a completed 1-minute candle and is merged into its
     * 5-minute bucket. A bar completing the last minute of its bucket
     * finalizes that bucket. Bars for a minute that is already finalized, or
     * that live ticks are building, are dropped, so repeating a backfill over
     * the same range is a no-op. Earlier minutes that were never finalized
     * are accepted even after live ticks have closed later minutes.
     *
     * @param bar              1-minute OHLC bar (windowStart = minute start)
     * @param triggerCallbacks false during backfill: completions are recorded
     *                         but listeners are not notified
     */
    public void ingestHistoricalBar(Candle bar, boolean triggerCallbacks) {
        List<Candle> completed = new ArrayList<>();
        lock.lock();
        try {
            Series minute = seriesFor(bar.instrumentId(), TimeframeType.MINUTE_1);
            Instant start = TimeframeType.MINUTE_1.floor(bar.windowStart());

            if (minute.isFinalized(start)) {
                log.debug("Skipping historical bar {} @ {}: minute already finalized",
                    bar.instrumentId(), start);
                return;
            }
            if (minute.live != null && !start.isBefore(minute.live.start)) {
                log.debug("Skipping historical bar {} @ {}: minute is being built from live ticks",
                    bar.instrumentId(), start);
                return;
            }

            Candle oneMinute = new Candle(bar.instrumentId(), TimeframeType.MINUTE_1, start,
                bar.open(), bar.high(), bar.low(), bar.close());
            minute.complete(oneMinute);
            completed.add(oneMinute);

            foldIntoBucket(seriesFor(bar.instrumentId(), TimeframeType.MINUTE_5), oneMinute, !triggerCallbacks, completed);
        } finally {
            lock.unlock();
        }
        if (triggerCallbacks) {
            dispatch(completed);
        }
    }

    private void foldIntoBucket(Series s, Candle bar, boolean silent, List<Candle> out) {
        Instant bucket = s.key.timeframe.floor(bar.windowStart());

        if (s.isFinalized(bucket)) {
            log.warn("Historical bar {} @ {} belongs to finalized {} window {}, not merged",
                bar.instrumentId(), bar.windowStart(), s.key.timeframe.getLabel(), bucket);
            return;
        }

        boolean behind = s.live != null
            ? bucket.isBefore(s.live.start)
            : s.lastFinalized != null && bucket.isBefore(s.lastFinalized);

        boolean isLive;
        if (!behind) {
            // Bucket at or after the live one: same path as ticks
            if (s.live != null && bucket.isAfter(s.live.start)) {
                finalizeLive(s, out);
            }
            if (s.live == null) {
                s.live = PartialCandle.fromBar(bucket, bar, silent);
            } else {
                s.live.merge(bar, silent);
            }
            isLive = true;
        } else {
            // Bucket before the live one: filled from history behind live ticks
            if (s.gap != null && bucket.isAfter(s.gap.start)) {
                finalizeGap(s, out);
            }
            if (s.gap == null) {
                s.gap = PartialCandle.fromBar(bucket, bar, silent);
            } else if (bucket.isBefore(s.gap.start)) {
                log.warn("Historical bar {} @ {} older than pending gap bucket {}, not merged",
                    bar.instrumentId(), bar.windowStart(), s.gap.start);
                return;
            } else {
                s.gap.merge(bar, silent);
            }
            isLive = false;
        }

        Instant barEnd = bar.windowStart().plus(TimeframeType.MINUTE_1.getDuration());
        Instant bucketEnd = bucket.plus(s.key.timeframe.getDuration());
        if (!barEnd.isBefore(bucketEnd)) {
            if (isLive) {
                finalizeLive(s, out);
            } else {
                finalizeGap(s, out);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Finalization
    // ═══════════════════════════════════════════════════════════════════════

    private void finalizeLive(Series s, List<Candle> out) {
        if (s.live == null) {
            return;
        }
        finalizeGap(s, out);
        PartialCandle partial = s.live;
        s.live = null;
        finalizePartial(s, partial, out);
    }

    private void finalizeGap(Series s, List<Candle> out) {
        if (s.gap == null) {
            return;
        }
        PartialCandle partial = s.gap;
        s.gap = null;
        finalizePartial(s, partial, out);
    }

    private void finalizePartial(Series s, PartialCandle partial, List<Candle> out) {
        Candle candle = partial.toCandle(s.key);
        s.complete(candle);
        if (partial.silent) {
            log.debug("Finalized backfilled {} {} @ {} without callbacks",
                s.key.instrumentId, s.key.timeframe.getLabel(), candle.windowStart());
            return;
        }
        out.add(candle);
    }

    /**
     * Finalize partial candles whose window ended at or before the cutoff.
     * Used by the live loop so that an instrument without further ticks still
     * closes its candles.
     *
     * @return number of candles finalized and dispatched
     */
    public int finalizeStale(Instant cutoff) {
        List<Candle> completed = new ArrayList<>();
        lock.lock();
        try {
            for (Series s : series.values()) {
                if (s.gap != null && !s.gap.end(s.key).isAfter(cutoff)) {
                    finalizeGap(s, completed);
                }
                if (s.live != null && !s.live.end(s.key).isAfter(cutoff)) {
                    finalizeLive(s, completed);
                }
            }
        } finally {
            lock.unlock();
        }
        sortForDispatch(completed);
        dispatch(completed);
        return completed.size();
    }

    /**
     * Finalize every partial candle (end of session / end of a backtest day).
     */
    public void closeAll() {
        List<Candle> completed = new ArrayList<>();
        lock.lock();
        try {
            for (Series s : series.values()) {
                finalizeLive(s, completed);
            }
        } finally {
            lock.unlock();
        }
        sortForDispatch(completed);
        dispatch(completed);
        log.debug("Closed {} partial candles", completed.size());
    }

    /**
     * Drop all state (day rollover).
     */
    public void clear() {
        lock.lock();
        try {
            series.clear();
        } finally {
            lock.unlock();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Completed candles with start <= windowStart < end (end exclusive).
     */
    public List<Candle> getWindow(String instrumentId, Instant start, Instant end, TimeframeType timeframe) {
        lock.lock();
        try {
            Series s = series.get(new SeriesKey(instrumentId, timeframe));
            if (s == null) {
                return List.of();
            }
            List<Candle> result = new ArrayList<>();
            for (Candle c : s.completed) {
                if (!c.windowStart().isBefore(start) && c.windowStart().isBefore(end)) {
                    result.add(c);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most recent completed candles, oldest first.
     */
    public List<Candle> getRecent(String instrumentId, TimeframeType timeframe, int count) {
        lock.lock();
        try {
            Series s = series.get(new SeriesKey(instrumentId, timeframe));
            if (s == null || count <= 0) {
                return List.of();
            }
            int from = Math.max(0, s.completed.size() - count);
            return new ArrayList<>(s.completed.subList(from, s.completed.size()));
        } finally {
            lock.unlock();
        }
    }

    public List<Candle> getCompleted(String instrumentId, TimeframeType timeframe) {
        lock.lock();
        try {
            Series s = series.get(new SeriesKey(instrumentId, timeframe));
            return s == null ? List.of() : new ArrayList<>(s.completed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start of the last finalized window, or null if none.
     */
    public Instant lastFinalized(String instrumentId, TimeframeType timeframe) {
        lock.lock();
        try {
            Series s = series.get(new SeriesKey(instrumentId, timeframe));
            return s == null ? null : s.lastFinalized;
        } finally {
            lock.unlock();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════════════

    private Series seriesFor(String instrumentId, TimeframeType tf) {
        return series.computeIfAbsent(new SeriesKey(instrumentId, tf), Series::new);
    }

    private static void sortForDispatch(List<Candle> completed) {
        completed.sort((a, b) -> {
            int byStart = a.windowStart().compareTo(b.windowStart());
            return byStart != 0 ? byStart : a.timeframe().compareTo(b.timeframe());
        });
    }

    private void dispatch(List<Candle> completed) {
        for (Candle candle : completed) {
            for (CandleListener listener : listeners.get(candle.timeframe())) {
                try {
                    listener.onCandleClosed(candle);
                } catch (RuntimeException e) {
                    log.warn("Candle listener {} failed for {} {} @ {}: {}",
                        listener.getClass().getSimpleName(), candle.instrumentId(),
                        candle.timeframe().getLabel(), candle.windowStart(), e.getMessage(), e);
                }
            }
        }
    }

    private record SeriesKey(String instrumentId, TimeframeType timeframe) {}

    private static final class Series {
        final SeriesKey key;
        final List<Candle> completed = new ArrayList<>();
        final Set<Instant> finalizedStarts = new HashSet<>();
        PartialCandle live;
        PartialCandle gap;
        Instant lastFinalized;

        Series(SeriesKey key) {
            this.key = key;
        }

        boolean isFinalized(Instant windowStart) {
            return finalizedStarts.contains(windowStart);
        }

        /**
         * Record a finalized candle, keeping completed in window order.
         */
        void complete(Candle candle) {
            Instant start = candle.windowStart();
            finalizedStarts.add(start);
            if (lastFinalized == null || start.isAfter(lastFinalized)) {
                completed.add(candle);
                lastFinalized = start;
                return;
            }
            int i = completed.size();
            while (i > 0 && completed.get(i - 1).windowStart().isAfter(start)) {
                i--;
            }
            completed.add(i, candle);
        }
    }

    /**
     * Mutable in-progress candle. Never leaves the aggregator.
     */
    private static final class PartialCandle {
        final Instant start;
        BigDecimal open;
        BigDecimal high;
        BigDecimal low;
        BigDecimal close;
        Instant firstDataAt;
        Instant lastDataAt;
        boolean silent;

        private PartialCandle(Instant start, BigDecimal open, BigDecimal high, BigDecimal low,
                              BigDecimal close, Instant firstDataAt, Instant lastDataAt, boolean silent) {
            this.start = start;
            this.open = open;
            this.high = high;
            this.low = low;
            this.close = close;
            this.firstDataAt = firstDataAt;
            this.lastDataAt = lastDataAt;
            this.silent = silent;
        }

        static PartialCandle fromPrice(Instant start, BigDecimal price, Instant ts) {
            return new PartialCandle(start, price, price, price, price, ts, ts, false);
        }

        static PartialCandle fromBar(Instant start, Candle bar, boolean silent) {
            return new PartialCandle(start, bar.open(), bar.high(), bar.low(), bar.close(),
                bar.windowStart(), bar.windowStart(), silent);
        }

        void update(BigDecimal price, Instant ts) {
            high = high.max(price);
            low = low.min(price);
            close = price;
            lastDataAt = ts;
            silent = false;
        }

        /**
         * OHLC merge of a 1-minute bar. Open follows the earliest data seen,
         * close the latest, so a bar older than live ticks does not move close.
         */
        void merge(Candle bar, boolean silentBar) {
            silent = silent && silentBar;
            high = high.max(bar.high());
            low = low.min(bar.low());
            if (bar.windowStart().isBefore(firstDataAt)) {
                open = bar.open();
                firstDataAt = bar.windowStart();
            }
            if (!bar.windowStart().isBefore(lastDataAt)) {
                close = bar.close();
                lastDataAt = bar.windowStart();
            }
        }

        Instant end(SeriesKey key) {
            return start.plus(key.timeframe().getDuration());
        }

        Candle toCandle(SeriesKey key) {
            return new Candle(key.instrumentId(), key.timeframe(), start, open, high, low, close);
        }
    }
}
