package in.niftybreak.service.live;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.service.strategy.CandleSlice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Groups completed 5-minute candles of the index and the selected legs into
 * CandleSlices, released strictly in window order.
 *
 * A window is released when:
 * - the index candle and every selected leg candle are present, or
 * - an index candle of a later window has arrived, or
 * - the grace period after the window end has passed.
 *
 * Leg candles that completed without a callback (backfilled) are looked up
 * through the LegLookup before a window is given up on.
 */
public final class SliceAssembler {
    private static final Logger log = LoggerFactory.getLogger(SliceAssembler.class);

    /**
     * Completed candle of an instrument for a window, if one exists.
     */
    @FunctionalInterface
    public interface LegLookup {
        Optional<Candle> find(String instrumentId, Instant windowStart);
    }

    private final Duration grace;
    private final LegLookup lookup;
    private final TreeMap<Instant, Pending> pending = new TreeMap<>();

    private String indexId;
    private String callId;
    private String putId;
    private Instant lastReleased;

    public SliceAssembler(Duration grace, LegLookup lookup) {
        this.grace = grace;
        this.lookup = lookup;
    }

    public synchronized void setIndex(String indexId) {
        this.indexId = indexId;
    }

    public synchronized void setLegs(String callId, String putId) {
        this.callId = callId;
        this.putId = putId;
    }

    /**
     * Add a completed 5-minute candle. Candles of other instruments, and of
     * windows already released, are ignored.
     */
    public synchronized void add(Candle candle) {
        Instant w = candle.windowStart();
        if (lastReleased != null && !w.isAfter(lastReleased)) {
            log.warn("Candle {} for window {} arrived after the slice was released, dropped",
                candle.instrumentId(), w);
            return;
        }
        String id = candle.instrumentId();
        if (id.equals(indexId)) {
            pending.computeIfAbsent(w, k -> new Pending()).index = candle;
        } else if (id.equals(callId)) {
            pending.computeIfAbsent(w, k -> new Pending()).call = candle;
        } else if (id.equals(putId)) {
            pending.computeIfAbsent(w, k -> new Pending()).put = candle;
        }
    }

    /**
     * Release every window that is ready, oldest first.
     */
    public synchronized List<CandleSlice> drain(Instant now) {
        List<CandleSlice> released = new ArrayList<>();
        while (!pending.isEmpty()) {
            Map.Entry<Instant, Pending> head = pending.firstEntry();
            Instant w = head.getKey();
            Pending p = head.getValue();
            fillFromLookup(w, p);

            boolean complete = p.index != null && legsComplete(p);
            boolean superseded = hasLaterIndex(w);
            boolean expired = !now.isBefore(w.plus(TimeframeType.MINUTE_5.getDuration()).plus(grace));
            if (!complete && !superseded && !expired) {
                break;
            }
            if (!complete) {
                log.warn("Releasing incomplete slice {} (index={}, call={}, put={}, {})", w,
                    p.index != null, p.call != null, p.put != null, superseded ? "later window seen" : "grace expired");
            }
            pending.pollFirstEntry();
            lastReleased = w;
            released.add(new CandleSlice(w, p.index, p.call, p.put));
        }
        return released;
    }

    private void fillFromLookup(Instant w, Pending p) {
        if (callId != null && p.call == null) {
            p.call = lookup.find(callId, w).orElse(null);
        }
        if (putId != null && p.put == null) {
            p.put = lookup.find(putId, w).orElse(null);
        }
    }

    private boolean legsComplete(Pending p) {
        return (callId == null || p.call != null) && (putId == null || p.put != null);
    }

    private boolean hasLaterIndex(Instant w) {
        for (Pending later : pending.tailMap(w, false).values()) {
            if (later.index != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drop all state (day rollover).
     */
    public synchronized void reset() {
        pending.clear();
        callId = null;
        putId = null;
        lastReleased = null;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private static final class Pending {
        Candle index;
        Candle call;
        Candle put;
    }
}
