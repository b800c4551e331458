package in.niftybreak.service.strategy;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.EntryPhase;
import in.niftybreak.domain.model.ReferenceBand;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.service.candle.SessionClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Entry Detector - two-candle breakout confirmation on completed index candles.
 *
 * States: WAITING -> ARMED -> POSITIONED -> REARM_PENDING(side) -> ARMED.
 *
 * With P the previous completed candle and C the current one:
 * - CALL: P.close > R and C.close > R and C.close > P.close
 * - PUT:  P.close < G and C.close < G and C.close < P.close
 *
 * After a trade on one side closes, no signal is evaluated until two
 * consecutive closes are back inside the band on that side (<= R after a
 * CALL, >= G after a PUT). The clearing candle itself is then evaluated.
 *
 * Not thread-safe: driven by one session on one thread.
 */
public final class EntryDetector {
    private static final Logger log = LoggerFactory.getLogger(EntryDetector.class);

    private final SessionClock sessionClock;

    private EntryPhase phase = EntryPhase.WAITING;
    private Candle previous;
    private TradeSide pendingRearmSide;
    private TradeSide positionSide;

    public EntryDetector(SessionClock sessionClock) {
        this.sessionClock = sessionClock;
    }

    /**
     * Feed the next completed index candle.
     *
     * @param candle    completed index candle (same timeframe every call)
     * @param indexBand latest index reference band
     * @return the confirmed side, if this candle confirms an entry
     */
    public Optional<TradeSide> onCandle(Candle candle, ReferenceBand indexBand) {
        if (previous != null && !candle.windowStart().isAfter(previous.windowStart())) {
            log.warn("Ignoring index candle {} not after previous {}", candle.windowStart(), previous.windowStart());
            return Optional.empty();
        }

        switch (phase) {
            case WAITING -> {
                if (candle.windowStart().isBefore(sessionClock.tradingStart(sessionClock.dateOf(candle.windowStart())))) {
                    return Optional.empty();
                }
                phase = EntryPhase.ARMED;
                previous = candle;
                log.info("Entry detector armed at {} (close={})", candle.windowStart(), candle.close());
                return Optional.empty();
            }
            case POSITIONED -> {
                previous = candle;
                return Optional.empty();
            }
            case REARM_PENDING -> {
                Candle p = previous;
                previous = candle;
                if (!rearmCleared(p, candle, indexBand)) {
                    log.debug("Re-arm pending on {} side: closes {} / {} not back inside band ({})",
                        pendingRearmSide, p.close(), candle.close(), indexBand);
                    return Optional.empty();
                }
                log.info("Re-arm cleared for {} side at {}", pendingRearmSide, candle.windowStart());
                phase = EntryPhase.ARMED;
                pendingRearmSide = null;
                return evaluate(p, candle, indexBand);
            }
            case ARMED -> {
                Candle p = previous;
                previous = candle;
                return evaluate(p, candle, indexBand);
            }
            default -> throw new IllegalStateException("Unknown phase " + phase);
        }
    }

    private boolean rearmCleared(Candle p, Candle c, ReferenceBand band) {
        if (pendingRearmSide == TradeSide.CALL) {
            return p.close().compareTo(band.resistance()) <= 0
                && c.close().compareTo(band.resistance()) <= 0;
        }
        return p.close().compareTo(band.support()) >= 0
            && c.close().compareTo(band.support()) >= 0;
    }

    private Optional<TradeSide> evaluate(Candle p, Candle c, ReferenceBand band) {
        if (p == null) {
            return Optional.empty();
        }
        if (p.close().compareTo(band.resistance()) > 0
            && c.close().compareTo(band.resistance()) > 0
            && c.close().compareTo(p.close()) > 0) {
            return confirm(TradeSide.CALL, p, c, band);
        }
        if (p.close().compareTo(band.support()) < 0
            && c.close().compareTo(band.support()) < 0
            && c.close().compareTo(p.close()) < 0) {
            return confirm(TradeSide.PUT, p, c, band);
        }
        return Optional.empty();
    }

    private Optional<TradeSide> confirm(TradeSide side, Candle p, Candle c, ReferenceBand band) {
        phase = EntryPhase.POSITIONED;
        positionSide = side;
        log.info("{} breakout confirmed at {}: P.close={} C.close={} ({})",
            side, c.windowStart(), p.close(), c.close(), band);
        return Optional.of(side);
    }

    /**
     * The position opened on the last signal has closed.
     */
    public void notifyClosed() {
        if (phase != EntryPhase.POSITIONED) {
            log.warn("notifyClosed() in phase {}, ignored", phase);
            return;
        }
        pendingRearmSide = positionSide;
        positionSide = null;
        phase = EntryPhase.REARM_PENDING;
        log.info("Position closed, re-arm pending on {} side", pendingRearmSide);
    }

    /**
     * The last signal could not be acted on (no fill, gate closed).
     * Back to ARMED with no re-arm requirement.
     */
    public void abortEntry() {
        if (phase == EntryPhase.POSITIONED) {
            positionSide = null;
            phase = EntryPhase.ARMED;
        }
    }

    /**
     * Reinitialize to WAITING (day rollover).
     */
    public void reset() {
        phase = EntryPhase.WAITING;
        previous = null;
        pendingRearmSide = null;
        positionSide = null;
    }

    public EntryPhase phase() {
        return phase;
    }

    public TradeSide pendingRearmSide() {
        return pendingRearmSide;
    }

    public Candle previous() {
        return previous;
    }
}
