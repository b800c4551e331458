package in.niftybreak.service.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stop-Loss Manager - staged stop for one open trade.
 *
 * Initial stop is the leg's reference low. Before breakeven the stop moves
 * by ordered, first-match rules (one stage per call):
 * <ol>
 *   <li>price >= entry + (mid - low)  and stop < mid   -> stop = mid</li>
 *   <li>price >= entry + (high - low) and stop < high  -> stop = high</li>
 *   <li>price >= entry + (entry - low) and stop < entry -> stop = entry, breakeven</li>
 * </ol>
 * After breakeven the stop trails in fixed increments above entry:
 * n = floor((price - entry) / increment); new level = entry + n * increment.
 */
public final class StopLossManager {
    private static final Logger log = LoggerFactory.getLogger(StopLossManager.class);

    private final BigDecimal trailingIncrement;
    private State state;

    public StopLossManager(BigDecimal trailingIncrement) {
        if (trailingIncrement.signum() <= 0) {
            throw new IllegalArgumentException("Trailing increment must be positive");
        }
        this.trailingIncrement = trailingIncrement;
    }

    public void initialize(BigDecimal entry, BigDecimal low, BigDecimal mid, BigDecimal high) {
        state = new State(entry, low, mid, high);
        log.info("Stop-loss initialized: entry={} stop={} (mid={}, high={})", entry, low, mid, high);
    }

    /**
     * Advance the stop with the latest price using the rule set of the
     * current stage.
     */
    public BigDecimal advance(BigDecimal price) {
        requireState();
        return state.breakeven ? advanceTrailing(price) : advanceProgressive(price);
    }

    public BigDecimal advanceProgressive(BigDecimal price) {
        requireState();
        State s = state;
        if (s.breakeven) {
            return s.currentStop;
        }

        if (price.compareTo(s.entry.add(s.mid.subtract(s.low))) >= 0 && s.currentStop.compareTo(s.mid) < 0) {
            moveStop(s.mid, "mid", price);
        } else if (price.compareTo(s.entry.add(s.high.subtract(s.low))) >= 0 && s.currentStop.compareTo(s.high) < 0) {
            moveStop(s.high, "high", price);
        } else if (price.compareTo(s.entry.add(s.entry.subtract(s.low))) >= 0 && s.currentStop.compareTo(s.entry) < 0) {
            moveStop(s.entry, "entry", price);
            s.breakeven = true;
            log.info("Breakeven reached at price {}", price);
        }
        return s.currentStop;
    }

    public BigDecimal advanceTrailing(BigDecimal price) {
        requireState();
        State s = state;
        if (!s.breakeven) {
            return s.currentStop;
        }

        BigDecimal increments = price.subtract(s.entry).divide(trailingIncrement, 0, RoundingMode.FLOOR);
        if (increments.signum() > 0) {
            BigDecimal level = s.entry.add(increments.multiply(trailingIncrement));
            if (level.compareTo(s.lastTrailingLevel) > 0) {
                s.lastTrailingLevel = level;
                moveStop(level, "trail", price);
            }
        }
        return s.currentStop;
    }

    /**
     * @return true iff lowPrice <= current stop
     */
    public boolean checkHit(BigDecimal lowPrice) {
        requireState();
        boolean hit = lowPrice.compareTo(state.currentStop) <= 0;
        if (hit) {
            log.info("Stop-loss hit: low {} <= stop {}", lowPrice, state.currentStop);
        }
        return hit;
    }

    private void moveStop(BigDecimal stop, String stage, BigDecimal price) {
        log.info("Stop-loss moved {} -> {} ({}, price={})", state.currentStop, stop, stage, price);
        state.currentStop = stop;
    }

    private void requireState() {
        if (state == null) {
            throw new IllegalStateException("Stop-loss not initialized");
        }
    }

    public boolean isActive() {
        return state != null;
    }

    public BigDecimal currentStop() {
        return state == null ? null : state.currentStop;
    }

    public BigDecimal initialStop() {
        return state == null ? null : state.low;
    }

    public boolean isBreakevenReached() {
        return state != null && state.breakeven;
    }

    public void reset() {
        state = null;
    }

    private static final class State {
        final BigDecimal entry;
        final BigDecimal low;
        final BigDecimal mid;
        final BigDecimal high;
        BigDecimal currentStop;
        BigDecimal lastTrailingLevel;
        boolean breakeven;

        State(BigDecimal entry, BigDecimal low, BigDecimal mid, BigDecimal high) {
            this.entry = entry;
            this.low = low;
            this.mid = mid;
            this.high = high;
            this.currentStop = low;
            this.lastTrailingLevel = entry;
            this.breakeven = false;
        }
    }
}
