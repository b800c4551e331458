package in.niftybreak.service.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Tracks the oscillator peak since entry and signals exit on a retracement
 * of at least dropThreshold from that peak.
 */
public final class OscillatorExitTracker {
    private static final Logger log = LoggerFactory.getLogger(OscillatorExitTracker.class);

    private final BigDecimal dropThreshold;
    private BigDecimal peak;

    public OscillatorExitTracker(BigDecimal dropThreshold) {
        this.dropThreshold = dropThreshold;
    }

    /**
     * peak' = max(peak, current), or current if there is no peak yet.
     */
    public static BigDecimal updatePeak(BigDecimal current, BigDecimal peak) {
        return peak == null ? current : peak.max(current);
    }

    public static boolean shouldExit(BigDecimal current, BigDecimal peak, BigDecimal dropThreshold) {
        if (current == null || peak == null) {
            return false;
        }
        return peak.subtract(current).compareTo(dropThreshold) >= 0;
    }

    /**
     * Record the latest oscillator value.
     *
     * @param current latest value, null when undefined (no signal)
     * @return true if the retracement from the peak reached the threshold
     */
    public boolean update(BigDecimal current) {
        if (current == null) {
            return false;
        }
        peak = updatePeak(current, peak);
        boolean exit = shouldExit(current, peak, dropThreshold);
        if (exit) {
            log.info("Oscillator exit: value {} dropped >= {} from peak {}", current, dropThreshold, peak);
        }
        return exit;
    }

    public BigDecimal peak() {
        return peak;
    }

    /**
     * Forget the peak (new trade).
     */
    public void reset() {
        peak = null;
    }
}
