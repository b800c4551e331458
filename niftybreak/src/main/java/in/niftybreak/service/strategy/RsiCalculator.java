package in.niftybreak.service.strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * RSI Calculator - bounded 0..100 momentum oscillator over closes.
 *
 * Calculation Method:
 * - Deltas: d_i = close_i - close_{i-1}
 * - avgGain / avgLoss: simple mean of gains / losses over the last `period` deltas
 * - RSI = 100 - 100 / (1 + avgGain / avgLoss)
 */
public final class RsiCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int SCALE = 6;

    /**
     * Latest RSI value.
     *
     * @param closes closes in chronological order (oldest first)
     * @param period number of deltas averaged (typically 14)
     * @return RSI, 100 when there are no losses, or null if there are fewer
     *         than period + 1 closes or the window has no movement at all
     */
    public static BigDecimal latest(List<BigDecimal> closes, int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("RSI period must be positive: " + period);
        }
        if (closes == null || closes.size() < period + 1) {
            return null;
        }

        BigDecimal gains = BigDecimal.ZERO;
        BigDecimal losses = BigDecimal.ZERO;
        int from = closes.size() - period;
        for (int i = from; i < closes.size(); i++) {
            BigDecimal delta = closes.get(i).subtract(closes.get(i - 1));
            if (delta.signum() > 0) {
                gains = gains.add(delta);
            } else {
                losses = losses.add(delta.negate());
            }
        }

        BigDecimal n = BigDecimal.valueOf(period);
        BigDecimal avgGain = gains.divide(n, SCALE, RoundingMode.HALF_UP);
        BigDecimal avgLoss = losses.divide(n, SCALE, RoundingMode.HALF_UP);

        if (avgLoss.signum() == 0) {
            return avgGain.signum() == 0 ? null : HUNDRED;
        }

        BigDecimal rs = avgGain.divide(avgLoss, SCALE, RoundingMode.HALF_UP);
        return HUNDRED.subtract(HUNDRED.divide(BigDecimal.ONE.add(rs), SCALE, RoundingMode.HALF_UP));
    }

    private RsiCalculator() {}
}
