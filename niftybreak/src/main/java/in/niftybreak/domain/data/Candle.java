package in.niftybreak.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Finalized OHLC candle.
 *
 * Immutable value handed out by the aggregator. windowStart is the tick
 * timestamp floored to the timeframe boundary.
 */
public record Candle(
    String instrumentId,
    TimeframeType timeframe,
    Instant windowStart,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close
) {
    /**
     * End of the candle window (exclusive).
     */
    public Instant windowEnd() {
        return windowStart.plus(timeframe.getDuration());
    }

    /**
     * Check if candle is bullish (close > open).
     */
    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    /**
     * Merge a later sub-bar of the same window into this candle.
     * Keeps open, widens high/low, takes the sub-bar's close.
     */
    public Candle mergeWith(BigDecimal barHigh, BigDecimal barLow, BigDecimal barClose) {
        return new Candle(
            instrumentId, timeframe, windowStart,
            open,
            high.max(barHigh),
            low.min(barLow),
            barClose
        );
    }

    /**
     * Create candle from raw values.
     */
    public static Candle of(String instrumentId, TimeframeType tf, Instant windowStart,
                            double o, double h, double l, double c) {
        return new Candle(
            instrumentId, tf, windowStart,
            BigDecimal.valueOf(o),
            BigDecimal.valueOf(h),
            BigDecimal.valueOf(l),
            BigDecimal.valueOf(c)
        );
    }
}
