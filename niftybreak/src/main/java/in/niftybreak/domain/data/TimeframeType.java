package in.niftybreak.domain.data;

import java.time.Duration;
import java.time.Instant;

/**
 * Candle timeframes built by the aggregator.
 */
public enum TimeframeType {
    /**
     * 1-minute candles. Built from ticks or appended directly from historical bars.
     */
    MINUTE_1(1, "1min"),

    /**
     * 5-minute candles. Working interval of the strategy.
     */
    MINUTE_5(5, "5min");

    private final int candleMinutes;
    private final String label;

    TimeframeType(int candleMinutes, String label) {
        this.candleMinutes = candleMinutes;
        this.label = label;
    }

    public int getCandleMinutes() {
        return candleMinutes;
    }

    public String getLabel() {
        return label;
    }

    public Duration getDuration() {
        return Duration.ofMinutes(candleMinutes);
    }

    /**
     * Floor a timestamp to this timeframe's window start.
     */
    public Instant floor(Instant ts) {
        long widthSeconds = candleMinutes * 60L;
        long epochSeconds = ts.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(epochSeconds, widthSeconds) * widthSeconds);
    }
}
