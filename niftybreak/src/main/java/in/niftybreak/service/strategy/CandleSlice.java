package in.niftybreak.service.strategy;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.TradeSide;

import java.time.Instant;

/**
 * Completed 5-minute candles of the index and both legs for one window.
 * Leg candles are null when the leg had no data (or was not selected yet).
 */
public record CandleSlice(
    Instant windowStart,
    Candle index,
    Candle call,
    Candle put
) {
    public Candle leg(TradeSide side) {
        return side == TradeSide.CALL ? call : put;
    }

    public Instant windowEnd() {
        return windowStart.plusSeconds(300);
    }
}
