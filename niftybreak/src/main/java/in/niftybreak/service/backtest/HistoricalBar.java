package in.niftybreak.service.backtest;

import in.niftybreak.domain.data.Candle;

import java.time.Instant;

/**
 * One row of the backtest dataset: the 1-minute bars of the index and both
 * option legs for the same minute. Legs are null when the row had no values.
 */
public record HistoricalBar(
    Instant timestamp,
    Candle index,
    Candle call,
    Candle put
) {}
