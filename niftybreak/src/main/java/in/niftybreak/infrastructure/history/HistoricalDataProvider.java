package in.niftybreak.infrastructure.history;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Source of historical OHLC bars.
 *
 * Results are ordered by window start and may be partial or empty;
 * callers decide whether to retry.
 */
public interface HistoricalDataProvider {

    /**
     * Fetch bars with from <= windowStart < to.
     *
     * @param instrumentId broker instrument token
     */
    CompletableFuture<List<Candle>> fetch(String instrumentId, Instant from, Instant to, TimeframeType timeframe);
}
