package in.niftybreak.persistence;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.TradeRecord;

/**
 * Fire-and-forget storage of finalized candles and completed trades.
 * Implementations must not block the caller.
 */
public interface PersistenceSink extends AutoCloseable {

    void onCandle(Candle candle);

    void onTrade(TradeRecord trade);

    /**
     * Flush pending writes and release resources.
     */
    @Override
    void close();
}
