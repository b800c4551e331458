package in.niftybreak.service.candle;

import in.niftybreak.domain.data.Candle;

/**
 * Receives finalized candles. The candle is an immutable snapshot.
 */
@FunctionalInterface
public interface CandleListener {
    void onCandleClosed(Candle candle);
}
