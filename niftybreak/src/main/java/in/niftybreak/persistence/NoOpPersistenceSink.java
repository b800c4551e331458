package in.niftybreak.persistence;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.TradeRecord;

public final class NoOpPersistenceSink implements PersistenceSink {

    @Override
    public void onCandle(Candle candle) {
    }

    @Override
    public void onTrade(TradeRecord trade) {
    }

    @Override
    public void close() {
    }
}
