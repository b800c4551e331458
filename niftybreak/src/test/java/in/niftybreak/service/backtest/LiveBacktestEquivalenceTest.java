package in.niftybreak.service.backtest;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.TradeRecord;
import in.niftybreak.infrastructure.feed.MarketFeed;
import in.niftybreak.persistence.NoOpPersistenceSink;
import in.niftybreak.service.candle.CandleAggregator;
import in.niftybreak.service.candle.HistoryBackfiller;
import in.niftybreak.service.candle.LatestPriceCache;
import in.niftybreak.service.candle.SessionClock;
import in.niftybreak.service.execution.PaperOrderSink;
import in.niftybreak.service.live.LiveTradeExecutor;
import in.niftybreak.service.live.LiveTradingLoop;
import in.niftybreak.service.strategy.StrikeSelector;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * The same day replayed as live ticks through the live loop must produce
 * exactly the trades of the backtest.
 */
class LiveBacktestEquivalenceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);

    @Test
    void testLiveReplayMatchesBacktest() {
        StrategyConfig config = StrategyConfig.defaults();
        List<HistoricalBar> bars = BacktestFixtures.singleStopOutDay(DAY);

        List<TradeRecord> backtestTrades = new BacktestDriver(config).runDay(DAY, bars).trades();

        SessionClock clock = new SessionClock(config);
        CandleAggregator aggregator = new CandleAggregator();
        LatestPriceCache prices = new LatestPriceCache();
        PaperOrderSink sink = new PaperOrderSink();
        LiveTradingLoop loop = new LiveTradingLoop(config, clock, aggregator, prices,
            mock(MarketFeed.class), mock(HistoryBackfiller.class),
            new StrikeSelector(new BacktestDriver.DatasetLegs(config.underlying(), config.lotSize()), config),
            new LiveTradeExecutor(sink, Duration.ofSeconds(5)),
            new NoOpPersistenceSink(), HistoricalBarCsvReader.INDEX_ID);

        loop.start(BacktestFixtures.at(DAY, 9, 14));
        for (HistoricalBar bar : bars) {
            replayAsTicks(bar.index(), aggregator, prices);
            replayAsTicks(bar.call(), aggregator, prices);
            replayAsTicks(bar.put(), aggregator, prices);
            loop.tick(bar.timestamp().plusSeconds(61));
        }

        List<TradeRecord> liveTrades = loop.session().trades();
        assertEquals(1, backtestTrades.size());
        assertEquals(backtestTrades, liveTrades);
        assertEquals(2, sink.orders().size(), "one entry and one exit order");
        assertTrue(loop.session().position().isEmpty());
    }

    /**
     * Four ticks per minute: open, high, low, close.
     */
    private static void replayAsTicks(Candle bar, CandleAggregator aggregator, LatestPriceCache prices) {
        BigDecimal[] path = { bar.open(), bar.high(), bar.low(), bar.close() };
        for (int i = 0; i < path.length; i++) {
            Instant ts = bar.windowStart().plusSeconds(i * 15L);
            prices.update(bar.instrumentId(), path[i], ts);
            aggregator.ingestTick(bar.instrumentId(), path[i], ts);
        }
    }
}
