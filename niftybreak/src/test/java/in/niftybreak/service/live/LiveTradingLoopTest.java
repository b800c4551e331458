package in.niftybreak.service.live;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.domain.model.BandSet;
import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.Position;
import in.niftybreak.domain.model.TradeRecord;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.infrastructure.feed.MarketFeed;
import in.niftybreak.persistence.NoOpPersistenceSink;
import in.niftybreak.service.candle.CandleAggregator;
import in.niftybreak.service.candle.HistoryBackfiller;
import in.niftybreak.service.candle.LatestPriceCache;
import in.niftybreak.service.candle.SessionClock;
import in.niftybreak.service.strategy.ExecutionResult;
import in.niftybreak.service.strategy.SimulatedExecution;
import in.niftybreak.service.strategy.StrikeSelection;
import in.niftybreak.service.strategy.StrikeSelector;
import in.niftybreak.service.strategy.TradeExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for LiveTradingLoop.
 *
 * Tests:
 * - Index subscription and backfill on start
 * - Provisional band at the end of the reference window
 * - Strike selection, leg subscription and leg backfill
 * - Selection retry while no index price is known
 * - Leg backfill repeated while the reference window is empty
 * - Wall-clock hard exit and entries closed after it
 * - Failed exit retried on a later tick
 * - Loss limit closes entries
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LiveTradingLoopTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);
    private static final LocalDate EXPIRY = LocalDate.of(2024, 1, 18);
    private static final String INDEX = "INDEX";

    @Mock
    private MarketFeed feed;

    @Mock
    private HistoryBackfiller backfiller;

    @Mock
    private StrikeSelector selector;

    private SessionClock clock;
    private CandleAggregator aggregator;
    private LatestPriceCache prices;
    private LiveTradingLoop loop;

    @BeforeEach
    void setUp() {
        loop = loop(StrategyConfig.defaults(), new SimulatedExecution());
        when(selector.select(any(), any())).thenReturn(new StrikeSelection(BigDecimal.ZERO, null, null, null));
    }

    private LiveTradingLoop loop(StrategyConfig config, TradeExecutor executor) {
        clock = new SessionClock(config);
        aggregator = new CandleAggregator();
        prices = new LatestPriceCache();
        return new LiveTradingLoop(config, clock, aggregator, prices, feed, backfiller, selector,
            executor, new NoOpPersistenceSink(), INDEX);
    }

    /**
     * Reference window 09:45-10:00 backfilled for all three instruments
     * (index R=110 G=90, legs R=120 G=80), strikes selected and final bands
     * computed at 10:00.
     */
    private void readyAtTen() {
        when(selector.select(any(), eq(DAY))).thenReturn(new StrikeSelection(BigDecimal.valueOf(21500), EXPIRY,
            contract("C1", 21300, TradeSide.CALL), contract("P1", 21700, TradeSide.PUT)));
        loop.start(at(9, 0));
        for (int m = 45; m < 60; m++) {
            aggregator.ingestHistoricalBar(Candle.of(INDEX, TimeframeType.MINUTE_1, at(9, m), 100, 110, 90, 100), false);
            aggregator.ingestHistoricalBar(Candle.of("C1", TimeframeType.MINUTE_1, at(9, m), 100, 120, 80, 100), false);
            aggregator.ingestHistoricalBar(Candle.of("P1", TimeframeType.MINUTE_1, at(9, m), 100, 120, 80, 100), false);
        }
        prices.update(INDEX, BigDecimal.valueOf(21500), at(9, 59));
        loop.tick(at(10, 0));
        assertTrue(loop.session().bands().current().isFinal());
    }

    /**
     * One 5-minute window of 1-minute bars closing at the given price, ingested with callbacks.
     */
    private void bucket(String id, int hour, int minute, double low, double close) {
        for (int m = 0; m < 5; m++) {
            aggregator.ingestHistoricalBar(
                Candle.of(id, TimeframeType.MINUTE_1, at(hour, minute + m), close, close, low, close), true);
        }
    }

    private void window(int hour, int minute, double indexClose, double callClose) {
        bucket(INDEX, hour, minute, indexClose, indexClose);
        bucket("C1", hour, minute, callClose, callClose);
        bucket("P1", hour, minute, 100, 100);
    }

    private void enterCallAtTenTen() {
        window(10, 0, 111, 105);
        loop.tick(at(10, 5));
        window(10, 5, 112, 105);
        loop.tick(at(10, 10));
        assertTrue(loop.session().position().isPresent());
    }

    private Instant at(int hour, int minute) {
        return clock.at(DAY, LocalTime.of(hour, minute));
    }

    private static OptionContract contract(String token, long strike, TradeSide side) {
        return new OptionContract("NIFTY24118" + strike + side.optionType(), token,
            BigDecimal.valueOf(strike), side, EXPIRY, 75);
    }

    @Test
    void testStartBeforeOpenSubscribesIndexOnly() {
        loop.start(at(9, 0));

        verify(feed).subscribe(List.of(INDEX));
        verifyNoInteractions(backfiller);
        assertEquals(DAY, loop.session().date());
    }

    @Test
    void testStartAfterOpenBackfillsIndex() {
        loop.start(at(10, 30));

        verify(backfiller).backfill(INDEX, at(9, 15), at(10, 30));
    }

    @Test
    void testProvisionalBandAtReferenceEnd() {
        loop.start(at(9, 0));
        for (int m = 45; m < 60; m++) {
            double high = m == 50 ? 21510 : 21500;
            double low = m == 51 ? 21490 : 21500;
            aggregator.ingestHistoricalBar(
                Candle.of(INDEX, TimeframeType.MINUTE_1, at(9, m), 21500, high, low, 21500), false);
        }

        loop.tick(at(9, 59));
        assertNull(loop.session().bands().current());

        loop.tick(at(10, 0));

        BandSet bands = loop.session().bands().current();
        assertNotNull(bands);
        assertFalse(bands.isFinal());
        assertEquals(0, bands.index().resistance().compareTo(BigDecimal.valueOf(21510)));
        assertEquals(0, bands.index().support().compareTo(BigDecimal.valueOf(21490)));
    }

    @Test
    void testStrikeSelectionSubscribesAndBackfillsLegs() {
        StrikeSelection selection = new StrikeSelection(BigDecimal.valueOf(21537), EXPIRY,
            contract("C1", 21350, TradeSide.CALL), contract("P1", 21750, TradeSide.PUT));
        when(selector.select(any(), eq(DAY))).thenReturn(selection);
        loop.start(at(9, 0));
        prices.update(INDEX, BigDecimal.valueOf(21537), at(9, 59));

        loop.tick(at(10, 0));
        loop.tick(at(10, 0).plusSeconds(1));

        ArgumentCaptor<BigDecimal> spot = ArgumentCaptor.forClass(BigDecimal.class);
        verify(selector, times(1)).select(spot.capture(), eq(DAY));
        assertEquals(0, spot.getValue().compareTo(BigDecimal.valueOf(21537)));
        verify(feed).subscribe(List.of("C1", "P1"));
        verify(backfiller).backfill("C1", at(9, 15), at(10, 0));
        verify(backfiller).backfill("P1", at(9, 15), at(10, 0));
        assertSame(selection, loop.session().selection());
    }

    @Test
    void testSelectionRetriedUntilIndexPriceKnown() {
        loop.start(at(9, 0));

        loop.tick(at(10, 0));
        verify(selector, never()).select(any(), any());

        prices.update(INDEX, BigDecimal.valueOf(21500), at(10, 0));
        loop.tick(at(10, 0).plusSeconds(1));

        verify(selector, times(1)).select(any(), eq(DAY));
    }

    @Test
    void testIncompleteSelectionDoesNotSubscribeLegs() {
        loop.start(at(9, 0));
        prices.update(INDEX, BigDecimal.valueOf(21500), at(9, 59));

        loop.tick(at(10, 0));

        verify(feed, times(1)).subscribe(any());
        verify(backfiller, never()).backfill(eq("C1"), any(), any());
        assertFalse(loop.session().selection().isComplete());
    }

    @Test
    void testShutdownWithoutPositionIsNoOp() {
        loop.start(at(9, 0));

        loop.shutdown(at(11, 0));

        assertTrue(loop.session().trades().isEmpty());
    }

    @Test
    void testLegBackfillRepeatedWhileReferenceWindowEmpty() {
        when(selector.select(any(), eq(DAY))).thenReturn(new StrikeSelection(BigDecimal.valueOf(21500), EXPIRY,
            contract("C1", 21300, TradeSide.CALL), contract("P1", 21700, TradeSide.PUT)));
        loop.start(at(9, 0));
        for (int m = 45; m < 60; m++) {
            aggregator.ingestHistoricalBar(Candle.of(INDEX, TimeframeType.MINUTE_1, at(9, m), 100, 110, 90, 100), false);
            aggregator.ingestHistoricalBar(Candle.of("P1", TimeframeType.MINUTE_1, at(9, m), 100, 120, 80, 100), false);
        }
        prices.update(INDEX, BigDecimal.valueOf(21500), at(9, 59));

        loop.tick(at(10, 0));
        loop.tick(at(10, 0).plusSeconds(30));
        assertFalse(loop.session().bands().current().isFinal());
        verify(backfiller, times(1)).backfill(eq("C1"), any(), any());

        loop.tick(at(10, 1));
        verify(backfiller).backfill("C1", at(9, 15), at(10, 1));
        verify(backfiller, times(1)).backfill(eq("P1"), any(), any());

        for (int m = 45; m < 60; m++) {
            aggregator.ingestHistoricalBar(Candle.of("C1", TimeframeType.MINUTE_1, at(9, m), 100, 120, 80, 100), false);
        }
        loop.tick(at(10, 1).plusSeconds(1));

        BandSet bands = loop.session().bands().current();
        assertTrue(bands.isFinal());
        assertEquals(0, bands.call().resistance().compareTo(BigDecimal.valueOf(120)));
    }

    @Test
    void testWallClockHardExitAtLatestPrice() {
        readyAtTen();
        enterCallAtTenTen();
        prices.update("C1", BigDecimal.valueOf(108), at(15, 14));

        loop.tick(at(15, 14));
        assertTrue(loop.session().position().isPresent());

        loop.tick(at(15, 15));

        assertTrue(loop.session().position().isEmpty());
        TradeRecord trade = loop.session().trades().get(0);
        assertEquals(ExitReason.HARD_EXIT, trade.exitReason());
        assertEquals(0, trade.exitPrice().compareTo(BigDecimal.valueOf(108)));
        assertEquals(at(15, 15), trade.exitTime());
    }

    @Test
    void testNoEntryFromSliceReleasedAfterHardExit() {
        readyAtTen();
        window(15, 0, 111, 105);
        window(15, 5, 112, 105);

        loop.tick(at(15, 15));

        assertTrue(loop.session().position().isEmpty());
        assertTrue(loop.session().trades().isEmpty());
    }

    @Test
    void testFailedExitRetriedOnNextTick() {
        TradeExecutor executor = mock(TradeExecutor.class);
        when(executor.enter(any(), any(), any(), anyInt(), any(), any()))
            .thenAnswer(inv -> ExecutionResult.filled(inv.getArgument(4), "E1"));
        when(executor.exit(any(), any(), any(), any()))
            .thenReturn(ExecutionResult.rejected("timeout"), ExecutionResult.rejected("timeout"))
            .thenAnswer(inv -> ExecutionResult.filled(inv.getArgument(1), "X1"));
        loop = loop(StrategyConfig.defaults(), executor);
        readyAtTen();
        enterCallAtTenTen();

        bucket(INDEX, 10, 10, 109, 109);
        bucket("C1", 10, 10, 75, 100);
        bucket("P1", 10, 10, 100, 100);
        loop.tick(at(10, 15));

        Position open = loop.session().position().orElseThrow();
        assertTrue(open.hasPendingExit());
        assertEquals(ExitReason.SL_HIT, open.pendingExit().reason());

        prices.update("C1", BigDecimal.valueOf(82), at(10, 15));
        loop.tick(at(10, 15).plusSeconds(1));

        assertTrue(loop.session().position().isEmpty());
        TradeRecord trade = loop.session().trades().get(0);
        assertEquals(ExitReason.SL_HIT, trade.exitReason());
        assertEquals(0, trade.exitPrice().compareTo(BigDecimal.valueOf(82)));
        verify(executor, times(3)).exit(any(), any(), any(), any());
    }

    @Test
    void testLossLimitClosesEntries() {
        loop = loop(StrategyConfig.builder().dailyLossLimit(BigDecimal.valueOf(1000)).build(), new SimulatedExecution());
        readyAtTen();
        enterCallAtTenTen();

        bucket(INDEX, 10, 10, 109, 109);
        bucket("C1", 10, 10, 75, 100);
        bucket("P1", 10, 10, 100, 100);
        loop.tick(at(10, 15));
        assertEquals(1, loop.session().trades().size());
        assertTrue(loop.session().isLossLimitReached());

        window(10, 15, 108, 100);
        loop.tick(at(10, 20));
        window(10, 20, 111, 100);
        loop.tick(at(10, 25));
        window(10, 25, 113, 101);
        loop.tick(at(10, 30));

        assertTrue(loop.session().position().isEmpty());
        assertEquals(1, loop.session().trades().size());
    }
}
