package in.niftybreak.service.strategy;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.domain.model.EntryPhase;
import in.niftybreak.domain.model.ReferenceBand;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.service.candle.SessionClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EntryDetectorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 15);
    private static final ReferenceBand BAND = ReferenceBand.of(BigDecimal.valueOf(110), BigDecimal.valueOf(90));

    private SessionClock clock;
    private EntryDetector detector;

    @BeforeEach
    void setUp() {
        clock = new SessionClock(StrategyConfig.defaults());
        detector = new EntryDetector(clock);
    }

    private Candle candle(int hour, int minute, double close) {
        return Candle.of("INDEX", TimeframeType.MINUTE_5, clock.at(DAY, LocalTime.of(hour, minute)),
            close, close, close, close);
    }

    @Test
    void testWaitsUntilTradingStart() {
        assertTrue(detector.onCandle(candle(9, 50, 115), BAND).isEmpty());
        assertTrue(detector.onCandle(candle(9, 55, 120), BAND).isEmpty());
        assertEquals(EntryPhase.WAITING, detector.phase());

        detector.onCandle(candle(10, 0, 100), BAND);
        assertEquals(EntryPhase.ARMED, detector.phase());
    }

    @Test
    void testCallBreakoutNeedsTwoRisingClosesAboveResistance() {
        detector.onCandle(candle(10, 0, 111), BAND);

        Optional<TradeSide> signal = detector.onCandle(candle(10, 5, 112), BAND);

        assertEquals(Optional.of(TradeSide.CALL), signal);
        assertEquals(EntryPhase.POSITIONED, detector.phase());
    }

    @Test
    void testNoCallWhenCloseDoesNotRise() {
        detector.onCandle(candle(10, 0, 112), BAND);

        assertTrue(detector.onCandle(candle(10, 5, 111), BAND).isEmpty());
        assertEquals(EntryPhase.ARMED, detector.phase());
    }

    @Test
    void testNoCallWhenPreviousCloseInsideBand() {
        detector.onCandle(candle(10, 0, 110), BAND);

        // Closing exactly on R is not a break
        assertTrue(detector.onCandle(candle(10, 5, 115), BAND).isEmpty());
    }

    @Test
    void testPutBreakout() {
        detector.onCandle(candle(10, 0, 89), BAND);

        assertEquals(Optional.of(TradeSide.PUT), detector.onCandle(candle(10, 5, 88), BAND));
    }

    @Test
    void testNoSignalsWhilePositioned() {
        detector.onCandle(candle(10, 0, 111), BAND);
        detector.onCandle(candle(10, 5, 112), BAND);

        assertTrue(detector.onCandle(candle(10, 10, 113), BAND).isEmpty());
        assertTrue(detector.onCandle(candle(10, 15, 114), BAND).isEmpty());
        assertEquals(EntryPhase.POSITIONED, detector.phase());
    }

    @Test
    void testRearmNeedsTwoClosesBackInsideBand() {
        detector.onCandle(candle(10, 0, 111), BAND);
        detector.onCandle(candle(10, 5, 112), BAND);
        detector.notifyClosed();

        assertEquals(EntryPhase.REARM_PENDING, detector.phase());
        assertEquals(TradeSide.CALL, detector.pendingRearmSide());

        // previous close 112 is still above R
        assertTrue(detector.onCandle(candle(10, 10, 105), BAND).isEmpty());
        assertEquals(EntryPhase.REARM_PENDING, detector.phase());

        assertTrue(detector.onCandle(candle(10, 15, 104), BAND).isEmpty());
        assertEquals(EntryPhase.ARMED, detector.phase());
        assertNull(detector.pendingRearmSide());
    }

    @Test
    void testRearmCandleIsEvaluatedForOppositeSide() {
        detector.onCandle(candle(10, 0, 89), BAND);
        detector.onCandle(candle(10, 5, 88), BAND);
        detector.notifyClosed();

        // PUT re-arm clears on two closes >= G; the same pair breaks out upwards
        detector.onCandle(candle(10, 10, 115), BAND);
        Optional<TradeSide> signal = detector.onCandle(candle(10, 15, 116), BAND);

        assertEquals(Optional.of(TradeSide.CALL), signal);
        assertEquals(EntryPhase.POSITIONED, detector.phase());
    }

    @Test
    void testAbortEntryReturnsToArmedWithoutRearm() {
        detector.onCandle(candle(10, 0, 111), BAND);
        detector.onCandle(candle(10, 5, 112), BAND);

        detector.abortEntry();

        assertEquals(EntryPhase.ARMED, detector.phase());
        assertNull(detector.pendingRearmSide());
        // Trend continues: next candle confirms again
        assertEquals(Optional.of(TradeSide.CALL), detector.onCandle(candle(10, 10, 113), BAND));
    }

    @Test
    void testOutOfOrderCandleIgnored() {
        detector.onCandle(candle(10, 5, 111), BAND);

        assertTrue(detector.onCandle(candle(10, 0, 120), BAND).isEmpty());
        assertEquals(clock.at(DAY, LocalTime.of(10, 5)), detector.previous().windowStart());
    }

    @Test
    void testResetReturnsToWaiting() {
        detector.onCandle(candle(10, 0, 111), BAND);
        detector.reset();

        assertEquals(EntryPhase.WAITING, detector.phase());
        assertNull(detector.previous());
    }

    @Test
    void testRisingSequenceAcrossResistanceOfHundred() {
        ReferenceBand band = ReferenceBand.of(BigDecimal.valueOf(100), BigDecimal.valueOf(90));

        assertTrue(detector.onCandle(candle(10, 0, 98), band).isEmpty());
        assertTrue(detector.onCandle(candle(10, 5, 101), band).isEmpty(), "98 is not above 100");
        assertEquals(Optional.of(TradeSide.CALL), detector.onCandle(candle(10, 10, 105), band));
    }

    @Test
    void testQualifyingPairSuppressedAfterCallExit() {
        detector.onCandle(candle(10, 0, 111), BAND);
        detector.onCandle(candle(10, 5, 112), BAND);
        detector.notifyClosed();

        assertTrue(detector.onCandle(candle(10, 10, 113), BAND).isEmpty());
        assertTrue(detector.onCandle(candle(10, 15, 114), BAND).isEmpty());
        assertEquals(EntryPhase.REARM_PENDING, detector.phase());

        assertTrue(detector.onCandle(candle(10, 20, 109), BAND).isEmpty());
        assertEquals(EntryPhase.REARM_PENDING, detector.phase(), "Previous close 114 still above resistance");

        assertTrue(detector.onCandle(candle(10, 25, 108), BAND).isEmpty());
        assertEquals(EntryPhase.ARMED, detector.phase());

        assertTrue(detector.onCandle(candle(10, 30, 111), BAND).isEmpty());
        assertEquals(Optional.of(TradeSide.CALL), detector.onCandle(candle(10, 35, 113), BAND));
    }
}
