package in.niftybreak.service.strategy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Leg band low=80 mid=90 high=100, entry 105, trailing increment 20.
 * Stage thresholds: mid at 115, high at 125, breakeven at 130.
 */
class StopLossManagerTest {

    private StopLossManager manager;

    @BeforeEach
    void setUp() {
        manager = new StopLossManager(BigDecimal.valueOf(20));
        manager.initialize(dec(105), dec(80), dec(90), dec(100));
    }

    private static BigDecimal dec(long v) {
        return BigDecimal.valueOf(v);
    }

    @Test
    void testInitialStopIsLegLow() {
        assertTrue(manager.isActive());
        assertEquals(dec(80), manager.currentStop());
        assertEquals(dec(80), manager.initialStop());
        assertFalse(manager.isBreakevenReached());
    }

    @Test
    void testNoMoveBelowFirstThreshold() {
        assertEquals(dec(80), manager.advance(dec(114)));
    }

    @Test
    void testOneStagePerCall() {
        assertEquals(dec(90), manager.advance(dec(130)), "first call: mid");
        assertEquals(dec(100), manager.advance(dec(130)), "second call: high");
        assertEquals(dec(105), manager.advance(dec(130)), "third call: entry");
        assertTrue(manager.isBreakevenReached());
    }

    @Test
    void testStagesInOrder() {
        assertEquals(dec(90), manager.advance(dec(115)));
        assertEquals(dec(90), manager.advance(dec(120)));
        assertEquals(dec(100), manager.advance(dec(125)));
        assertEquals(dec(100), manager.advance(dec(129)));
        assertFalse(manager.isBreakevenReached());
        assertEquals(dec(105), manager.advance(dec(130)));
        assertTrue(manager.isBreakevenReached());
    }

    @Test
    void testTrailingAfterBreakeven() {
        manager.advance(dec(130));
        manager.advance(dec(130));
        manager.advance(dec(130));

        // floor((150 - 105) / 20) = 2 -> 145
        assertEquals(0, manager.advance(dec(150)).compareTo(dec(145)));
        // lower price never lowers the stop
        assertEquals(0, manager.advance(dec(140)).compareTo(dec(145)));
        // floor((166 - 105) / 20) = 3 -> 165
        assertEquals(0, manager.advance(dec(166)).compareTo(dec(165)));
    }

    @Test
    void testTrailingIgnoredBeforeBreakeven() {
        assertEquals(dec(80), manager.advanceTrailing(dec(200)));
    }

    @Test
    void testCheckHit() {
        assertFalse(manager.checkHit(dec(81)));
        assertTrue(manager.checkHit(dec(80)), "touching the stop is a hit");
        assertTrue(manager.checkHit(dec(70)));
    }

    @Test
    void testUninitializedThrows() {
        StopLossManager fresh = new StopLossManager(BigDecimal.TEN);

        assertThrows(IllegalStateException.class, () -> fresh.advance(dec(100)));
        assertThrows(IllegalStateException.class, () -> fresh.checkHit(dec(100)));
        assertNull(fresh.currentStop());
    }

    @Test
    void testResetClearsState() {
        manager.reset();

        assertFalse(manager.isActive());
        assertNull(manager.currentStop());
    }

    @Test
    void testNonPositiveIncrementRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StopLossManager(BigDecimal.ZERO));
    }
}
