package in.niftybreak.service.strategy;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.domain.model.BandSet;
import in.niftybreak.domain.model.ReferenceBand;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceBandCalculatorTest {

    private static final Instant T0 = Instant.parse("2024-01-15T04:15:00Z");

    private static Candle candle(String id, int minute, double high, double low) {
        return Candle.of(id, TimeframeType.MINUTE_1, T0.plusSeconds(60L * minute), low, high, low, high);
    }

    @Test
    void testBandFromHighsAndLows() {
        ReferenceBand band = ReferenceBand.fromCandles(List.of(
            candle("I", 0, 105, 100),
            candle("I", 1, 110, 98),
            candle("I", 2, 104, 101)));

        assertEquals(0, band.resistance().compareTo(BigDecimal.valueOf(110)));
        assertEquals(0, band.support().compareTo(BigDecimal.valueOf(98)));
        assertEquals(0, band.mid().compareTo(BigDecimal.valueOf(104)));
    }

    @Test
    void testComputeSkipsInstrumentsWithoutCandles() {
        Map<String, List<Candle>> windows = new LinkedHashMap<>();
        windows.put("I", List.of(candle("I", 0, 105, 95)));
        windows.put("C", List.of());

        Map<String, ReferenceBand> bands = ReferenceBandCalculator.compute(windows);

        assertEquals(1, bands.size());
        assertTrue(bands.containsKey("I"));
    }

    @Test
    void testProvisionalMirrorsIndexBand() {
        ReferenceBandCalculator calculator = new ReferenceBandCalculator();

        BandSet set = calculator.computeProvisional(List.of(candle("I", 0, 110, 90))).orElseThrow();

        assertFalse(set.isFinal());
        assertEquals(set.index(), set.call());
        assertEquals(set.index(), set.put());
        assertSame(set, calculator.current());
    }

    @Test
    void testFinalReplacesProvisional() {
        ReferenceBandCalculator calculator = new ReferenceBandCalculator();
        calculator.computeProvisional(List.of(candle("I", 0, 110, 90)));

        Optional<BandSet> set = calculator.computeFinal(
            List.of(candle("I", 0, 110, 90)),
            List.of(candle("C", 0, 120, 80)),
            List.of(candle("P", 0, 60, 40)));

        assertTrue(set.isPresent());
        assertTrue(calculator.current().isFinal());
        assertEquals(0, calculator.current().call().resistance().compareTo(BigDecimal.valueOf(120)));
        assertEquals(0, calculator.current().put().support().compareTo(BigDecimal.valueOf(40)));
    }

    @Test
    void testIncompleteFinalKeepsProvisional() {
        ReferenceBandCalculator calculator = new ReferenceBandCalculator();
        BandSet provisional = calculator.computeProvisional(List.of(candle("I", 0, 110, 90))).orElseThrow();

        Optional<BandSet> set = calculator.computeFinal(
            List.of(candle("I", 0, 110, 90)), List.of(), List.of(candle("P", 0, 60, 40)));

        assertTrue(set.isEmpty());
        assertSame(provisional, calculator.current());
    }

    @Test
    void testEmptyIndexWindowDefersProvisional() {
        ReferenceBandCalculator calculator = new ReferenceBandCalculator();

        assertTrue(calculator.computeProvisional(List.of()).isEmpty());
        assertNull(calculator.current());
    }

    @Test
    void testResistanceBelowSupportRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new ReferenceBand(BigDecimal.ONE, BigDecimal.TEN, BigDecimal.ONE));
    }
}
