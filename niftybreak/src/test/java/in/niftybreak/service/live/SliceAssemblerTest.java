package in.niftybreak.service.live;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.service.strategy.CandleSlice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SliceAssemblerTest {

    // 10:00 IST
    private static final Instant W0 = Instant.parse("2024-01-15T04:30:00Z");
    private static final Instant W1 = W0.plusSeconds(300);

    private final Map<String, Candle> backfilled = new HashMap<>();
    private SliceAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new SliceAssembler(Duration.ofSeconds(20),
            (id, w) -> Optional.ofNullable(backfilled.get(id + "@" + w)));
        assembler.setIndex("I");
        assembler.setLegs("C", "P");
    }

    private static Candle candle(String id, Instant w) {
        return Candle.of(id, TimeframeType.MINUTE_5, w, 100, 100, 100, 100);
    }

    @Test
    void testCompleteWindowReleasedImmediately() {
        assembler.add(candle("I", W0));
        assembler.add(candle("C", W0));
        assertTrue(assembler.drain(W1).isEmpty(), "Put leg still missing");

        assembler.add(candle("P", W0));
        List<CandleSlice> slices = assembler.drain(W1);

        assertEquals(1, slices.size());
        CandleSlice slice = slices.get(0);
        assertEquals(W0, slice.windowStart());
        assertNotNull(slice.index());
        assertNotNull(slice.call());
        assertNotNull(slice.put());
        assertEquals(0, assembler.pendingCount());
    }

    @Test
    void testIncompleteWindowReleasedAfterGrace() {
        assembler.add(candle("I", W0));
        assembler.add(candle("C", W0));

        assertTrue(assembler.drain(W1.plusSeconds(19)).isEmpty());
        List<CandleSlice> slices = assembler.drain(W1.plusSeconds(20));

        assertEquals(1, slices.size());
        assertNull(slices.get(0).put());
    }

    @Test
    void testLaterIndexCandleSupersedesWindow() {
        assembler.add(candle("I", W0));
        assembler.add(candle("I", W1));

        List<CandleSlice> slices = assembler.drain(W1);

        assertEquals(1, slices.size());
        assertEquals(W0, slices.get(0).windowStart());
        assertEquals(1, assembler.pendingCount());
    }

    @Test
    void testMissingLegsFilledFromLookup() {
        backfilled.put("C@" + W0, candle("C", W0));
        backfilled.put("P@" + W0, candle("P", W0));
        assembler.add(candle("I", W0));

        List<CandleSlice> slices = assembler.drain(W1);

        assertEquals(1, slices.size());
        assertNotNull(slices.get(0).call());
        assertNotNull(slices.get(0).put());
    }

    @Test
    void testIndexOnlySlicesBeforeSelection() {
        SliceAssembler indexOnly = new SliceAssembler(Duration.ofSeconds(20), (id, w) -> Optional.empty());
        indexOnly.setIndex("I");

        indexOnly.add(candle("I", W0));
        indexOnly.add(candle("C", W0));

        List<CandleSlice> slices = indexOnly.drain(W1);
        assertEquals(1, slices.size());
        assertNull(slices.get(0).call());
    }

    @Test
    void testCandleForReleasedWindowDropped() {
        assembler.add(candle("I", W0));
        assembler.add(candle("C", W0));
        assembler.add(candle("P", W0));
        assembler.drain(W1);

        assembler.add(candle("C", W0));

        assertEquals(0, assembler.pendingCount());
    }

    @Test
    void testReleasedInWindowOrder() {
        Instant w2 = W1.plusSeconds(300);
        for (Instant w : List.of(W1, W0, w2)) {
            assembler.add(candle("I", w));
            assembler.add(candle("C", w));
            assembler.add(candle("P", w));
        }

        List<CandleSlice> slices = assembler.drain(w2.plusSeconds(300));

        assertEquals(List.of(W0, W1, w2), slices.stream().map(CandleSlice::windowStart).toList());
    }

    @Test
    void testResetClearsLegs() {
        assembler.add(candle("I", W0));
        assembler.reset();

        assertEquals(0, assembler.pendingCount());
        assembler.add(candle("C", W1));
        assertEquals(0, assembler.pendingCount(), "Legs are unknown after reset");
    }
}
