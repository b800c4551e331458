package in.niftybreak.service.strategy;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.model.BandSet;
import in.niftybreak.domain.model.ReferenceBand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reference Band Calculator.
 *
 * Computes R = max(high), G = min(low), B = (R + G) / 2 per instrument over
 * the morning window, and holds the day's current BandSet. The set is
 * replaced by an atomic swap; readers call current() each time instead of
 * keeping a copy.
 */
public final class ReferenceBandCalculator {
    private static final Logger log = LoggerFactory.getLogger(ReferenceBandCalculator.class);

    private final AtomicReference<BandSet> current = new AtomicReference<>();

    /**
     * Compute one band per instrument. Instruments with no candles are omitted.
     */
    public static Map<String, ReferenceBand> compute(Map<String, List<Candle>> windowCandlesByInstrument) {
        Map<String, ReferenceBand> bands = new LinkedHashMap<>();
        windowCandlesByInstrument.forEach((instrumentId, candles) -> {
            if (candles.isEmpty()) {
                log.warn("No candles in reference window for {}, band skipped", instrumentId);
            } else {
                bands.put(instrumentId, ReferenceBand.fromCandles(candles));
            }
        });
        return bands;
    }

    /**
     * First computation: index candles only. Leg bands mirror the index band
     * until the final computation replaces them.
     */
    public Optional<BandSet> computeProvisional(List<Candle> indexWindow) {
        if (indexWindow.isEmpty()) {
            log.warn("No index candles in reference window, provisional band deferred");
            return Optional.empty();
        }
        BandSet set = BandSet.provisional(ReferenceBand.fromCandles(indexWindow));
        current.set(set);
        log.info("Provisional reference band from {} index candles: {}", indexWindow.size(), set.index());
        return Optional.of(set);
    }

    /**
     * Second computation with the selected option legs. Replaces the provisional set.
     */
    public Optional<BandSet> computeFinal(List<Candle> indexWindow, List<Candle> callWindow, List<Candle> putWindow) {
        if (indexWindow.isEmpty() || callWindow.isEmpty() || putWindow.isEmpty()) {
            log.warn("Reference window incomplete (index={}, call={}, put={}), final band deferred",
                indexWindow.size(), callWindow.size(), putWindow.size());
            return Optional.empty();
        }
        BandSet set = BandSet.finalBands(
            ReferenceBand.fromCandles(indexWindow),
            ReferenceBand.fromCandles(callWindow),
            ReferenceBand.fromCandles(putWindow));
        BandSet previous = current.getAndSet(set);
        log.info("Final reference bands ({}): index [{}], call [{}], put [{}]",
            previous == null ? "first" : "replaced " + previous.stage(),
            set.index(), set.call(), set.put());
        return Optional.of(set);
    }

    /**
     * Latest band set, or null before the first computation.
     */
    public BandSet current() {
        return current.get();
    }

    public void reset() {
        current.set(null);
    }
}
