package in.niftybreak.domain.model;

import in.niftybreak.domain.data.Candle;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Resistance (R), support (G) and midpoint (B) of one instrument over the
 * morning reference window.
 */
public record ReferenceBand(
    BigDecimal resistance,
    BigDecimal support,
    BigDecimal mid
) {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public ReferenceBand {
        if (resistance == null || support == null || mid == null) {
            throw new IllegalArgumentException("Band levels must not be null");
        }
        if (resistance.compareTo(support) < 0) {
            throw new IllegalArgumentException(
                "Resistance " + resistance + " below support " + support);
        }
    }

    public static ReferenceBand of(BigDecimal resistance, BigDecimal support) {
        BigDecimal mid = resistance.add(support).divide(TWO, 4, RoundingMode.HALF_UP);
        return new ReferenceBand(resistance, support, mid);
    }

    /**
     * R = max(high), G = min(low) over the candles.
     *
     * @throws IllegalArgumentException if candles is empty
     */
    public static ReferenceBand fromCandles(List<Candle> candles) {
        if (candles.isEmpty()) {
            throw new IllegalArgumentException("No candles in reference window");
        }
        BigDecimal high = candles.get(0).high();
        BigDecimal low = candles.get(0).low();
        for (Candle c : candles) {
            high = high.max(c.high());
            low = low.min(c.low());
        }
        return of(high, low);
    }

    @Override
    public String toString() {
        return "R=" + resistance.toPlainString()
            + " G=" + support.toPlainString()
            + " B=" + mid.toPlainString();
    }
}
