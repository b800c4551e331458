package in.niftybreak.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Real-time last-traded-price tick.
 * Consumed immediately by the candle pipeline.
 */
public record Tick(
    String instrumentId,
    BigDecimal price,
    Instant timestamp
) {}
