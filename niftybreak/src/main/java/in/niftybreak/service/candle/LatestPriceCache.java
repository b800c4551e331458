package in.niftybreak.service.candle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of the last traded price per instrument.
 * Written by the tick consumer, read by the control loop.
 */
public final class LatestPriceCache {
    private static final Logger log = LoggerFactory.getLogger(LatestPriceCache.class);

    private final ConcurrentHashMap<String, PriceData> latest = new ConcurrentHashMap<>();

    /**
     * Update latest price. Older timestamps never overwrite newer ones.
     */
    public void update(String instrumentId, BigDecimal price, Instant timestamp) {
        latest.merge(instrumentId, new PriceData(price, timestamp),
            (old, fresh) -> fresh.timestamp().isBefore(old.timestamp()) ? old : fresh);
        log.trace("Updated price cache: {} = {} @ {}", instrumentId, price, timestamp);
    }

    public Optional<PriceData> get(String instrumentId) {
        return Optional.ofNullable(latest.get(instrumentId));
    }

    public Optional<BigDecimal> price(String instrumentId) {
        return get(instrumentId).map(PriceData::price);
    }

    public Map<String, PriceData> snapshot() {
        return Map.copyOf(latest);
    }

    public void clear() {
        latest.clear();
        log.info("Price cache cleared");
    }

    /**
     * Immutable price data.
     */
    public record PriceData(BigDecimal price, Instant timestamp) {
        public PriceData {
            if (price == null || timestamp == null) {
                throw new IllegalArgumentException("price and timestamp cannot be null");
            }
        }
    }
}
