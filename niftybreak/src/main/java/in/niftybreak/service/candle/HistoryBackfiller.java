package in.niftybreak.service.candle;

import in.niftybreak.domain.data.Candle;
import in.niftybreak.domain.data.TimeframeType;
import in.niftybreak.infrastructure.common.RetryPolicy;
import in.niftybreak.infrastructure.common.Sleeper;
import in.niftybreak.infrastructure.history.HistoricalDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * History Backfiller - fetch missed 1-minute bars and merge them into the aggregator.
 *
 * Used when:
 * 1. The engine starts after market open (index from session start)
 * 2. Option legs are subscribed after strike selection (legs from reference window start)
 *
 * Only completed minutes are ingested, with callbacks disabled so that
 * backfilled candles never reach the strategy as live signals.
 */
public final class HistoryBackfiller {
    private static final Logger log = LoggerFactory.getLogger(HistoryBackfiller.class);

    private final HistoricalDataProvider provider;
    private final CandleAggregator aggregator;
    private final Supplier<RetryPolicy> retryPolicies;
    private final Sleeper sleeper;
    private final Duration fetchTimeout;

    public HistoryBackfiller(HistoricalDataProvider provider, CandleAggregator aggregator) {
        this(provider, aggregator, RetryPolicy::forHistory, Sleeper.SYSTEM, Duration.ofSeconds(15));
    }

    public HistoryBackfiller(
            HistoricalDataProvider provider,
            CandleAggregator aggregator,
            Supplier<RetryPolicy> retryPolicies,
            Sleeper sleeper,
            Duration fetchTimeout) {
        this.provider = provider;
        this.aggregator = aggregator;
        this.retryPolicies = retryPolicies;
        this.sleeper = sleeper;
        this.fetchTimeout = fetchTimeout;
    }

    /**
     * Backfill 1-minute bars for [from, now floored to the minute).
     *
     * @return number of bars handed to the aggregator
     */
    public int backfill(String instrumentId, Instant from, Instant now) {
        Instant upTo = TimeframeType.MINUTE_1.floor(now);
        if (!from.isBefore(upTo)) {
            log.debug("Nothing to backfill for {}: from {} not before {}", instrumentId, from, upTo);
            return 0;
        }

        List<Candle> bars = fetchWithRetry(instrumentId, from, upTo);
        if (bars.isEmpty()) {
            log.warn("Backfill for {} [{}, {}) returned no bars, continuing without history",
                instrumentId, from, upTo);
            return 0;
        }

        int ingested = 0;
        for (Candle bar : bars) {
            if (bar.windowStart().isBefore(from) || !bar.windowStart().isBefore(upTo)) {
                continue;
            }
            aggregator.ingestHistoricalBar(bar, false);
            ingested++;
        }
        log.info("Backfilled {} 1-min bars for {} [{}, {})", ingested, instrumentId, from, upTo);
        return ingested;
    }

    private List<Candle> fetchWithRetry(String instrumentId, Instant from, Instant upTo) {
        RetryPolicy policy = retryPolicies.get();
        while (policy.shouldRetry()) {
            try {
                List<Candle> bars = provider.fetch(instrumentId, from, upTo, TimeframeType.MINUTE_1)
                    .get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!bars.isEmpty()) {
                    policy.recordSuccess();
                    return bars;
                }
                log.warn("Historical fetch for {} returned empty (attempt {}/{})",
                    instrumentId, policy.getAttemptCount() + 1, policy.getMaxAttempts());
            } catch (ExecutionException | TimeoutException e) {
                log.warn("Historical fetch for {} failed (attempt {}/{}): {}",
                    instrumentId, policy.getAttemptCount() + 1, policy.getMaxAttempts(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }

            policy.recordFailure();
            if (!policy.shouldRetry()) {
                break;
            }
            try {
                sleeper.sleep(policy.getNextDelay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }
        return List.of();
    }
}
