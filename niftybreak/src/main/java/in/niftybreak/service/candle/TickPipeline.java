package in.niftybreak.service.candle;

import in.niftybreak.domain.data.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-writer tick pipeline.
 *
 * Feed threads call offer(); one consumer thread performs every aggregator
 * update and the price cache write. offer() never blocks: when the queue is
 * full the tick is dropped and counted.
 */
public final class TickPipeline {
    private static final Logger log = LoggerFactory.getLogger(TickPipeline.class);
    private static final long DROP_LOG_INTERVAL_MS = 10_000;

    private final CandleAggregator aggregator;
    private final LatestPriceCache priceCache;
    private final SessionClock sessionClock;
    private final BlockingQueue<Tick> queue;
    private final ExecutorService consumer;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong outsideSession = new AtomicLong();
    private volatile long lastDropLogAt = 0;
    private volatile boolean running = false;

    public TickPipeline(CandleAggregator aggregator, LatestPriceCache priceCache,
                        SessionClock sessionClock, int capacity) {
        this.aggregator = aggregator;
        this.priceCache = priceCache;
        this.sessionClock = sessionClock;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.consumer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tick-consumer");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("Tick pipeline already running");
            return;
        }
        running = true;
        consumer.submit(this::consumeLoop);
        log.info("Tick pipeline started (capacity={})", queue.remainingCapacity() + queue.size());
    }

    /**
     * Enqueue a tick from a feed thread.
     *
     * @return false if the tick was dropped
     */
    public boolean offer(Tick tick) {
        if (queue.offer(tick)) {
            accepted.incrementAndGet();
            return true;
        }
        long count = dropped.incrementAndGet();
        long now = System.currentTimeMillis();
        if (now - lastDropLogAt > DROP_LOG_INTERVAL_MS) {
            lastDropLogAt = now;
            log.warn("Tick queue full, dropping ticks (total dropped={})", count);
        }
        return false;
    }

    private void consumeLoop() {
        while (running) {
            try {
                Tick tick = queue.poll(200, TimeUnit.MILLISECONDS);
                if (tick != null) {
                    process(tick);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Tick processing failed", e);
            }
        }
        log.info("Tick consumer stopped (processed={}, dropped={}, outsideSession={})",
            processed.get(), dropped.get(), outsideSession.get());
    }

    private void process(Tick tick) {
        try {
            priceCache.update(tick.instrumentId(), tick.price(), tick.timestamp());
            if (!sessionClock.isWithinSession(tick.timestamp())) {
                outsideSession.incrementAndGet();
                log.debug("Tick outside market hours for {}: {}", tick.instrumentId(), tick.timestamp());
                return;
            }
            aggregator.ingestTick(tick.instrumentId(), tick.price(), tick.timestamp());
        } finally {
            processed.incrementAndGet();
        }
    }

    /**
     * Wait until every accepted tick has been processed.
     *
     * @return true if drained within the timeout
     */
    public boolean awaitDrained(long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (processed.get() < accepted.get()) {
            if (System.currentTimeMillis() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        consumer.shutdown();
        try {
            if (!consumer.awaitTermination(2, TimeUnit.SECONDS)) {
                consumer.shutdownNow();
            }
        } catch (InterruptedException e) {
            consumer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long processedCount() {
        return processed.get();
    }
}
