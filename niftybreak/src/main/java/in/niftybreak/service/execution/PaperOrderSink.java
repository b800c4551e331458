package in.niftybreak.service.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper trading: every order fills immediately at the requested price.
 * The orders are kept in memory for the day's paper log.
 */
public final class PaperOrderSink implements OrderSink {
    private static final Logger log = LoggerFactory.getLogger(PaperOrderSink.class);

    private final AtomicLong sequence = new AtomicLong();
    private final List<PaperOrder> orders = Collections.synchronizedList(new ArrayList<>());

    public record PaperOrder(String orderId, OrderRequest request) {}

    @Override
    public CompletableFuture<OrderResult> placeEntry(OrderRequest request) {
        return CompletableFuture.completedFuture(fill(request));
    }

    @Override
    public CompletableFuture<OrderResult> placeExit(OrderRequest request) {
        return CompletableFuture.completedFuture(fill(request));
    }

    private OrderResult fill(OrderRequest request) {
        String orderId = "PAPER_" + sequence.incrementAndGet();
        orders.add(new PaperOrder(orderId, request));
        log.info("[PAPER] {} {} {} x{} @ {} (trade {}){}",
            request.signalType(), request.side(), request.symbol(), request.qty(), request.price(),
            request.tradeId(), request.exitReason() == null ? "" : " reason=" + request.exitReason());
        return new OrderResult(orderId, request.price(), request.qty(), "Paper trading - " + request.signalType() + " simulated");
    }

    public List<PaperOrder> orders() {
        synchronized (orders) {
            return List.copyOf(orders);
        }
    }

    @Override
    public String name() {
        return "PAPER";
    }
}
