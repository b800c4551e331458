package in.niftybreak.service.live;

import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.Position;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.service.execution.OrderRequest;
import in.niftybreak.service.execution.OrderResult;
import in.niftybreak.service.execution.OrderSink;
import in.niftybreak.service.strategy.ExecutionResult;
import in.niftybreak.service.strategy.TradeExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Routes session entries and exits to an OrderSink and waits for the
 * acknowledgement. A failed or timed-out order is reported as not filled;
 * the session then keeps its state (no position on entry, pending exit on exit).
 */
public final class LiveTradeExecutor implements TradeExecutor {
    private static final Logger log = LoggerFactory.getLogger(LiveTradeExecutor.class);

    private final OrderSink sink;
    private final Duration timeout;

    public LiveTradeExecutor(OrderSink sink, Duration timeout) {
        this.sink = sink;
        this.timeout = timeout;
    }

    @Override
    public ExecutionResult enter(String tradeId, TradeSide side, OptionContract contract, int qty,
                                 BigDecimal price, Instant at) {
        OrderRequest request = OrderRequest.entry(tradeId, contract.symbol(), qty, price, at);
        return await(request, sink.placeEntry(request));
    }

    @Override
    public ExecutionResult exit(Position position, BigDecimal price, ExitReason reason, Instant at) {
        OrderRequest request = OrderRequest.exit(position.tradeId(), position.contract().symbol(),
            position.qty(), price, reason, at);
        return await(request, sink.placeExit(request));
    }

    private ExecutionResult await(OrderRequest request, CompletableFuture<OrderResult> future) {
        try {
            OrderResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            BigDecimal fill = result.averagePrice() != null ? result.averagePrice() : request.price();
            return ExecutionResult.filled(fill, result.orderId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[{}] {} {} failed: {}", sink.name(), request.signalType(), request.tradeId(), cause.getMessage());
            return ExecutionResult.rejected(cause.getMessage());
        } catch (TimeoutException e) {
            log.error("[{}] {} {} not acknowledged within {}s", sink.name(), request.signalType(),
                request.tradeId(), timeout.toSeconds());
            return ExecutionResult.rejected("timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.rejected("interrupted");
        }
    }
}
