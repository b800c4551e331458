package in.niftybreak.service.execution;

import java.util.concurrent.CompletableFuture;

/**
 * Destination for entry and exit signals.
 *
 * Error Handling:
 * - Both calls return a CompletableFuture
 * - A rejected or undeliverable order completes the future exceptionally
 *   with OrderPlacementException
 */
public interface OrderSink {

    CompletableFuture<OrderResult> placeEntry(OrderRequest request);

    CompletableFuture<OrderResult> placeExit(OrderRequest request);

    /**
     * Short name for logs ("PAPER", "HTTP").
     */
    String name();
}
