package in.niftybreak.service.execution;

/**
 * Exception thrown when order placement fails.
 */
public class OrderPlacementException extends RuntimeException {

    private final String sink;
    private final OrderRequest orderRequest;

    public OrderPlacementException(String sink, OrderRequest orderRequest, String message) {
        super(String.format("[%s] %s order placement failed for %s (%s): %s",
            sink, orderRequest.signalType(), orderRequest.symbol(), orderRequest.tradeId(), message));
        this.sink = sink;
        this.orderRequest = orderRequest;
    }

    public OrderPlacementException(String sink, OrderRequest orderRequest, String message, Throwable cause) {
        super(String.format("[%s] %s order placement failed for %s (%s): %s",
            sink, orderRequest.signalType(), orderRequest.symbol(), orderRequest.tradeId(), message), cause);
        this.sink = sink;
        this.orderRequest = orderRequest;
    }

    public String getSink() {
        return sink;
    }

    public OrderRequest getOrderRequest() {
        return orderRequest;
    }
}
