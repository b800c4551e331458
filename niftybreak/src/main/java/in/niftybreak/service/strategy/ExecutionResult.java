package in.niftybreak.service.strategy;

import java.math.BigDecimal;

/**
 * Result of an entry or exit request made by the trading session.
 */
public record ExecutionResult(
    boolean filled,
    BigDecimal price,
    String orderId,
    String message
) {
    public static ExecutionResult filled(BigDecimal price, String orderId) {
        return new ExecutionResult(true, price, orderId, "filled");
    }

    public static ExecutionResult rejected(String message) {
        return new ExecutionResult(false, null, null, message);
    }
}
