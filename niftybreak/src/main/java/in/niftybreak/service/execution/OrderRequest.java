package in.niftybreak.service.execution;

import in.niftybreak.domain.model.ExitReason;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Entry or exit signal sent to the order sink. Entries buy the option leg,
 * exits sell it.
 */
public record OrderRequest(
    SignalType signalType,
    String tradeId,
    String symbol,
    int qty,
    BigDecimal price,
    ExitReason exitReason,     // null for entries
    Instant timestamp
) {
    public enum SignalType {
        ENTRY,
        EXIT
    }

    public OrderRequest {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("Trade id cannot be null or empty");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (qty <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (signalType == SignalType.EXIT && exitReason == null) {
            throw new IllegalArgumentException("Exit reason is required for exits");
        }
    }

    public static OrderRequest entry(String tradeId, String symbol, int qty, BigDecimal price, Instant at) {
        return new OrderRequest(SignalType.ENTRY, tradeId, symbol, qty, price, null, at);
    }

    public static OrderRequest exit(String tradeId, String symbol, int qty, BigDecimal price,
                                    ExitReason reason, Instant at) {
        return new OrderRequest(SignalType.EXIT, tradeId, symbol, qty, price, reason, at);
    }

    public String side() {
        return signalType == SignalType.ENTRY ? "BUY" : "SELL";
    }

    /**
     * Key the order endpoint uses to drop duplicate submissions of the same signal.
     */
    public String idempotencyKey() {
        return tradeId + "-" + signalType;
    }
}
