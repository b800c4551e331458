package in.niftybreak.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Open position. Exists only between entry fill and confirmed exit.
 *
 * pendingExit is set when an exit was decided but the order sink has not
 * confirmed it yet; the position stays open until it does.
 */
public record Position(
    String tradeId,
    TradeSide side,
    OptionContract contract,
    BigDecimal entryPrice,
    Instant entryTime,
    int qty,
    PendingExit pendingExit
) {
    public record PendingExit(ExitReason reason, BigDecimal price, Instant decidedAt) {}

    public boolean hasPendingExit() {
        return pendingExit != null;
    }

    public Position withPendingExit(PendingExit exit) {
        return new Position(tradeId, side, contract, entryPrice, entryTime, qty, exit);
    }
}
