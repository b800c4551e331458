package in.niftybreak.service.strategy;

import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.Position;
import in.niftybreak.domain.model.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Seam between the shared strategy core and order handling.
 * Backtests fill immediately; the live loop routes through an OrderSink.
 */
public interface TradeExecutor {

    ExecutionResult enter(String tradeId, TradeSide side, OptionContract contract, int qty,
                          BigDecimal price, Instant at);

    /**
     * Request an exit. A result that is not filled leaves the position open.
     */
    ExecutionResult exit(Position position, BigDecimal price, ExitReason reason, Instant at);
}
