package in.niftybreak.service.strategy;

import in.niftybreak.domain.model.ExitReason;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.Position;
import in.niftybreak.domain.model.TradeSide;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immediate fills at the requested price. Used by backtests.
 */
public final class SimulatedExecution implements TradeExecutor {

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ExecutionResult enter(String tradeId, TradeSide side, OptionContract contract, int qty,
                                 BigDecimal price, Instant at) {
        return ExecutionResult.filled(price, "SIM_" + sequence.incrementAndGet());
    }

    @Override
    public ExecutionResult exit(Position position, BigDecimal price, ExitReason reason, Instant at) {
        return ExecutionResult.filled(price, "SIM_" + sequence.incrementAndGet());
    }
}
