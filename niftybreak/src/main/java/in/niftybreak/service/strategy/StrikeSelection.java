package in.niftybreak.service.strategy;

import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.TradeSide;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Outcome of strike selection. Either leg may be null when no contract was
 * found; callers must not trade unless isComplete().
 */
public record StrikeSelection(
    BigDecimal spot,
    LocalDate expiry,
    OptionContract call,
    OptionContract put
) {
    public boolean isComplete() {
        return call != null && put != null;
    }

    public OptionContract leg(TradeSide side) {
        return side == TradeSide.CALL ? call : put;
    }
}
