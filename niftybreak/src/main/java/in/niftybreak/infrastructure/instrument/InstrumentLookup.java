package in.niftybreak.infrastructure.instrument;

import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.TradeSide;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Instrument master lookups used by strike selection.
 */
public interface InstrumentLookup {

    /**
     * Resolve (strike, side, expiry) to a tradeable contract.
     */
    Optional<OptionContract> find(BigDecimal strike, TradeSide side, LocalDate expiry);

    /**
     * Earliest option expiry on or after the given date.
     */
    Optional<LocalDate> nearestExpiry(LocalDate onOrAfter);

    /**
     * Instrument token of the underlying index.
     */
    Optional<String> indexToken();

    /**
     * Advisory liquidity check. Never blocks selection.
     */
    default boolean isLiquid(OptionContract contract) {
        return true;
    }
}
