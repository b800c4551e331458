package in.niftybreak.service.strategy;

import in.niftybreak.config.StrategyConfig;
import in.niftybreak.domain.model.OptionContract;
import in.niftybreak.domain.model.TradeSide;
import in.niftybreak.infrastructure.instrument.InstrumentLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Strike Selector - map the index spot to one call and one put contract.
 *
 * call strike = round(spot - offset, step), put strike = round(spot + offset, step),
 * both on the nearest expiry on or after the trading date. A missing strike
 * is retried at +step, then -step.
 */
public final class StrikeSelector {
    private static final Logger log = LoggerFactory.getLogger(StrikeSelector.class);

    private final InstrumentLookup instruments;
    private final BigDecimal offset;
    private final BigDecimal step;

    public StrikeSelector(InstrumentLookup instruments, StrategyConfig config) {
        this.instruments = instruments;
        this.offset = config.strikeOffset();
        this.step = config.strikeStep();
    }

    /**
     * Round to the nearest multiple of step. Ties go to the even multiple.
     */
    public static BigDecimal roundToNearest(BigDecimal value, BigDecimal step) {
        BigDecimal multiples = value.divide(step, 0, RoundingMode.HALF_EVEN);
        return multiples.multiply(step);
    }

    public StrikeSelection select(BigDecimal spot, LocalDate tradingDate) {
        BigDecimal callStrike = roundToNearest(spot.subtract(offset), step);
        BigDecimal putStrike = roundToNearest(spot.add(offset), step);
        log.info("Spot {} -> call strike {} CE, put strike {} PE", spot, callStrike, putStrike);

        Optional<LocalDate> expiry = instruments.nearestExpiry(tradingDate);
        if (expiry.isEmpty()) {
            log.error("No option expiry on or after {}, strike selection failed", tradingDate);
            return new StrikeSelection(spot, null, null, null);
        }

        OptionContract call = resolve(callStrike, TradeSide.CALL, expiry.get());
        OptionContract put = resolve(putStrike, TradeSide.PUT, expiry.get());

        StrikeSelection selection = new StrikeSelection(spot, expiry.get(), call, put);
        if (!selection.isComplete()) {
            log.error("Strike selection incomplete (call={}, put={}), not trading today",
                call == null ? "missing" : call.symbol(), put == null ? "missing" : put.symbol());
        } else {
            log.info("Strikes selected for expiry {}: call={} ({}), put={} ({})",
                expiry.get(), call.symbol(), call.token(), put.symbol(), put.token());
        }
        return selection;
    }

    private OptionContract resolve(BigDecimal strike, TradeSide side, LocalDate expiry) {
        for (BigDecimal candidate : List.of(strike, strike.add(step), strike.subtract(step))) {
            Optional<OptionContract> contract = instruments.find(candidate, side, expiry);
            if (contract.isPresent()) {
                if (candidate.compareTo(strike) != 0) {
                    log.info("Using alternate {} strike {} (wanted {})", side.optionType(), candidate, strike);
                }
                if (!instruments.isLiquid(contract.get())) {
                    log.warn("{} strike {} may be illiquid", side.optionType(), candidate);
                }
                return contract.get();
            }
            log.warn("{} strike {} {} not found for expiry {}", side, candidate, side.optionType(), expiry);
        }
        return null;
    }
}
