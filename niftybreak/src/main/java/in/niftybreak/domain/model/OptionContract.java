package in.niftybreak.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Tradeable option contract resolved from the instrument master.
 */
public record OptionContract(
    String symbol,          // NIFTY24JAN21500CE
    String token,           // Broker instrument token
    BigDecimal strike,
    TradeSide side,
    LocalDate expiry,
    int lotSize
) {}
