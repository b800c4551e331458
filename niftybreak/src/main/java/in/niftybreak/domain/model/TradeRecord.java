package in.niftybreak.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Completed trade. One per entry/exit pair, never mutated.
 */
public record TradeRecord(
    @JsonProperty("tradeId") String tradeId,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("side") TradeSide side,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("qty") int qty,
    @JsonProperty("entryTime") Instant entryTime,
    @JsonProperty("entryPrice") BigDecimal entryPrice,
    @JsonProperty("exitTime") Instant exitTime,
    @JsonProperty("exitPrice") BigDecimal exitPrice,
    @JsonProperty("exitReason") ExitReason exitReason,
    @JsonProperty("pnl") BigDecimal pnl,

    // Metadata
    @JsonProperty("initialStop") BigDecimal initialStop,
    @JsonProperty("finalStop") BigDecimal finalStop,
    @JsonProperty("maxPrice") BigDecimal maxPrice
) {
    public boolean isWin() {
        return pnl.signum() > 0;
    }
}
