package in.niftybreak.service.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.niftybreak.domain.model.TradeRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Output of a backtest run.
 */
public record BacktestResult(
    @JsonProperty("daysTraded") List<LocalDate> daysTraded,
    @JsonProperty("daysSkipped") List<SkippedDay> daysSkipped,
    @JsonProperty("trades") List<TradeRecord> trades,
    @JsonProperty("summary") BacktestSummary summary
) {
    public record SkippedDay(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("reason") String reason
    ) {}
}
