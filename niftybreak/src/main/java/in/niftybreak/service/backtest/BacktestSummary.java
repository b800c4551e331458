package in.niftybreak.service.backtest;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.niftybreak.domain.model.TradeRecord;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Aggregate statistics over completed trades. A trade with pnl <= 0 counts
 * as a loss. profitFactor is |avgWin / avgLoss|, null when there are no losses.
 */
public record BacktestSummary(
    @JsonProperty("totalTrades") int totalTrades,
    @JsonProperty("wins") int wins,
    @JsonProperty("losses") int losses,
    @JsonProperty("winRate") BigDecimal winRate,
    @JsonProperty("totalPnl") BigDecimal totalPnl,
    @JsonProperty("averagePnl") BigDecimal averagePnl,
    @JsonProperty("averageWin") BigDecimal averageWin,
    @JsonProperty("averageLoss") BigDecimal averageLoss,
    @JsonProperty("maxWin") BigDecimal maxWin,
    @JsonProperty("maxLoss") BigDecimal maxLoss,
    @JsonProperty("profitFactor") BigDecimal profitFactor
) {
    private static final int SCALE = 2;

    public static BacktestSummary of(List<TradeRecord> trades) {
        if (trades.isEmpty()) {
            return new BacktestSummary(0, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null);
        }

        int wins = 0;
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal winSum = BigDecimal.ZERO;
        BigDecimal lossSum = BigDecimal.ZERO;
        BigDecimal maxWin = null;
        BigDecimal maxLoss = null;

        for (TradeRecord t : trades) {
            BigDecimal pnl = t.pnl();
            total = total.add(pnl);
            if (pnl.signum() > 0) {
                wins++;
                winSum = winSum.add(pnl);
            } else {
                lossSum = lossSum.add(pnl);
            }
            maxWin = maxWin == null ? pnl : maxWin.max(pnl);
            maxLoss = maxLoss == null ? pnl : maxLoss.min(pnl);
        }

        int count = trades.size();
        int losses = count - wins;
        BigDecimal avgWin = wins == 0 ? BigDecimal.ZERO : avg(winSum, wins);
        BigDecimal avgLoss = losses == 0 ? BigDecimal.ZERO : avg(lossSum, losses);
        BigDecimal winRate = BigDecimal.valueOf(wins * 100L)
            .divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
        BigDecimal profitFactor = avgLoss.signum() == 0
            ? null
            : avgWin.divide(avgLoss, SCALE, RoundingMode.HALF_UP).abs();

        return new BacktestSummary(count, wins, losses, winRate,
            total.setScale(SCALE, RoundingMode.HALF_UP), avg(total, count),
            avgWin, avgLoss,
            maxWin.setScale(SCALE, RoundingMode.HALF_UP), maxLoss.setScale(SCALE, RoundingMode.HALF_UP),
            profitFactor);
    }

    private static BigDecimal avg(BigDecimal sum, int n) {
        return sum.divide(BigDecimal.valueOf(n), SCALE, RoundingMode.HALF_UP);
    }
}
