package in.niftybreak.service.backtest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.niftybreak.domain.model.TradeRecord;
import in.niftybreak.persistence.TradeCsvFormat;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;

/**
 * Renders a BacktestResult: console table, trade CSV and summary JSON.
 */
public final class BacktestReport {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final ZoneId zone;

    public BacktestReport(ZoneId zone) {
        this.zone = zone;
    }

    public String summaryTable(BacktestResult result) {
        BacktestSummary s = result.summary();
        StringBuilder sb = new StringBuilder();
        sb.append("════════════════════════════════════════\n");
        sb.append("  BACKTEST SUMMARY\n");
        sb.append("════════════════════════════════════════\n");
        row(sb, "Days traded", String.valueOf(result.daysTraded().size()));
        row(sb, "Days skipped", String.valueOf(result.daysSkipped().size()));
        row(sb, "Trades", String.valueOf(s.totalTrades()));
        row(sb, "Wins", String.valueOf(s.wins()));
        row(sb, "Losses", String.valueOf(s.losses()));
        row(sb, "Win rate %", plain(s.winRate()));
        row(sb, "Total P&L", plain(s.totalPnl()));
        row(sb, "Average P&L", plain(s.averagePnl()));
        row(sb, "Average win", plain(s.averageWin()));
        row(sb, "Average loss", plain(s.averageLoss()));
        row(sb, "Max win", plain(s.maxWin()));
        row(sb, "Max loss", plain(s.maxLoss()));
        row(sb, "Profit factor", s.profitFactor() == null ? "n/a" : plain(s.profitFactor()));
        sb.append("════════════════════════════════════════\n");
        return sb.toString();
    }

    public void writeTradesCsv(BacktestResult result, Path file) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            w.write(TradeCsvFormat.HEADER);
            w.newLine();
            for (TradeRecord t : result.trades()) {
                w.write(TradeCsvFormat.format(t, zone));
                w.newLine();
            }
        }
    }

    public void writeSummaryJson(BacktestResult result, Path file) throws IOException {
        MAPPER.writeValue(file.toFile(), result);
    }

    private static void row(StringBuilder sb, String label, String value) {
        sb.append(String.format("  %-16s %20s%n", label, value));
    }

    private static String plain(BigDecimal v) {
        return v == null ? "" : v.toPlainString();
    }
}
