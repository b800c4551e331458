package in.niftybreak.persistence;

import in.niftybreak.domain.model.TradeRecord;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Row format shared by the daily trade log and the backtest trade export.
 */
public final class TradeCsvFormat {

    public static final String HEADER =
        "trade_id,date,side,symbol,qty,entry_time,entry_price,exit_time,exit_price,exit_reason,pnl,initial_stop,final_stop,max_price";

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TradeCsvFormat() {
    }

    public static String format(TradeRecord t, ZoneId zone) {
        return String.join(",",
            t.tradeId(),
            t.date().toString(),
            t.side().name(),
            t.symbol(),
            String.valueOf(t.qty()),
            TIME.format(t.entryTime().atZone(zone)),
            plain(t.entryPrice()),
            TIME.format(t.exitTime().atZone(zone)),
            plain(t.exitPrice()),
            t.exitReason().name(),
            plain(t.pnl()),
            plain(t.initialStop()),
            plain(t.finalStop()),
            plain(t.maxPrice()));
    }

    private static String plain(BigDecimal v) {
        return v == null ? "" : v.toPlainString();
    }
}
