package in.niftybreak.service.candle;

import in.niftybreak.config.StrategyConfig;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Session Clock - maps exchange-local session times to instants.
 *
 * NSE regular session: 09:15 - 15:30 IST. 1- and 5-minute candles align to
 * the epoch, which coincides with local boundaries because the IST offset
 * (+05:30) is a whole number of 5-minute steps.
 */
public final class SessionClock {
    private final ZoneId zone;
    private final StrategyConfig config;

    public SessionClock(StrategyConfig config) {
        this.config = config;
        this.zone = config.zone();
    }

    public ZoneId zone() {
        return zone;
    }

    public Instant at(LocalDate date, LocalTime time) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }

    public LocalDate dateOf(Instant ts) {
        return ts.atZone(zone).toLocalDate();
    }

    public LocalTime timeOf(Instant ts) {
        return ts.atZone(zone).toLocalTime();
    }

    public Instant sessionStart(LocalDate date) {
        return at(date, config.marketStart());
    }

    public Instant sessionEnd(LocalDate date) {
        return at(date, config.marketEnd());
    }

    public Instant referenceStart(LocalDate date) {
        return at(date, config.referenceWindowStart());
    }

    public Instant referenceEnd(LocalDate date) {
        return at(date, config.referenceWindowEnd());
    }

    public Instant strikeSelection(LocalDate date) {
        return at(date, config.strikeSelectionTime());
    }

    public Instant tradingStart(LocalDate date) {
        return at(date, config.tradingStart());
    }

    public Instant hardExit(LocalDate date) {
        return at(date, config.hardExitTime());
    }

    /**
     * Check if timestamp is within [session start, session end] for its date.
     */
    public boolean isWithinSession(Instant ts) {
        LocalDate date = dateOf(ts);
        return !ts.isBefore(sessionStart(date)) && !ts.isAfter(sessionEnd(date));
    }

    public boolean isWeekend(LocalDate date) {
        return switch (date.getDayOfWeek()) {
            case SATURDAY, SUNDAY -> true;
            default -> false;
        };
    }
}
