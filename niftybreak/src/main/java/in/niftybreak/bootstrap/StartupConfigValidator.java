package in.niftybreak.bootstrap;

import in.niftybreak.config.ConnectionSettings;
import in.niftybreak.config.StrategyConfig;
import in.niftybreak.config.TradingPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Startup configuration validator.
 *
 * Runs before anything connects or subscribes. Any problem throws
 * IllegalStateException listing every failed check, and the engine refuses
 * to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private StartupConfigValidator() {
    }

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(StrategyConfig config, ConnectionSettings connection) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> errors = new ArrayList<>(config.validate());

        // an out-of-range phase is already reported by config.validate()
        TradingPhase phase = config.tradingPhase() >= 1 && config.tradingPhase() <= 3 ? config.phase() : null;

        if (phase != null) {
            log.info("Trading phase: {} ({})", phase.code(), phase.description());
            if (phase.usesRealData()) {
                if (connection.kiteApiKey().isBlank()) {
                    errors.add("KITE_API_KEY required for phase " + phase.code());
                }
                if (connection.kiteAccessToken().isBlank()) {
                    errors.add("KITE_ACCESS_TOKEN required for phase " + phase.code());
                }
            }
            if (phase.placesRealOrders()) {
                if (connection.orderApiKey().isBlank()) {
                    errors.add("ORDER_API_KEY required for phase 3 (live orders)");
                }
                if (connection.orderApiBaseUrl().isBlank()) {
                    errors.add("ORDER_API_BASE_URL required for phase 3 (live orders)");
                }
            }
        }

        Path instruments = Path.of(connection.instrumentsCsvPath());
        if (!Files.isReadable(instruments)) {
            errors.add("Instrument master not readable: " + instruments + " (set INSTRUMENTS_CSV_PATH)");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: " + errors.size() + " problem(s)\n" +
                "  - " + String.join("\n  - ", errors) + "\n" +
                "System refuses to start."
            );
        }

        if (phase.placesRealOrders()) {
            log.warn("⚠️  LIVE ORDERS ENABLED - orders go to {} (key {})",
                connection.orderApiBaseUrl(), ConnectionSettings.mask(connection.orderApiKey()));
        } else {
            log.info("Paper trading - no real orders will be placed");
        }
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }
}
