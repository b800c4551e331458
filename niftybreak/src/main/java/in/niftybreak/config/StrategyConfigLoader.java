package in.niftybreak.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.niftybreak.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the StrategyConfig.
 *
 * Layers, lowest first:
 * 1. StrategyConfig.defaults()
 * 2. JSON file named by STRATEGY_CONFIG_FILE (partial files allowed)
 * 3. Environment variables / system properties
 */
public final class StrategyConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(StrategyConfigLoader.class);

    private final ObjectMapper mapper;

    public StrategyConfigLoader() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public StrategyConfig load() {
        StrategyConfig base = StrategyConfig.defaults();
        String file = Env.get("STRATEGY_CONFIG_FILE", null);
        if (file != null) {
            base = overlayFile(base, Path.of(file));
        }
        return overlayEnv(base);
    }

    /**
     * Overlay a (possibly partial) JSON file on a base config.
     *
     * @throws IllegalStateException if the file is missing or malformed
     */
    public StrategyConfig overlayFile(StrategyConfig base, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalStateException("STRATEGY_CONFIG_FILE not found: " + file);
        }
        try {
            ObjectNode merged = mapper.valueToTree(base);
            JsonNode overrides = mapper.readTree(file.toFile());
            if (overrides == null || !overrides.isObject()) {
                throw new IllegalStateException("STRATEGY_CONFIG_FILE must contain a JSON object: " + file);
            }
            merged.setAll((ObjectNode) overrides);
            StrategyConfig config = mapper.treeToValue(merged, StrategyConfig.class);
            log.info("Loaded strategy config overrides from {}", file);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read STRATEGY_CONFIG_FILE " + file + ": " + e.getMessage(), e);
        }
    }

    public StrategyConfig overlayEnv(StrategyConfig base) {
        return base.toBuilder()
            .tradingPhase(Env.getInt("TRADING_PHASE", base.tradingPhase()))
            .underlying(Env.get("UNDERLYING", base.underlying()))
            .strikeOffset(Env.getDecimal("STRIKE_OFFSET", base.strikeOffset()))
            .strikeStep(Env.getDecimal("STRIKE_STEP", base.strikeStep()))
            .lotSize(Env.getInt("LOT_SIZE", base.lotSize()))
            .dailyLossLimit(Env.getDecimal("DAILY_LOSS_LIMIT", base.dailyLossLimit()))
            .maxPositions(Env.getInt("MAX_POSITIONS", base.maxPositions()))
            .marketStart(Env.getTime("MARKET_START_TIME", base.marketStart()))
            .referenceWindowStart(Env.getTime("REFERENCE_WINDOW_START", base.referenceWindowStart()))
            .referenceWindowEnd(Env.getTime("REFERENCE_WINDOW_END", base.referenceWindowEnd()))
            .strikeSelectionTime(Env.getTime("STRIKE_SELECTION_TIME", base.strikeSelectionTime()))
            .tradingStart(Env.getTime("TRADING_START_TIME", base.tradingStart()))
            .hardExitTime(Env.getTime("HARD_EXIT_TIME", base.hardExitTime()))
            .marketEnd(Env.getTime("MARKET_END_TIME", base.marketEnd()))
            .trailingIncrement(Env.getDecimal("TRAILING_INCREMENT", base.trailingIncrement()))
            .rsiPeriod(Env.getInt("RSI_PERIOD", base.rsiPeriod()))
            .rsiExitDrop(Env.getDecimal("RSI_EXIT_DROP", base.rsiExitDrop()))
            .rsiLookback(Env.getInt("RSI_LOOKBACK", base.rsiLookback()))
            .minSlicesPerDay(Env.getInt("MIN_SLICES_PER_DAY", base.minSlicesPerDay()))
            .sliceGraceSeconds(Env.getInt("SLICE_GRACE_SECONDS", base.sliceGraceSeconds()))
            .orderTimeoutSeconds(Env.getInt("ORDER_TIMEOUT_SECONDS", base.orderTimeoutSeconds()))
            .timezone(Env.get("TIMEZONE", base.timezone()))
            .build();
    }
}
