package in.niftybreak.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Strategy and session parameters.
 *
 * Times are exchange-local (see timezone). The reference window is
 * [referenceWindowStart, referenceWindowEnd).
 */
public record StrategyConfig(
    @JsonProperty("tradingPhase")
    int tradingPhase,               // 1 = mock+paper, 2 = real data+paper, 3 = live

    @JsonProperty("underlying")
    String underlying,              // Index symbol in the instrument master

    @JsonProperty("strikeOffset")
    BigDecimal strikeOffset,        // Distance from spot for call/put strikes

    @JsonProperty("strikeStep")
    BigDecimal strikeStep,          // Strike grid

    @JsonProperty("lotSize")
    int lotSize,

    @JsonProperty("dailyLossLimit")
    BigDecimal dailyLossLimit,

    @JsonProperty("maxPositions")
    int maxPositions,

    @JsonProperty("marketStart")
    LocalTime marketStart,

    @JsonProperty("referenceWindowStart")
    LocalTime referenceWindowStart,

    @JsonProperty("referenceWindowEnd")
    LocalTime referenceWindowEnd,

    @JsonProperty("strikeSelectionTime")
    LocalTime strikeSelectionTime,

    @JsonProperty("tradingStart")
    LocalTime tradingStart,

    @JsonProperty("hardExitTime")
    LocalTime hardExitTime,

    @JsonProperty("marketEnd")
    LocalTime marketEnd,

    @JsonProperty("trailingIncrement")
    BigDecimal trailingIncrement,

    @JsonProperty("rsiPeriod")
    int rsiPeriod,

    @JsonProperty("rsiExitDrop")
    BigDecimal rsiExitDrop,

    @JsonProperty("rsiLookback")
    int rsiLookback,                // Leg closes kept for the oscillator

    @JsonProperty("minSlicesPerDay")
    int minSlicesPerDay,            // Backtest skips thinner days

    @JsonProperty("sliceGraceSeconds")
    int sliceGraceSeconds,          // Live: wait for late leg candles

    @JsonProperty("orderTimeoutSeconds")
    int orderTimeoutSeconds,

    @JsonProperty("timezone")
    String timezone
) {
    /**
     * Default configuration (NIFTY weekly options).
     */
    public static StrategyConfig defaults() {
        return new StrategyConfig(
            1,
            "NIFTY",
            BigDecimal.valueOf(200),
            BigDecimal.valueOf(50),
            75,
            BigDecimal.valueOf(10000),
            1,
            LocalTime.of(9, 15),
            LocalTime.of(9, 45),
            LocalTime.of(10, 0),
            LocalTime.of(10, 0),
            LocalTime.of(10, 0),
            LocalTime.of(15, 15),
            LocalTime.of(15, 30),
            BigDecimal.valueOf(20),
            14,
            BigDecimal.valueOf(10),
            20,
            10,
            20,
            15,
            "Asia/Kolkata"
        );
    }

    public TradingPhase phase() {
        return TradingPhase.fromCode(tradingPhase);
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }

    /**
     * Validate configuration values.
     *
     * @return list of problems, empty when valid
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (tradingPhase < 1 || tradingPhase > 3) {
            errors.add("TRADING_PHASE must be 1, 2 or 3 (was " + tradingPhase + ")");
        }
        if (underlying == null || underlying.isBlank()) {
            errors.add("UNDERLYING must be set");
        }
        if (strikeOffset == null || strikeOffset.signum() <= 0) {
            errors.add("STRIKE_OFFSET must be positive");
        }
        if (strikeStep == null || strikeStep.signum() <= 0) {
            errors.add("STRIKE_STEP must be positive");
        }
        if (lotSize <= 0) {
            errors.add("LOT_SIZE must be positive");
        }
        if (dailyLossLimit == null || dailyLossLimit.signum() <= 0) {
            errors.add("DAILY_LOSS_LIMIT must be positive");
        }
        if (maxPositions != 1) {
            errors.add("MAX_POSITIONS other than 1 is not supported");
        }
        if (trailingIncrement == null || trailingIncrement.signum() <= 0) {
            errors.add("TRAILING_INCREMENT must be positive");
        }
        if (rsiPeriod < 2) {
            errors.add("RSI_PERIOD must be at least 2");
        }
        if (rsiLookback < rsiPeriod + 1) {
            errors.add("RSI_LOOKBACK must be at least RSI_PERIOD + 1");
        }
        if (rsiExitDrop == null || rsiExitDrop.signum() <= 0) {
            errors.add("RSI_EXIT_DROP must be positive");
        }
        if (orderTimeoutSeconds <= 0) {
            errors.add("ORDER_TIMEOUT_SECONDS must be positive");
        }
        if (sliceGraceSeconds < 0) {
            errors.add("SLICE_GRACE_SECONDS must not be negative");
        }
        try {
            ZoneId.of(timezone);
        } catch (RuntimeException e) {
            errors.add("TIMEZONE is not a valid zone id: " + timezone);
        }
        validateTimeline(errors);
        return errors;
    }

    private void validateTimeline(List<String> errors) {
        if (marketStart == null || referenceWindowStart == null || referenceWindowEnd == null
            || strikeSelectionTime == null || tradingStart == null
            || hardExitTime == null || marketEnd == null) {
            errors.add("All session times must be set");
            return;
        }
        if (referenceWindowStart.isBefore(marketStart)) {
            errors.add("REFERENCE_WINDOW_START must not be before MARKET_START_TIME");
        }
        if (!referenceWindowStart.isBefore(referenceWindowEnd)) {
            errors.add("REFERENCE_WINDOW_START must be before REFERENCE_WINDOW_END");
        }
        if (strikeSelectionTime.isBefore(referenceWindowEnd)) {
            errors.add("STRIKE_SELECTION_TIME must not be before REFERENCE_WINDOW_END");
        }
        if (tradingStart.isBefore(strikeSelectionTime)) {
            errors.add("TRADING_START_TIME must not be before STRIKE_SELECTION_TIME");
        }
        if (!tradingStart.isBefore(hardExitTime)) {
            errors.add("TRADING_START_TIME must be before HARD_EXIT_TIME");
        }
        if (hardExitTime.isAfter(marketEnd)) {
            errors.add("HARD_EXIT_TIME must not be after MARKET_END_TIME");
        }
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder(defaults());
    }

    /**
     * Builder for overlaying individual values on a base configuration.
     */
    public static class Builder {
        private int tradingPhase;
        private String underlying;
        private BigDecimal strikeOffset;
        private BigDecimal strikeStep;
        private int lotSize;
        private BigDecimal dailyLossLimit;
        private int maxPositions;
        private LocalTime marketStart;
        private LocalTime referenceWindowStart;
        private LocalTime referenceWindowEnd;
        private LocalTime strikeSelectionTime;
        private LocalTime tradingStart;
        private LocalTime hardExitTime;
        private LocalTime marketEnd;
        private BigDecimal trailingIncrement;
        private int rsiPeriod;
        private BigDecimal rsiExitDrop;
        private int rsiLookback;
        private int minSlicesPerDay;
        private int sliceGraceSeconds;
        private int orderTimeoutSeconds;
        private String timezone;

        private Builder(StrategyConfig base) {
            this.tradingPhase = base.tradingPhase;
            this.underlying = base.underlying;
            this.strikeOffset = base.strikeOffset;
            this.strikeStep = base.strikeStep;
            this.lotSize = base.lotSize;
            this.dailyLossLimit = base.dailyLossLimit;
            this.maxPositions = base.maxPositions;
            this.marketStart = base.marketStart;
            this.referenceWindowStart = base.referenceWindowStart;
            this.referenceWindowEnd = base.referenceWindowEnd;
            this.strikeSelectionTime = base.strikeSelectionTime;
            this.tradingStart = base.tradingStart;
            this.hardExitTime = base.hardExitTime;
            this.marketEnd = base.marketEnd;
            this.trailingIncrement = base.trailingIncrement;
            this.rsiPeriod = base.rsiPeriod;
            this.rsiExitDrop = base.rsiExitDrop;
            this.rsiLookback = base.rsiLookback;
            this.minSlicesPerDay = base.minSlicesPerDay;
            this.sliceGraceSeconds = base.sliceGraceSeconds;
            this.orderTimeoutSeconds = base.orderTimeoutSeconds;
            this.timezone = base.timezone;
        }

        public Builder tradingPhase(int tradingPhase) { this.tradingPhase = tradingPhase; return this; }
        public Builder underlying(String underlying) { this.underlying = underlying; return this; }
        public Builder strikeOffset(BigDecimal strikeOffset) { this.strikeOffset = strikeOffset; return this; }
        public Builder strikeStep(BigDecimal strikeStep) { this.strikeStep = strikeStep; return this; }
        public Builder lotSize(int lotSize) { this.lotSize = lotSize; return this; }
        public Builder dailyLossLimit(BigDecimal dailyLossLimit) { this.dailyLossLimit = dailyLossLimit; return this; }
        public Builder maxPositions(int maxPositions) { this.maxPositions = maxPositions; return this; }
        public Builder marketStart(LocalTime marketStart) { this.marketStart = marketStart; return this; }
        public Builder referenceWindowStart(LocalTime t) { this.referenceWindowStart = t; return this; }
        public Builder referenceWindowEnd(LocalTime t) { this.referenceWindowEnd = t; return this; }
        public Builder strikeSelectionTime(LocalTime t) { this.strikeSelectionTime = t; return this; }
        public Builder tradingStart(LocalTime t) { this.tradingStart = t; return this; }
        public Builder hardExitTime(LocalTime t) { this.hardExitTime = t; return this; }
        public Builder marketEnd(LocalTime t) { this.marketEnd = t; return this; }
        public Builder trailingIncrement(BigDecimal v) { this.trailingIncrement = v; return this; }
        public Builder rsiPeriod(int v) { this.rsiPeriod = v; return this; }
        public Builder rsiExitDrop(BigDecimal v) { this.rsiExitDrop = v; return this; }
        public Builder rsiLookback(int v) { this.rsiLookback = v; return this; }
        public Builder minSlicesPerDay(int v) { this.minSlicesPerDay = v; return this; }
        public Builder sliceGraceSeconds(int v) { this.sliceGraceSeconds = v; return this; }
        public Builder orderTimeoutSeconds(int v) { this.orderTimeoutSeconds = v; return this; }
        public Builder timezone(String timezone) { this.timezone = timezone; return this; }

        public StrategyConfig build() {
            return new StrategyConfig(
                tradingPhase, underlying, strikeOffset, strikeStep, lotSize,
                dailyLossLimit, maxPositions, marketStart, referenceWindowStart,
                referenceWindowEnd, strikeSelectionTime, tradingStart, hardExitTime,
                marketEnd, trailingIncrement, rsiPeriod, rsiExitDrop, rsiLookback,
                minSlicesPerDay, sliceGraceSeconds, orderTimeoutSeconds, timezone
            );
        }
    }
}
