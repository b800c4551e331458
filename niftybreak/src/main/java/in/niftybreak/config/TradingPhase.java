package in.niftybreak.config;

/**
 * Rollout phase of the live engine.
 */
public enum TradingPhase {
    MOCK_PAPER(1, "Mock data + paper trading"),
    LIVE_DATA_PAPER(2, "Kite data + paper trading"),
    LIVE(3, "Kite data + live orders");

    private final int code;
    private final String description;

    TradingPhase(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    public boolean usesRealData() {
        return code >= 2;
    }

    public boolean placesRealOrders() {
        return code == 3;
    }

    public static TradingPhase fromCode(int code) {
        for (TradingPhase phase : values()) {
            if (phase.code == code) {
                return phase;
            }
        }
        throw new IllegalStateException("Unknown TRADING_PHASE: " + code + " (expected 1, 2 or 3)");
    }
}
