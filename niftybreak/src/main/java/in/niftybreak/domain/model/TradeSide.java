package in.niftybreak.domain.model;

/**
 * Option leg traded on a breakout.
 * CALL on an upside break of resistance, PUT on a downside break of support.
 */
public enum TradeSide {
    CALL("CE"),
    PUT("PE");

    private final String optionType;

    TradeSide(String optionType) {
        this.optionType = optionType;
    }

    /**
     * Exchange option type code (CE / PE).
     */
    public String optionType() {
        return optionType;
    }

    public static TradeSide fromOptionType(String code) {
        for (TradeSide side : values()) {
            if (side.optionType.equalsIgnoreCase(code)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown option type: " + code);
    }
}
