package in.niftybreak.domain.model;

/**
 * Reference bands of the index and both option legs for one trading day.
 *
 * A PROVISIONAL set is computed from index data only (legs mirror the index
 * band). The FINAL set is computed from real option-leg candles after strike
 * selection and replaces the provisional one as a whole.
 */
public record BandSet(
    ReferenceBand index,
    ReferenceBand call,
    ReferenceBand put,
    Stage stage
) {
    public enum Stage {
        PROVISIONAL,
        FINAL
    }

    public static BandSet provisional(ReferenceBand index) {
        return new BandSet(index, index, index, Stage.PROVISIONAL);
    }

    public static BandSet finalBands(ReferenceBand index, ReferenceBand call, ReferenceBand put) {
        return new BandSet(index, call, put, Stage.FINAL);
    }

    public boolean isFinal() {
        return stage == Stage.FINAL;
    }

    /**
     * Band of the option leg for a side.
     */
    public ReferenceBand leg(TradeSide side) {
        return side == TradeSide.CALL ? call : put;
    }
}
