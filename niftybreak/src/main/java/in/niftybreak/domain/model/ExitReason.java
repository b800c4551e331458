package in.niftybreak.domain.model;

/**
 * Exit reasons for trade exits.
 */
public enum ExitReason {
    SL_HIT, // Candle low touched the current stop
    RSI_EXIT, // Oscillator retraced from its peak
    HARD_EXIT, // End-of-window forced close
    SHUTDOWN, // Process shutting down with an open position
    MANUAL // Operator exit
}
