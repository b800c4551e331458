package in.niftybreak.domain.model;

/**
 * Entry detector states.
 */
public enum EntryPhase {
    WAITING, // Before trading start time
    ARMED, // Evaluating breakout pairs
    POSITIONED, // Trade open, no new signals
    REARM_PENDING // Waiting for price to return inside the band on the closed side
}
