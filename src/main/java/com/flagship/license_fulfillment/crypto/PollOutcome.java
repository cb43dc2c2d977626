package com.flagship.license_fulfillment.crypto;

/**
 * What a single monitor tick did. Everything except {@link #WAITING} and
 * {@link #ERROR} stops the monitor.
 */
public enum PollOutcome {
    /** No matching transaction yet. */
    WAITING,
    /** The explorer could not be queried; counts towards the poll cap. */
    ERROR,
    MATCHED,
    EXPIRED,
    /** The payment left PENDING elsewhere (another tick, the sweeper) or no longer exists. */
    CLOSED;

    public boolean isTerminal() {
        return this != WAITING && this != ERROR;
    }
}
