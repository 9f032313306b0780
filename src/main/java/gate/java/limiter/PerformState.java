package gate.java.limiter;

/**
 * Lifecycle of one {@link RateLimiter#perform} call.
 *
 * WAITING -> ALL_GRANTED -> COMMITTING -> EXECUTING -> DONE | FAILED,
 * or WAITING -> CANCELLED. FAILED is also reached from WAITING when a rule
 * check throws.
 */
public enum PerformState {
    /** At least one rule has not granted yet. Cancellable. */
    WAITING,
    /** Every rule granted; cancellation is no longer accepted. */
    ALL_GRANTED,
    COMMITTING,
    EXECUTING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
