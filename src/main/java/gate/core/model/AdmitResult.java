package gate.core.model;

/**
 * Outcome of one admission check against a rule.
 *
 * @param decision AVAILABLE when the rule has spare capacity at {@code observedAtNanos}
 * @param observedAtNanos Instant the rule evaluated; for AVAILABLE this is the granted timestamp
 * @param readyAtNanos Earliest instant a slot frees up; equals observedAtNanos when AVAILABLE
 */
public record AdmitResult(
    Decision decision,
    long observedAtNanos,
    long readyAtNanos
) {
    public static AdmitResult available(long nowNanos) {
        return new AdmitResult(Decision.AVAILABLE, nowNanos, nowNanos);
    }

    public static AdmitResult busy(long nowNanos, long readyAtNanos) {
        return new AdmitResult(Decision.BUSY, nowNanos, readyAtNanos);
    }

    public boolean isAvailable() {
        return decision == Decision.AVAILABLE;
    }

    public long retryAfterNanos() {
        return Math.max(0L, readyAtNanos - observedAtNanos);
    }
}
