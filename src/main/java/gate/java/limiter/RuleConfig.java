package gate.java.limiter;

import java.time.Duration;

/**
 * Configuration for one sliding-window rule: at most {@code limit}
 * admissions in any trailing window of {@code windowNanos}.
 *
 * @param limit Maximum admissions per window
 * @param windowNanos Window size in nanoseconds
 */
public record RuleConfig(
    int limit,
    long windowNanos
) {
    public RuleConfig {
        if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
        if (windowNanos <= 0) throw new IllegalArgumentException("windowSize must be > 0");
    }

    /**
     * @param limit Maximum admissions per window
     * @param window Window length (must be positive)
     * @return Configuration for the rule
     */
    public static RuleConfig of(int limit, Duration window) {
        if (window == null) throw new IllegalArgumentException("window cannot be null");
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("windowSize must be > 0");
        }
        return new RuleConfig(limit, window.toNanos());
    }

    /**
     * Shorthand for "limit per N seconds".
     */
    public static RuleConfig perSeconds(int limit, long seconds) {
        if (seconds <= 0) throw new IllegalArgumentException("windowSize must be > 0");
        return of(limit, Duration.ofSeconds(seconds));
    }
}
