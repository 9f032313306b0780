package gate.java.limiter;

import gate.core.algorithms.sliding_window.RateLimitRule;
import gate.core.clock.Clock;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link RateLimitRule} instances from configuration.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class RuleFactory {

    private RuleFactory() {
        // Utility class, no instantiation
    }

    /**
     * @param clock Clock the rule reads inside its critical section
     * @param config Rule parameters
     * @return A new rule with empty history
     * @throws IllegalArgumentException if clock or config is null
     */
    public static RateLimitRule create(Clock clock, RuleConfig config) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");

        return new RateLimitRule(clock, config.windowNanos(), config.limit());
    }

    /**
     * Creates one rule per config, in order, all on the same clock.
     *
     * @throws IllegalArgumentException if configs is null or empty
     */
    public static List<RateLimitRule> createAll(Clock clock, List<RuleConfig> configs) {
        if (configs == null || configs.isEmpty()) {
            throw new IllegalArgumentException("at least one rule config is required");
        }
        List<RateLimitRule> rules = new ArrayList<>(configs.size());
        for (RuleConfig config : configs) {
            rules.add(create(clock, config));
        }
        return List.copyOf(rules);
    }
}
