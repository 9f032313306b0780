package gate.java.limiter;

import gate.core.algorithms.sliding_window.RateLimitRule;
import gate.core.clock.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleConfigTest {

    @Test
    void testOf_convertsDurationToNanos() {
        RuleConfig config = RuleConfig.of(3, Duration.ofSeconds(5));

        assertEquals(3, config.limit());
        assertEquals(5_000_000_000L, config.windowNanos());
        assertEquals(config, RuleConfig.perSeconds(3, 5));
    }

    @Test
    void testValidation_rejectsNonPositiveValues() {
        assertThrows(IllegalArgumentException.class, () -> new RuleConfig(0, 1L));
        assertThrows(IllegalArgumentException.class, () -> new RuleConfig(1, 0L));
        assertThrows(IllegalArgumentException.class, () -> RuleConfig.of(1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RuleConfig.of(1, Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> RuleConfig.of(1, null));
        assertThrows(IllegalArgumentException.class, () -> RuleConfig.perSeconds(-2, 5));
        assertThrows(IllegalArgumentException.class, () -> RuleConfig.perSeconds(2, 0));
    }

    @Test
    void testFactory_createsRulesInOrder() {
        ManualClock clock = new ManualClock(0L);

        List<RateLimitRule> rules = RuleFactory.createAll(clock, List.of(
            RuleConfig.perSeconds(3, 5),
            RuleConfig.perSeconds(10, 60)
        ));

        assertEquals(2, rules.size());
        assertEquals(3, rules.get(0).limit());
        assertEquals(5_000_000_000L, rules.get(0).windowNanos());
        assertEquals(10, rules.get(1).limit());
        assertEquals(60_000_000_000L, rules.get(1).windowNanos());
        assertEquals(0, rules.get(1).size());
    }

    @Test
    void testFactory_rejectsMissingInputs() {
        ManualClock clock = new ManualClock(0L);
        RuleConfig config = RuleConfig.perSeconds(1, 1);

        assertThrows(IllegalArgumentException.class, () -> RuleFactory.create(null, config));
        assertThrows(IllegalArgumentException.class, () -> RuleFactory.create(clock, null));
        assertThrows(IllegalArgumentException.class, () -> RuleFactory.createAll(clock, List.of()));
        assertThrows(IllegalArgumentException.class, () -> RuleFactory.createAll(clock, null));
    }
}
