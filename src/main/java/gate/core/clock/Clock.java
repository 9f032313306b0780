package gate.core.clock;

/**
 * Monotonic time source in nanoseconds.
 * Injected everywhere time is read so tests can drive it deterministically.
 */
public interface Clock {
    long nowNanos();
}
