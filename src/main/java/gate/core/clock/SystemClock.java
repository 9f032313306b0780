package gate.core.clock;

/**
 * Monotonic clock over System.nanoTime(), read by each rule inside its lock.
 *
 * Shares its time base with ScheduledSleeper, so a rule's retry-after delay and
 * the timer that waits it out agree. Use ManualClock where tests need determinism.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
