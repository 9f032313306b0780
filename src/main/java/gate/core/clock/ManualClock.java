package gate.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Clock that only moves when told to.
 * Reads and writes are atomic so waiters on other threads see every advance.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void setNanos(long value) {
        now.set(value);
    }
}
