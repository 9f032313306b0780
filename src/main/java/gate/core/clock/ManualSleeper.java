package gate.core.clock;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Sleeper driven by a {@link ManualClock}.
 *
 * <p>Sleeps register a deadline on the clock's timeline and stay pending until
 * {@link #advanceNanos(long)} moves the clock past it. Due sleeps complete on the
 * advancing thread, earliest deadline first, after the clock has already moved,
 * so anything woken up reads the new time.
 */
public final class ManualSleeper implements Sleeper {

    private final ManualClock clock;
    private final PriorityQueue<Pending> pending = new PriorityQueue<>();
    private long sequence;

    public ManualSleeper(ManualClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    public ManualClock clock() {
        return clock;
    }

    @Override
    public CompletableFuture<Void> sleep(long delayNanos) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (delayNanos <= 0) {
            done.complete(null);
            return done;
        }
        synchronized (this) {
            pending.add(new Pending(clock.nowNanos() + delayNanos, sequence++, done));
        }
        return done;
    }

    /**
     * Moves the clock forward and wakes every sleep that is now due.
     * Sleeps registered by woken callbacks are honoured within the same advance.
     */
    public void advanceNanos(long delta) {
        clock.advanceNanos(delta);
        fireDue();
    }

    /**
     * Jumps the clock to the earliest pending deadline and wakes it.
     *
     * @return false if nothing is pending
     */
    public boolean advanceToNext() {
        long deadline;
        synchronized (this) {
            purgeCancelled();
            Pending next = pending.peek();
            if (next == null) {
                return false;
            }
            deadline = next.deadlineNanos;
        }
        long now = clock.nowNanos();
        if (deadline > now) {
            clock.advanceNanos(deadline - now);
        }
        fireDue();
        return true;
    }

    /**
     * Number of sleeps still waiting for their deadline (cancelled ones excluded).
     */
    public synchronized int pendingCount() {
        purgeCancelled();
        return pending.size();
    }

    private void fireDue() {
        while (true) {
            List<CompletableFuture<Void>> due = new ArrayList<>();
            synchronized (this) {
                long now = clock.nowNanos();
                while (!pending.isEmpty() && pending.peek().deadlineNanos <= now) {
                    due.add(pending.poll().future);
                }
            }
            if (due.isEmpty()) {
                return;
            }
            for (CompletableFuture<Void> future : due) {
                future.complete(null);
            }
        }
    }

    private void purgeCancelled() {
        pending.removeIf(p -> p.future.isDone());
    }

    private static final class Pending implements Comparable<Pending> {
        private final long deadlineNanos;
        private final long seq;
        private final CompletableFuture<Void> future;

        private Pending(long deadlineNanos, long seq, CompletableFuture<Void> future) {
            this.deadlineNanos = deadlineNanos;
            this.seq = seq;
            this.future = future;
        }

        @Override
        public int compareTo(Pending other) {
            int byDeadline = Long.compare(deadlineNanos, other.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(seq, other.seq);
        }
    }
}
