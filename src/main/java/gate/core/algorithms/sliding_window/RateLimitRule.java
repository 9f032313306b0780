package gate.core.algorithms.sliding_window;

import gate.core.clock.Clock;
import gate.core.model.AdmissionRule;
import gate.core.model.AdmitResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exact sliding window (log): at most {@code limit} admissions in any
 * trailing interval {@code (now - window, now]}.
 *
 * Keeps one timestamp per committed admission, oldest first. An entry exactly
 * {@code window} old is expired.
 *
 * Check and record are separate steps:
 * - tryAdmit: evict + capacity check, no write
 * - commit: append, no capacity check
 *
 * Between the two another caller may commit too, so the log can briefly hold
 * more than {@code limit} entries (at most one extra per racing commit). The
 * next eviction pass brings it back under the limit.
 *
 * Thread-safety: one ReentrantLock per rule guards eviction, the count check and
 * every append. Callers never hold it while waiting.
 */
public final class RateLimitRule implements AdmissionRule {
    private final Clock clock;
    private final long windowNanos;
    private final int limit;

    private final ArrayDeque<Long> history = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public RateLimitRule(Clock clock, long windowNanos, int limit) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (windowNanos <= 0) throw new IllegalArgumentException("window <= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        this.clock = clock;
        this.windowNanos = windowNanos;
        this.limit = limit;
    }

    @Override
    public AdmitResult tryAdmit() {
        lock.lock();
        try {
            return check(clock.nowNanos());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Same as {@link #tryAdmit()} at a caller-supplied instant.
     */
    public AdmitResult tryAdmit(long nowNanos) {
        lock.lock();
        try {
            return check(nowNanos);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void commit(long timestampNanos) {
        lock.lock();
        try {
            Long newest = history.peekLast();
            if (newest == null || newest <= timestampNanos) {
                history.addLast(timestampNanos);
                return;
            }
            // Granted earlier than a commit that beat us here: keep the log ordered.
            ArrayDeque<Long> later = new ArrayDeque<>();
            while (!history.isEmpty() && history.peekLast() > timestampNanos) {
                later.addFirst(history.removeLast());
            }
            history.addLast(timestampNanos);
            history.addAll(later);
        } finally {
            lock.unlock();
        }
    }

    public int limit() {
        return limit;
    }

    public long windowNanos() {
        return windowNanos;
    }

    /**
     * Entries currently held. No eviction is performed, so expired entries
     * still count until the next check.
     */
    public int size() {
        lock.lock();
        try {
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Oldest-first copy of the committed timestamps.
     */
    public List<Long> history() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(history));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "RateLimitRule{limit=" + limit + ", windowNanos=" + windowNanos + "}";
    }

    // Caller holds the lock.
    private AdmitResult check(long now) {
        prune(now);

        if (history.size() < limit) {
            return AdmitResult.available(now);
        }

        long oldest = history.peekFirst();
        return AdmitResult.busy(now, oldest + windowNanos);
    }

    private void prune(long now) {
        long cutoff = now - windowNanos;
        while (!history.isEmpty() && history.peekFirst() <= cutoff) {
            history.removeFirst();
        }
    }
}
