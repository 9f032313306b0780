package gate.java.limiter;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle for one {@link RateLimiter#perform} call.
 *
 * <p>Completes normally when the action completes, exceptionally with the
 * action's own exception when it fails, and with {@link java.util.concurrent.CancellationException}
 * when cancelled while waiting.
 *
 * <p>{@link #cancel(boolean)} is honoured only in {@link PerformState#WAITING}. Once every
 * rule has granted, capacity is considered consumed: cancel returns {@code false} and
 * the call runs to completion.
 *
 * <p>Completing the handle from outside ({@link #complete}, {@link #completeExceptionally},
 * and so {@link #orTimeout}/{@link #completeOnTimeout}) follows the same rule: while
 * waiting it abandons the call without charging any rule (exceptionally: FAILED,
 * normally: CANCELLED); afterwards it is refused. The obtrude methods are not supported.
 */
public final class Admission extends CompletableFuture<Void> {

    private final AtomicReference<PerformState> state = new AtomicReference<>(PerformState.WAITING);
    private final Set<CompletableFuture<?>> pendingSleeps = ConcurrentHashMap.newKeySet();

    Admission() {
    }

    public PerformState state() {
        return state.get();
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (!state.compareAndSet(PerformState.WAITING, PerformState.CANCELLED)) {
            return false;
        }
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        abandonSleeps();
        return cancelled;
    }

    /**
     * Abandons a waiting call with {@code value}; refused once every rule has granted.
     */
    @Override
    public boolean complete(Void value) {
        if (!state.compareAndSet(PerformState.WAITING, PerformState.CANCELLED)) {
            return false;
        }
        abandonSleeps();
        return super.complete(value);
    }

    /**
     * Fails a waiting call with {@code ex}; refused once every rule has granted.
     */
    @Override
    public boolean completeExceptionally(Throwable ex) {
        if (ex == null) {
            throw new NullPointerException("ex");
        }
        if (!state.compareAndSet(PerformState.WAITING, PerformState.FAILED)) {
            return false;
        }
        abandonSleeps();
        return super.completeExceptionally(ex);
    }

    @Override
    public void obtrudeValue(Void value) {
        throw new UnsupportedOperationException("admission outcome cannot be overwritten");
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw new UnsupportedOperationException("admission outcome cannot be overwritten");
    }

    boolean isWaiting() {
        return state.get() == PerformState.WAITING;
    }

    /**
     * Registers a pending sleep so cancellation can abort it. A sleep tracked
     * after the call left WAITING is aborted immediately.
     */
    void track(CompletableFuture<?> sleep) {
        pendingSleeps.add(sleep);
        if (!isWaiting()) {
            sleep.cancel(false);
        }
    }

    void untrack(CompletableFuture<?> sleep) {
        pendingSleeps.remove(sleep);
    }

    boolean markAllGranted() {
        return state.compareAndSet(PerformState.WAITING, PerformState.ALL_GRANTED);
    }

    void advance(PerformState from, PerformState to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException("expected " + from + " but was " + state.get());
        }
    }

    /**
     * Fails a call that is still waiting. No-op if it already left WAITING.
     */
    void failWaiting(Throwable cause) {
        if (state.compareAndSet(PerformState.WAITING, PerformState.FAILED)) {
            abandonSleeps();
            super.completeExceptionally(cause);
        }
    }

    void fail(Throwable cause) {
        state.set(PerformState.FAILED);
        super.completeExceptionally(cause);
    }

    void succeed() {
        state.set(PerformState.DONE);
        super.complete(null);
    }

    private void abandonSleeps() {
        for (CompletableFuture<?> sleep : pendingSleeps) {
            sleep.cancel(false);
        }
    }
}
