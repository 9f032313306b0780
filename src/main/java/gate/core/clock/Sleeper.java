package gate.core.clock;

import java.util.concurrent.CompletableFuture;

/**
 * Cancellable, non-blocking delay.
 *
 * <p>The returned future completes normally once {@code delayNanos} have elapsed.
 * Cancelling it before then abandons the underlying timer; no thread is parked
 * while the delay is pending.
 */
public interface Sleeper {
    CompletableFuture<Void> sleep(long delayNanos);
}
