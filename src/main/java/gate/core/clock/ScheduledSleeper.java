package gate.core.clock;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Sleeper backed by a {@link ScheduledExecutorService}.
 *
 * <p>Each sleep is one scheduled task that completes the returned future.
 * Cancelling the future cancels the task, so an abandoned wait does not linger
 * in the scheduler queue until its deadline.
 *
 * <p>A scheduler that rejects the task (for example after shutdown) yields a future
 * already completed with the {@link RejectedExecutionException}.
 *
 * <p>Timers fire on the scheduler's threads; anything chained onto the returned
 * future without an explicit executor runs there too.
 */
public final class ScheduledSleeper implements Sleeper {

    private static final ScheduledSleeper SHARED = new ScheduledSleeper(newDaemonScheduler());

    private final ScheduledExecutorService scheduler;

    /**
     * @param scheduler Scheduler that owns the timers (lifecycle stays with the caller)
     * @throws IllegalArgumentException if scheduler is null
     */
    public ScheduledSleeper(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * Process-wide sleeper on a single daemon thread. Never shut down.
     */
    public static ScheduledSleeper shared() {
        return SHARED;
    }

    @Override
    public CompletableFuture<Void> sleep(long delayNanos) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (delayNanos <= 0) {
            done.complete(null);
            return done;
        }

        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(
                () -> done.complete(null),
                delayNanos,
                TimeUnit.NANOSECONDS
            );
        } catch (RejectedExecutionException e) {
            // Scheduler shut down: the delay can never fire.
            done.completeExceptionally(e);
            return done;
        }
        done.whenComplete((ignored, error) -> {
            if (done.isCancelled()) {
                timer.cancel(false);
            }
        });
        return done;
    }

    private static ScheduledExecutorService newDaemonScheduler() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "window-gate-sleeper");
            thread.setDaemon(true);
            return thread;
        });
    }
}
