package gate.java.limiter;

import gate.core.clock.ScheduledSleeper;
import gate.core.clock.Sleeper;
import gate.core.model.AdmissionRule;
import gate.core.model.AdmitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Runs an action only when every configured rule has capacity for it.
 *
 * <p>Each {@link #perform} call goes through three phases:
 * <ol>
 *   <li>Wait: one retry loop per rule, all running independently. A busy rule
 *       suspends its loop through the {@link Sleeper} until the rule's oldest
 *       entry expires, then checks again. Nothing is written to any rule.</li>
 *   <li>Commit: once every rule has granted at least once, a read-only sweep checks
 *       every rule again (back to waiting if one filled up meanwhile), then each
 *       rule records the instant at which the sweep saw it available.</li>
 *   <li>Execute: the action runs once with the caller's argument. Its outcome
 *       becomes the outcome of the call; the commit stands either way.</li>
 * </ol>
 *
 * <p>No rule is charged unless all of them granted. The price is a soft bound:
 * between a rule's grant and this call's commit, another call can commit to the
 * same rule, so a rule may briefly hold more than its limit (by at most the number
 * of commits racing at that moment). {@link AdmissionRule#commit} never re-checks
 * capacity: refusing there, after other rules were already charged, would leave
 * them charged for an action that never ran.
 *
 * <p>Fairness is best-effort. Waiters are not queued: whichever call re-checks first
 * after a slot frees takes it, and a steady stream of new calls can starve an old one.
 *
 * <p>Threading: with a caller-supplied {@link Sleeper} and no executor, the action
 * runs on the thread that fired the last timer. Blocking actions need an executor
 * (see the four-argument constructor) or they hold up every other waiter on that
 * sleeper.
 *
 * <p>Thread-safety: the rule list is immutable and each rule guards its own state,
 * so any number of {@code perform} calls may run concurrently. No thread is held
 * while a call waits.
 *
 * <p>Usage example:
 * <pre>
 * List&lt;RateLimitRule&gt; rules = RuleFactory.createAll(SystemClock.instance(), List.of(
 *     RuleConfig.perSeconds(3, 5),
 *     RuleConfig.perSeconds(10, 60)));
 * RateLimiter&lt;Integer&gt; limiter = new RateLimiter&lt;&gt;(Action.of(id -&gt; call(id)), rules);
 *
 * limiter.perform(42).join();
 * </pre>
 *
 * @param <T> Argument type of the action
 */
public final class RateLimiter<T> {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    /** Retry delay when a busy rule reports a ready time that has already passed. */
    static final long MIN_RETRY_NANOS = 1_000_000L;

    private static final Executor DIRECT = Runnable::run;

    private final Action<T> action;
    private final List<AdmissionRule> rules;
    private final Sleeper sleeper;
    private final Executor actionExecutor;

    /**
     * Creates a limiter that waits on {@link ScheduledSleeper#shared()} and starts
     * admitted actions on {@link ForkJoinPool#commonPool()}, so the shared timer
     * thread never runs caller code.
     *
     * @param action Action to gate
     * @param rules Rules that must all grant (non-empty)
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RateLimiter(Action<T> action, List<? extends AdmissionRule> rules) {
        this(action, rules, ScheduledSleeper.shared(), ForkJoinPool.commonPool());
    }

    /**
     * Runs admitted actions on the thread that completes the last grant: the
     * caller's thread when nothing waited, otherwise whichever thread fires the
     * sleeper's timers. A blocking action stalls those timers; pass an executor
     * to the four-argument constructor for such actions.
     *
     * @param action Action to gate
     * @param rules Rules that must all grant (non-empty)
     * @param sleeper Delay primitive used while a rule is busy
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RateLimiter(Action<T> action, List<? extends AdmissionRule> rules, Sleeper sleeper) {
        this(action, rules, sleeper, DIRECT);
    }

    /**
     * @param action Action to gate
     * @param rules Rules that must all grant (non-empty)
     * @param sleeper Delay primitive used while a rule is busy
     * @param actionExecutor Where the action is started once admitted
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public RateLimiter(
        Action<T> action,
        List<? extends AdmissionRule> rules,
        Sleeper sleeper,
        Executor actionExecutor
    ) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("at least one rate limit rule is required");
        }
        for (AdmissionRule rule : rules) {
            if (rule == null) {
                throw new IllegalArgumentException("rules cannot contain null");
            }
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        if (actionExecutor == null) {
            throw new IllegalArgumentException("actionExecutor cannot be null");
        }

        this.action = action;
        this.rules = List.copyOf(rules);
        this.sleeper = sleeper;
        this.actionExecutor = actionExecutor;
    }

    /**
     * Starts an admission for {@code arg} and returns without blocking.
     *
     * @param arg Argument handed to the action (must not be null)
     * @return Handle completing with the action's outcome
     * @throws IllegalArgumentException if arg is null
     */
    public Admission perform(T arg) {
        if (arg == null) {
            throw new IllegalArgumentException("arg cannot be null");
        }

        Admission admission = new Admission();
        waitRound(admission, arg);
        return admission;
    }

    /**
     * Blocking form of {@link #perform}.
     *
     * <p>If the calling thread is interrupted while the call is still waiting, the
     * admission is cancelled (nothing is committed) and the interrupt is rethrown.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws CancellationException if the admission was cancelled elsewhere
     * @throws Exception the action's own exception, unwrapped
     */
    public void performAndWait(T arg) throws Exception {
        Admission admission = perform(arg);
        try {
            admission.get();
        } catch (InterruptedException e) {
            admission.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Rules in the order they were given.
     */
    public List<AdmissionRule> rules() {
        return rules;
    }

    /**
     * Starts one retry loop per rule and confirms once all of them have granted.
     */
    private void waitRound(Admission admission, T arg) {
        CompletableFuture<?>[] grants = new CompletableFuture<?>[rules.size()];
        for (int i = 0; i < grants.length; i++) {
            grants[i] = awaitGrant(admission, rules.get(i));
        }

        CompletableFuture.allOf(grants).whenComplete((ignored, error) -> {
            if (error != null) {
                admission.failWaiting(unwrap(error));
                return;
            }
            confirm(admission, arg);
        });
    }

    /**
     * Read-only sweep over every rule. Grants from the wait loops may be stale by
     * now (a loop can finish long before the slowest rule frees up), so each rule is
     * checked once more and its fresh instant becomes the commit timestamp. A rule
     * that turned busy sends the call back to waiting; nothing has been written.
     */
    private void confirm(Admission admission, T arg) {
        long[] grantedAt = new long[rules.size()];
        for (int i = 0; i < grantedAt.length; i++) {
            if (!admission.isWaiting()) {
                return;
            }

            AdmissionRule rule = rules.get(i);
            AdmitResult result;
            try {
                result = rule.tryAdmit();
            } catch (RuntimeException e) {
                log.debug("Admission check failed on {}", rule, e);
                admission.failWaiting(e);
                return;
            }

            if (!result.isAvailable()) {
                log.trace("{} filled up before commit, waiting again", rule);
                waitRound(admission, arg);
                return;
            }
            grantedAt[i] = result.observedAtNanos();
        }

        commitAndExecute(admission, grantedAt, arg);
    }

    /**
     * Retry loop for one rule. Completes once the rule reports capacity, or
     * exceptionally once the admission is no longer waiting.
     */
    private CompletableFuture<Void> awaitGrant(Admission admission, AdmissionRule rule) {
        CompletableFuture<Void> grant = new CompletableFuture<>();
        attempt(admission, rule, grant);
        return grant;
    }

    private void attempt(Admission admission, AdmissionRule rule, CompletableFuture<Void> grant) {
        if (!admission.isWaiting()) {
            grant.completeExceptionally(new CancellationException("admission is no longer waiting"));
            return;
        }

        AdmitResult result;
        try {
            result = rule.tryAdmit();
        } catch (RuntimeException e) {
            log.debug("Admission check failed on {}", rule, e);
            admission.failWaiting(e);
            grant.completeExceptionally(e);
            return;
        }

        if (result.isAvailable()) {
            grant.complete(null);
            return;
        }

        long delay = result.retryAfterNanos();
        if (delay <= 0) {
            delay = MIN_RETRY_NANOS;
        }
        log.trace("{} busy, retrying in {} ns", rule, delay);

        CompletableFuture<Void> sleep;
        try {
            sleep = sleeper.sleep(delay);
        } catch (RuntimeException e) {
            log.debug("Could not schedule retry for {}", rule, e);
            admission.failWaiting(e);
            grant.completeExceptionally(e);
            return;
        }
        admission.track(sleep);
        sleep.whenComplete((ignored, error) -> {
            admission.untrack(sleep);
            if (error != null) {
                if (!(error instanceof CancellationException)) {
                    log.debug("Retry delay failed for {}", rule, error);
                    admission.failWaiting(unwrap(error));
                }
                grant.completeExceptionally(error);
                return;
            }
            attempt(admission, rule, grant);
        });
    }

    private void commitAndExecute(Admission admission, long[] grantedAt, T arg) {
        if (!admission.markAllGranted()) {
            log.debug("Admission cancelled before commit, no rule charged");
            return;
        }

        try {
            admission.advance(PerformState.ALL_GRANTED, PerformState.COMMITTING);
            for (int i = 0; i < rules.size(); i++) {
                rules.get(i).commit(grantedAt[i]);
            }
            admission.advance(PerformState.COMMITTING, PerformState.EXECUTING);
            actionExecutor.execute(() -> execute(admission, arg));
        } catch (RuntimeException e) {
            log.debug("Admission failed after grant", e);
            admission.fail(e);
        }
    }

    private void execute(Admission admission, T arg) {
        CompletionStage<Void> stage;
        try {
            stage = action.execute(arg);
        } catch (Throwable t) {
            log.debug("Action failed for arg {}", arg, t);
            admission.fail(t);
            return;
        }

        if (stage == null) {
            admission.fail(new IllegalStateException("action returned a null stage"));
            return;
        }

        stage.whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                log.debug("Action failed for arg {}", arg, cause);
                admission.fail(cause);
            } else {
                admission.succeed();
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
