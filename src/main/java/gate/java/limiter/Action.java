package gate.java.limiter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * The work a {@link RateLimiter} gates.
 *
 * Completion of the returned stage is the completion of the call; a stage
 * that completes exceptionally, or a thrown exception, fails it.
 *
 * @param <T> Argument type
 */
@FunctionalInterface
public interface Action<T> {

    CompletionStage<Void> execute(T arg) throws Exception;

    /**
     * Adapts a synchronous consumer. It runs on the thread that executes the action.
     */
    static <T> Action<T> of(Consumer<? super T> consumer) {
        if (consumer == null) {
            throw new IllegalArgumentException("consumer cannot be null");
        }
        return arg -> {
            consumer.accept(arg);
            return CompletableFuture.completedFuture(null);
        };
    }
}
