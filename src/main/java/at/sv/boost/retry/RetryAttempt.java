package at.sv.boost.retry;

import java.util.concurrent.CompletableFuture;

/**
 * Handle for a running retry. The future completes with {@code true} once the action succeeded, or with
 * {@code false} if all attempts were used up or the retry was cancelled. It never completes exceptionally.
 */
public interface RetryAttempt {

    CompletableFuture<Boolean> future();

    /**
     * Stops further attempts. An attempt already in progress is not interrupted.
     */
    void cancel();
}
