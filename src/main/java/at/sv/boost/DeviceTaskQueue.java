package at.sv.boost;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Serializes all work for a single device: tasks submitted for the same device run one after another in submission
 * order, tasks of different devices run independently on the shared executor.
 */
@Slf4j
public final class DeviceTaskQueue {

    private final Executor executor;
    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public DeviceTaskQueue(Executor executor) {
        this.executor = executor;
    }

    public CompletableFuture<Void> run(String deviceId, Runnable task) {
        return submit(deviceId, () -> {
            task.run();
            return null;
        });
    }

    /**
     * @return a future completed with the result of the task, or exceptionally with the exception it threw
     */
    public <T> CompletableFuture<T> submit(String deviceId, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(deviceId, done);
        Runnable dispatch = () -> {
            try {
                executor.execute(() -> runTask(deviceId, task, result, done));
            } catch (RuntimeException e) {
                log.error("Failed to submit task for '{}': {}", deviceId, e.getLocalizedMessage());
                result.completeExceptionally(e);
                finish(deviceId, done);
            }
        };
        if (previous == null) {
            dispatch.run();
        } else {
            previous.whenComplete((ignored, e) -> dispatch.run());
        }
        return result;
    }

    private <T> void runTask(String deviceId, Supplier<T> task, CompletableFuture<T> result, CompletableFuture<Void> done) {
        String previousContext = MDC.get("context");
        MDC.put("context", deviceId);
        try {
            result.complete(task.get());
        } catch (Exception e) {
            result.completeExceptionally(e);
        } finally {
            restoreContext(previousContext);
            finish(deviceId, done);
        }
    }

    private void finish(String deviceId, CompletableFuture<Void> done) {
        tails.remove(deviceId, done);
        done.complete(null);
    }

    private static void restoreContext(String previousContext) {
        if (previousContext == null) {
            MDC.remove("context");
        } else {
            MDC.put("context", previousContext);
        }
    }
}
