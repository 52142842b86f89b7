package at.sv.boost.retry;

import at.sv.boost.TaskScheduler;
import at.sv.boost.api.HomeAssistantApi;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs actions against entities that may be temporarily unavailable. Before each attempt the target entity has to
 * report an available state; unavailable targets and failed actions are retried after the configured delay, or
 * earlier, as soon as a state change reports the target as available again.
 * <p>
 * Running out of attempts is logged as a warning and reported through {@link RetryAttempt#future()}, never thrown.
 */
@Slf4j
public final class RetryExecutor {

    private final HomeAssistantApi api;
    private final TaskScheduler scheduler;
    private final Executor executor;
    private final RetryPolicy policy;
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<WakeUp>> waitingForAvailability = new ConcurrentHashMap<>();

    public RetryExecutor(HomeAssistantApi api, TaskScheduler scheduler, Executor executor, RetryPolicy policy) {
        this.api = api;
        this.scheduler = scheduler;
        this.executor = executor;
        this.policy = policy;
    }

    /**
     * Starts running the given action asynchronously.
     *
     * @param description  a short description used for logging, e.g. "restore temperature"
     * @param targetEntity the entity that has to be available before the action is run
     */
    public RetryAttempt attempt(String description, String targetEntity, Runnable action) {
        Attempt attempt = new Attempt(description, targetEntity, action, MDC.getCopyOfContextMap());
        executor.execute(attempt::run);
        return attempt;
    }

    /**
     * Wakes up all deferred attempts waiting for the given entity.
     */
    public void onEntityAvailable(String entityId) {
        List<WakeUp> waiting = waitingForAvailability.remove(entityId);
        if (waiting != null) {
            log.debug("{} became available. Resume {} waiting attempts.", entityId, waiting.size());
            waiting.forEach(wakeUp -> executor.execute(wakeUp::fire));
        }
    }

    private final class Attempt implements RetryAttempt {
        private final String description;
        private final String targetEntity;
        private final Runnable action;
        private final Map<String, String> context;
        private final CompletableFuture<Boolean> future = new CompletableFuture<>();
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private int attemptsMade;
        private WakeUp pending;

        private Attempt(String description, String targetEntity, Runnable action, Map<String, String> context) {
            this.description = description;
            this.targetEntity = targetEntity;
            this.action = action;
            this.context = context;
        }

        @Override
        public CompletableFuture<Boolean> future() {
            return future;
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                removePending();
                future.complete(false);
            }
        }

        private synchronized void run() {
            if (cancelled.get() || future.isDone()) {
                return;
            }
            Map<String, String> previousContext = MDC.getCopyOfContextMap();
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                attemptsMade++;
                if (tryAction()) {
                    future.complete(true);
                } else if (attemptsMade >= policy.maxAttempts()) {
                    log.warn("Failed to {} for {} after {} attempts. Giving up.", description, targetEntity, attemptsMade);
                    future.complete(false);
                } else {
                    defer();
                }
            } finally {
                if (previousContext != null) {
                    MDC.setContextMap(previousContext);
                } else {
                    MDC.clear();
                }
            }
        }

        private boolean tryAction() {
            if (!api.isAvailable(targetEntity)) {
                log.debug("{} not available. Deferring '{}' (attempt {}/{}).", targetEntity, description,
                        attemptsMade, policy.maxAttempts());
                return false;
            }
            try {
                action.run();
                log.debug("{}: {} done.", targetEntity, description);
                return true;
            } catch (Exception e) {
                log.debug("Failed to {} for {} (attempt {}/{}): {}", description, targetEntity, attemptsMade,
                        policy.maxAttempts(), e.getLocalizedMessage());
                return false;
            }
        }

        private void defer() {
            WakeUp wakeUp = new WakeUp(this);
            pending = wakeUp;
            waitingForAvailability.computeIfAbsent(targetEntity, id -> new CopyOnWriteArrayList<>()).add(wakeUp);
            scheduler.schedule(wakeUp::fire, policy.delay());
        }

        private synchronized void removePending() {
            if (pending != null) {
                List<WakeUp> waiting = waitingForAvailability.get(targetEntity);
                if (waiting != null) {
                    waiting.remove(pending);
                }
                pending = null;
            }
        }
    }

    /**
     * A single scheduled continuation of an attempt. Fired either by the retry delay or by an availability event,
     * whichever comes first; the later one is ignored.
     */
    private final class WakeUp {
        private final Attempt attempt;
        private final AtomicBoolean claimed = new AtomicBoolean();

        private WakeUp(Attempt attempt) {
            this.attempt = attempt;
        }

        private void fire() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            attempt.removePending();
            attempt.run();
        }
    }
}
