package at.sv.boost;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Delays tasks on a single scheduler thread and runs them on the worker executor, so a long running task never
 * delays another one. The logging context of the scheduling thread is carried over to the task.
 */
@Slf4j
public final class TaskSchedulerImpl implements TaskScheduler {

    private final ScheduledExecutorService scheduler;
    private final Executor executor;

    public TaskSchedulerImpl(ScheduledExecutorService scheduler, Executor executor) {
        this.scheduler = scheduler;
        this.executor = executor;
    }

    @Override
    public void schedule(Runnable runnable, Duration delay) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        scheduler.schedule(() -> executor.execute(() -> runInContext(runnable, context)),
                Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    private static void runInContext(Runnable runnable, Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            runnable.run();
        } catch (Exception e) {
            log.error("Scheduled task failed: {}", e.getLocalizedMessage(), e);
        } finally {
            MDC.clear();
        }
    }
}
