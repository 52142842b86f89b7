package at.sv.boost;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

public final class TestTaskScheduler implements TaskScheduler {

    private final Supplier<Instant> currentTime;
    private final List<ScheduledTask> scheduledTasks = new ArrayList<>();

    public TestTaskScheduler(Supplier<Instant> currentTime) {
        this.currentTime = currentTime;
    }

    @Override
    public void schedule(Runnable runnable, Duration delay) {
        scheduledTasks.add(new ScheduledTask(currentTime.get().plus(delay), runnable));
    }

    public List<ScheduledTask> getScheduledTasks() {
        List<ScheduledTask> tasks = new ArrayList<>(scheduledTasks);
        tasks.sort(Comparator.comparing(ScheduledTask::due));
        return tasks;
    }

    /**
     * Runs all tasks due at the current time, including tasks scheduled by them that are due as well.
     */
    public void runDueTasks() {
        while (true) {
            Instant now = currentTime.get();
            ScheduledTask next = getScheduledTasks().stream()
                                                    .filter(task -> !task.due().isAfter(now))
                                                    .findFirst()
                                                    .orElse(null);
            if (next == null) {
                return;
            }
            scheduledTasks.remove(next);
            next.run();
        }
    }

    public void clear() {
        scheduledTasks.clear();
    }

    public record ScheduledTask(Instant due, Runnable runnable) implements Runnable {
        @Override
        public void run() {
            runnable.run();
        }
    }
}
