package at.sv.boost;

import java.time.Duration;

public interface TaskScheduler {
    /**
     * Runs the given task once after the given delay. Non-positive delays run the task as soon as possible.
     */
    void schedule(Runnable runnable, Duration delay);
}
