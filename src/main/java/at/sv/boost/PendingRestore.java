package at.sv.boost;

import at.sv.boost.retry.RetryAttempt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Restores of a finished boost, possibly still retrying in the background. The temperature is restored first, the
 * schedule switches once the temperature restore is done or gave up.
 * <p>
 * A boost started while restores are outstanding {@link #interrupt() interrupts} them and takes over what is left,
 * so it records the state the device was about to return to instead of the one the previous boost left behind.
 */
final class PendingRestore {

    private final String deviceId;
    private final Double temperature;
    private final List<ScheduleSwitchState> schedules;
    private RetryAttempt temperatureRestore;
    private Map<String, RetryAttempt> scheduleRestores;
    private boolean interrupted;

    PendingRestore(String deviceId, Double temperature, List<ScheduleSwitchState> schedules) {
        this.deviceId = deviceId;
        this.temperature = temperature;
        this.schedules = schedules == null || schedules.isEmpty() ? null : List.copyOf(schedules);
    }

    static PendingRestore none(String deviceId) {
        return new PendingRestore(deviceId, null, null);
    }

    void start(TemperatureSnapshotManager temperatures, ScheduleSnapshotManager scheduleManager) {
        CompletableFuture<Boolean> temperatureRestored = CompletableFuture.completedFuture(false);
        if (temperature != null) {
            RetryAttempt attempt = temperatures.restore(deviceId, temperature);
            synchronized (this) {
                temperatureRestore = attempt;
            }
            temperatureRestored = attempt.future();
        }
        if (schedules != null) {
            temperatureRestored.whenComplete((restored, e) -> restoreSchedules(scheduleManager));
        }
    }

    private synchronized void restoreSchedules(ScheduleSnapshotManager scheduleManager) {
        if (interrupted) {
            return;
        }
        scheduleRestores = scheduleManager.restore(schedules);
    }

    /**
     * Stops all restores still in progress.
     *
     * @return the part not restored yet; restores that gave up are not included
     */
    PendingRestore interrupt() {
        List<RetryAttempt> running = new ArrayList<>();
        Double remainingTemperature = null;
        List<ScheduleSwitchState> remainingSchedules = new ArrayList<>();
        synchronized (this) {
            interrupted = true;
            if (temperature != null && (temperatureRestore == null || !temperatureRestore.future().isDone())) {
                remainingTemperature = temperature;
                if (temperatureRestore != null) {
                    running.add(temperatureRestore);
                }
            }
            if (schedules != null) {
                for (ScheduleSwitchState entry : schedules) {
                    RetryAttempt restore = scheduleRestores == null ? null : scheduleRestores.get(entry.switchId());
                    if (restore == null || !restore.future().isDone()) {
                        remainingSchedules.add(entry);
                    }
                    if (restore != null) {
                        running.add(restore);
                    }
                }
            }
        }
        // cancel outside the lock, a completing attempt may be waiting for it
        running.forEach(RetryAttempt::cancel);
        return new PendingRestore(deviceId, remainingTemperature, remainingSchedules);
    }

    boolean isEmpty() {
        return temperature == null && schedules == null;
    }

    List<ScheduleSwitchState> getSchedules() {
        return schedules;
    }

    /**
     * @return the temperature still to be restored, or the given one if there is none
     */
    Double temperatureOr(Double current) {
        return temperature != null ? temperature : current;
    }

    /**
     * Replaces the captured state of each switch still to be restored by its target state. Switches missing from
     * the capture, e.g. because they are unavailable right now, are added.
     *
     * @return the merged snapshot, null if empty
     */
    List<ScheduleSwitchState> mergeInto(List<ScheduleSwitchState> captured) {
        if (schedules == null) {
            return captured;
        }
        List<ScheduleSwitchState> merged = new ArrayList<>();
        if (captured != null) {
            for (ScheduleSwitchState entry : captured) {
                merged.add(schedules.stream()
                                    .filter(pending -> pending.switchId().equals(entry.switchId()))
                                    .findFirst()
                                    .orElse(entry));
            }
        }
        for (ScheduleSwitchState pending : schedules) {
            if (merged.stream().noneMatch(entry -> entry.switchId().equals(pending.switchId()))) {
                merged.add(pending);
            }
        }
        return merged.isEmpty() ? null : List.copyOf(merged);
    }

    @Override
    public String toString() {
        return "temperature=" + temperature + ", schedules=" + schedules;
    }
}
