package at.sv.boost;

import at.sv.boost.api.HomeAssistantApi;
import at.sv.boost.store.DeviceSettingsStore;
import at.sv.boost.store.TimerStore;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Collaborators shared by all {@link BoostSession}s.
 *
 * @param endTimerScheduler schedules the end timer of a device's boost
 */
record SessionDependencies(HomeAssistantApi api, TemperatureSnapshotManager temperatures,
                           ScheduleSnapshotManager schedules, TimerStore timerStore,
                           DeviceSettingsStore settingsStore, CallForHeatAggregator callForHeat,
                           BoostStateListener stateListener, BiConsumer<String, Instant> endTimerScheduler,
                           Supplier<Instant> currentTime, Duration maxDuration) {

    double maxDurationHours() {
        return maxDuration.toMillis() / 3_600_000.0;
    }
}
