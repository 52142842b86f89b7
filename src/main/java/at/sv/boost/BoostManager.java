package at.sv.boost;

import at.sv.boost.api.BoostEventListener;
import at.sv.boost.api.EntityState;
import at.sv.boost.api.HomeAssistantApi;
import at.sv.boost.retry.RetryExecutor;
import at.sv.boost.store.DeviceSettingsStore;
import at.sv.boost.store.PersistedBoostRecord;
import at.sv.boost.store.TimerStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Entry point for all boost operations. Owns one {@link BoostSession} per configured thermostat and routes every
 * trigger (requests, end timers, state changes, recovery) through the {@link DeviceTaskQueue}, so the triggers of a
 * device never interleave.
 */
@Slf4j
public final class BoostManager implements BoostEventListener {

    private final Map<String, BoostSession> sessions;
    private final HomeAssistantApi api;
    private final DeviceSettingsStore settingsStore;
    private final RetryExecutor retryExecutor;
    private final DeviceTaskQueue queue;
    private final TaskScheduler scheduler;
    private final BoostStateListener stateListener;
    private final CallForHeatAggregator callForHeat;
    private final Supplier<Instant> currentTime;
    private volatile boolean acceptingCommands;

    public BoostManager(List<ThermostatDevice> devices, HomeAssistantApi api, TimerStore timerStore,
                        DeviceSettingsStore settingsStore, RetryExecutor retryExecutor, DeviceTaskQueue queue,
                        TaskScheduler scheduler, BoostStateListener stateListener, Supplier<Instant> currentTime,
                        Duration maxDuration) {
        this.api = api;
        this.settingsStore = settingsStore;
        this.retryExecutor = retryExecutor;
        this.queue = queue;
        this.scheduler = scheduler;
        this.stateListener = stateListener;
        this.currentTime = currentTime;
        callForHeat = new CallForHeatAggregator(stateListener::onCallForHeatChanged);
        SessionDependencies deps = new SessionDependencies(api, new TemperatureSnapshotManager(api, retryExecutor),
                new ScheduleSnapshotManager(api, retryExecutor), timerStore, settingsStore, callForHeat,
                stateListener, this::scheduleEndTimer, currentTime, maxDuration);
        Map<String, DeviceSettings> storedSettings = settingsStore.getAll();
        Map<String, BoostSession> created = new LinkedHashMap<>();
        for (ThermostatDevice device : devices) {
            DeviceSettings settings = storedSettings.getOrDefault(device.deviceId(),
                    DeviceSettings.defaults(device.callForHeatByDefault()));
            created.put(device.deviceId(), new BoostSession(device, settings, deps));
        }
        sessions = Collections.unmodifiableMap(created);
    }

    /**
     * Computes bounds, publishes the state of all devices and seeds the call-for-heat aggregate. Settings of devices
     * that are no longer configured are discarded.
     */
    public CompletableFuture<Void> initialize() {
        settingsStore.getAll().keySet().stream()
                     .filter(deviceId -> !sessions.containsKey(deviceId))
                     .forEach(deviceId -> {
                         log.warn("Discarding settings of removed device {}.", deviceId);
                         settingsStore.remove(deviceId);
                     });
        CompletableFuture<?>[] initialized = sessions.values().stream()
                                                     .map(session -> queue.run(session.getDevice().deviceId(),
                                                             () -> initialize(session)))
                                                     .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(initialized).whenComplete((ignored, e) -> {
            if (e != null) {
                log.error("Failed to initialize devices: {}", e.getLocalizedMessage(), e);
            }
        });
    }

    private void initialize(BoostSession session) {
        String deviceId = session.getDevice().deviceId();
        EntityState thermostat = lookupState(deviceId);
        session.initialize(thermostat);
        callForHeat.onHeatingChanged(deviceId, thermostat != null && thermostat.isHeating());
        callForHeat.setEnabled(deviceId, session.getSettings().callForHeatEnabled());
    }

    private EntityState lookupState(String entityId) {
        try {
            return api.getState(entityId);
        } catch (RuntimeException e) {
            log.warn("Failed to look up {}: {}", entityId, e.getLocalizedMessage());
            return null;
        }
    }

    /**
     * Starts accepting start, finish and settings requests. Called once recovery has been queued, so requests
     * always run after the recovery of their device.
     */
    public void acceptCommands() {
        acceptingCommands = true;
    }

    public boolean isConfigured(String deviceId) {
        return sessions.containsKey(deviceId);
    }

    /**
     * @param time        the requested duration (see {@link DurationParser}), null to use the duration selector
     * @param temperature the requested temperature, null to use the temperature selector
     * @return completes once the boost is active, or exceptionally with a {@link BoostValidationException} or
     * {@link BoostActuationException}
     */
    public CompletableFuture<Void> startBoost(String deviceId, Object time, Double temperature) {
        return startBoost(List.of(deviceId), time, temperature);
    }

    public CompletableFuture<Void> startBoost(List<String> deviceIds, Object time, Double temperature) {
        Duration duration;
        try {
            assertCommandsAccepted();
            assertConfigured(deviceIds);
            duration = DurationParser.parse(time);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return forEach(deviceIds, session -> session.start(duration, temperature));
    }

    /**
     * Finishes the boost of the given devices. Finishing an idle device does nothing.
     */
    public CompletableFuture<Void> finishBoost(String deviceId) {
        return finishBoost(List.of(deviceId));
    }

    public CompletableFuture<Void> finishBoost(List<String> deviceIds) {
        try {
            assertCommandsAccepted();
            assertConfigured(deviceIds);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return forEach(deviceIds, session -> session.finish(FinishReason.REQUESTED));
    }

    public CompletableFuture<Void> updateSettings(String deviceId, Map<String, Object> values) {
        try {
            assertCommandsAccepted();
            assertConfigured(List.of(deviceId));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return forEach(List.of(deviceId), session -> session.updateSettings(values));
    }

    private CompletableFuture<Void> forEach(List<String> deviceIds, Consumer<BoostSession> action) {
        CompletableFuture<?>[] results = deviceIds.stream()
                                                  .distinct()
                                                  .map(deviceId -> queue.run(deviceId, () -> action.accept(sessions.get(deviceId))))
                                                  .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(results);
    }

    private void assertCommandsAccepted() {
        if (!acceptingCommands) {
            throw new IllegalStateException("Still starting up. Try again later.");
        }
    }

    private void assertConfigured(List<String> deviceIds) {
        if (deviceIds.isEmpty()) {
            throw new BoostValidationException("No device given.");
        }
        for (String deviceId : deviceIds) {
            if (!isConfigured(deviceId)) {
                throw new BoostValidationException("Unknown device '" + deviceId + "'.");
            }
        }
    }

    CompletableFuture<Void> resumeBoost(String deviceId, PersistedBoostRecord record) {
        return queue.run(deviceId, () -> sessions.get(deviceId).resume(record));
    }

    CompletableFuture<Void> finishExpiredBoost(String deviceId, PersistedBoostRecord record) {
        return queue.run(deviceId, () -> sessions.get(deviceId).finishExpired(record));
    }

    private void scheduleEndTimer(String deviceId, Instant end) {
        Duration delay = Duration.between(currentTime.get(), end);
        log.debug("Boost ends in {}.", delay);
        scheduler.schedule(() -> queue.run(deviceId, () -> sessions.get(deviceId).onTimerFired(end))
                                      .whenComplete((ignored, e) -> logFailure(deviceId, "end timer", e)), delay);
    }

    /**
     * @return the current state of the given device, null if it is not configured or not initialized yet
     */
    public DeviceBoostState getState(String deviceId) {
        BoostSession session = sessions.get(deviceId);
        return session != null ? session.getView() : null;
    }

    public boolean isCallForHeatActive() {
        return callForHeat.isActive();
    }

    /**
     * Publishes all exposed state again, e.g. after Home Assistant restarted and forgot it.
     */
    public void republishAll() {
        sessions.forEach((deviceId, session) -> queue.run(deviceId, session::publish)
                                                     .whenComplete((ignored, e) -> logFailure(deviceId, "publish", e)));
        stateListener.onCallForHeatChanged(callForHeat.isActive());
    }

    @Override
    public void onStateChanged(String entityId, EntityState oldState, EntityState newState) {
        if (entityId == null) {
            return;
        }
        if (newState != null && newState.isAvailable() && (oldState == null || !oldState.isAvailable())) {
            retryExecutor.onEntityAvailable(entityId);
        }
        BoostSession session = sessions.get(entityId);
        if (session == null || newState == null) {
            return;
        }
        callForHeat.onHeatingChanged(entityId, newState.isHeating());
        queue.run(entityId, () -> session.onThermostatChanged(newState))
             .whenComplete((ignored, e) -> logFailure(entityId, "state update", e));
    }

    @Override
    public void onStartRequested(List<String> deviceIds, Object time, Double temperature) {
        log.debug("Start requested for {} (time={}, temperature={}).", deviceIds, time, temperature);
        startBoost(deviceIds, time, temperature).whenComplete((ignored, e) -> logFailure(deviceIds.toString(), "start", e));
    }

    @Override
    public void onFinishRequested(List<String> deviceIds) {
        log.debug("Finish requested for {}.", deviceIds);
        finishBoost(deviceIds).whenComplete((ignored, e) -> logFailure(deviceIds.toString(), "finish", e));
    }

    @Override
    public void onSettingsChangeRequested(String deviceId, Map<String, Object> values) {
        updateSettings(deviceId, values).whenComplete((ignored, e) -> logFailure(deviceId, "settings change", e));
    }

    private static void logFailure(String target, String operation, Throwable e) {
        if (e == null) {
            return;
        }
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof BoostValidationException || cause instanceof IllegalStateException) {
            log.warn("Rejected {} for {}: {}", operation, target, cause.getMessage());
        } else if (cause instanceof BoostActuationException) {
            log.warn("Failed to {} boost for {}: {}", operation, target, getCauseMessage(cause));
        } else {
            log.error("Failed {} for {}: {}", operation, target, cause.getLocalizedMessage(), cause);
        }
    }

    private static String getCauseMessage(Throwable e) {
        Throwable cause = e.getCause();
        return cause != null ? e.getMessage() + ": " + cause.getLocalizedMessage() : e.getMessage();
    }
}
