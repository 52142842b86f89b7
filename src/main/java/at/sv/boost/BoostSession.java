package at.sv.boost;

import at.sv.boost.api.EntityState;
import at.sv.boost.retry.RetryAttempt;
import at.sv.boost.store.PersistedBoostRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Boost state machine of a single thermostat. Not thread-safe: all calls for one device have to be serialized,
 * see {@link DeviceTaskQueue}.
 * <p>
 * A boost moves the session from {@link SessionState#IDLE} to {@link SessionState#ACTIVE}. On this transition the
 * current target temperature and the state of all schedule switches controlling the thermostat are captured once;
 * finishing the boost restores both and returns to idle. While active, a persisted record exists for the device so a
 * restart can resume or finish the boost.
 */
@Slf4j
final class BoostSession {

    private final ThermostatDevice device;
    private final SessionDependencies deps;

    private SessionState state = SessionState.IDLE;
    private Instant endTimestamp;
    private Double preBoostTemperature;
    private List<ScheduleSwitchState> scheduleSnapshot;
    private boolean scheduleOverrideActive;
    private List<RetryAttempt> pendingDisables = List.of();
    private PendingRestore pendingRestore;
    private DeviceSettings settings;
    private TemperatureBounds bounds;
    private TemperatureUnit unit = TemperatureUnit.METRIC;
    private String friendlyName;
    private volatile DeviceBoostState view;

    BoostSession(ThermostatDevice device, DeviceSettings settings, SessionDependencies deps) {
        this.device = device;
        this.settings = settings;
        this.deps = deps;
    }

    /**
     * Computes the initial temperature bounds and publishes the current state.
     *
     * @param thermostat the current thermostat state, null if not known
     */
    void initialize(EntityState thermostat) {
        if (thermostat == null) {
            log.warn("Thermostat not found. Using fallback temperature range until it reports.");
        }
        updateBounds(thermostat);
        publish();
    }

    /**
     * Starts a new boost, or extends the active one.
     *
     * @param requestedDuration    the requested duration, null to use the duration selector
     * @param requestedTemperature the requested temperature, null to use the temperature selector
     * @throws BoostValidationException if no valid duration or temperature could be determined
     * @throws BoostActuationException  if the temperature could not be set, or the boost not be persisted
     */
    void start(Duration requestedDuration, Double requestedTemperature) {
        Duration duration = resolveDuration(requestedDuration);
        EntityState thermostat = readThermostat();
        updateBounds(thermostat);
        double temperature = resolveTemperature(requestedTemperature, thermostat);
        Instant end = deps.currentTime().get().plus(duration);
        if (state == SessionState.ACTIVE) {
            extend(end, temperature);
            return;
        }
        PendingRestore unfinished = interruptPendingRestore();
        Double capturedTemperature = unfinished.temperatureOr(deps.temperatures().capture(thermostat));
        boolean override = settings.scheduleOverride();
        List<ScheduleSwitchState> capturedSchedules = override ? null : unfinished.mergeInto(captureSchedules());
        try {
            setTargetTemperature(temperature);
        } catch (BoostActuationException e) {
            continueRestore(unfinished);
            throw e;
        }
        PersistedBoostRecord record = new PersistedBoostRecord(end.toEpochMilli(), capturedTemperature,
                capturedSchedules, override);
        try {
            deps.timerStore().save(device.deviceId(), record);
        } catch (UncheckedIOException e) {
            if (capturedTemperature != null) {
                deps.temperatures().restoreNow(device.deviceId(), capturedTemperature);
            }
            continueRestore(new PendingRestore(device.deviceId(), null, unfinished.getSchedules()));
            throw new BoostActuationException("Failed to persist boost", e);
        }
        if (override) {
            // this boost leaves schedules alone, the previous one still has to turn its switches back
            continueRestore(new PendingRestore(device.deviceId(), null, unfinished.getSchedules()));
        }
        activate(record);
        log.info("Boost started: {} until {}{}.", temperature, end,
                override ? " (schedule override active)" : getScheduleInfo());
        publish();
    }

    private void extend(Instant end, double temperature) {
        setTargetTemperature(temperature);
        try {
            deps.timerStore().save(device.deviceId(), new PersistedBoostRecord(end.toEpochMilli(),
                    preBoostTemperature, scheduleSnapshot, scheduleOverrideActive));
        } catch (UncheckedIOException e) {
            throw new BoostActuationException("Failed to persist extended boost", e);
        }
        endTimestamp = end;
        deps.endTimerScheduler().accept(device.deviceId(), end);
        log.info("Boost updated: {} until {}.", temperature, end);
        publish();
    }

    private void activate(PersistedBoostRecord record) {
        state = SessionState.ACTIVE;
        endTimestamp = Instant.ofEpochMilli(record.endTimestamp());
        preBoostTemperature = record.preBoostTemperature();
        scheduleSnapshot = record.scheduleSnapshot();
        scheduleOverrideActive = record.scheduleOverrideActive();
        pendingDisables = deps.schedules().disable(scheduleSnapshot);
        deps.endTimerScheduler().accept(device.deviceId(), endTimestamp);
    }

    /**
     * Finishes the active boost. Restores run in the background, see {@link PendingRestore}: first the temperature,
     * then the schedule switches, so a re-applied schedule has the final say over the target temperature.
     *
     * @return false if there was no active boost
     */
    boolean finish(FinishReason reason) {
        if (state != SessionState.ACTIVE) {
            log.debug("No active boost to finish.");
            return false;
        }
        try {
            deps.timerStore().remove(device.deviceId());
        } catch (UncheckedIOException e) {
            log.error("Failed to remove persisted boost: {}", e.getLocalizedMessage());
        }
        pendingDisables.forEach(RetryAttempt::cancel);
        continueRestore(new PendingRestore(device.deviceId(), preBoostTemperature, scheduleSnapshot));
        clear();
        saveSettings(settings.withDurationHours(0));
        log.info("Boost finished ({}).", reason.name().toLowerCase(Locale.ROOT).replace('_', ' '));
        publish();
        return true;
    }

    private void continueRestore(PendingRestore restore) {
        if (restore.isEmpty()) {
            return;
        }
        pendingRestore = restore;
        restore.start(deps.temperatures(), deps.schedules());
    }

    /**
     * @return what the previous boost has not restored yet
     */
    private PendingRestore interruptPendingRestore() {
        PendingRestore running = pendingRestore;
        pendingRestore = null;
        if (running == null) {
            return PendingRestore.none(device.deviceId());
        }
        PendingRestore unfinished = running.interrupt();
        if (!unfinished.isEmpty()) {
            log.info("Previous boost not fully restored yet. Taking over: {}", unfinished);
        }
        return unfinished;
    }

    private void clear() {
        state = SessionState.IDLE;
        endTimestamp = null;
        preBoostTemperature = null;
        scheduleSnapshot = null;
        scheduleOverrideActive = false;
        pendingDisables = List.of();
    }

    /**
     * Resumes a boost persisted before a restart that has not ended yet.
     */
    void resume(PersistedBoostRecord record) {
        activate(record);
        log.info("Resumed boost until {}.", endTimestamp);
        publish();
    }

    /**
     * Finishes a boost that ended while the service was not running. Schedule switches that no longer exist are
     * dropped from the restore.
     */
    void finishExpired(PersistedBoostRecord record) {
        state = SessionState.ACTIVE;
        endTimestamp = Instant.ofEpochMilli(record.endTimestamp());
        preBoostTemperature = record.preBoostTemperature();
        scheduleSnapshot = dropMissingSwitches(record.scheduleSnapshot());
        scheduleOverrideActive = record.scheduleOverrideActive();
        log.info("Boost ended at {} while offline.", endTimestamp);
        finish(FinishReason.OFFLINE_EXPIRED);
    }

    private List<ScheduleSwitchState> dropMissingSwitches(List<ScheduleSwitchState> snapshot) {
        if (snapshot == null) {
            return null;
        }
        List<ScheduleSwitchState> present = new ArrayList<>();
        for (ScheduleSwitchState entry : snapshot) {
            if (switchExists(entry.switchId())) {
                present.add(entry);
            } else {
                log.warn("Schedule switch {} no longer exists. Skipping its restore.", entry.switchId());
            }
        }
        return present;
    }

    private boolean switchExists(String switchId) {
        try {
            return deps.api().getState(switchId) != null;
        } catch (RuntimeException e) {
            log.debug("Failed to look up {}: {}", switchId, e.getLocalizedMessage());
            return true;
        }
    }

    /**
     * Fired end timer. Timers of earlier boosts, or of boosts that were extended since, are ignored.
     */
    void onTimerFired(Instant scheduledEnd) {
        if (state != SessionState.ACTIVE || !scheduledEnd.equals(endTimestamp)) {
            log.trace("Ignore stale end timer for {}.", scheduledEnd);
            return;
        }
        finish(FinishReason.TIMER_EXPIRED);
    }

    void onThermostatChanged(EntityState thermostat) {
        if (thermostat == null) {
            return;
        }
        if (updateBounds(thermostat)) {
            publish();
        }
    }

    /**
     * Applies changes to the selectors and flags of this device. Supported keys: {@code boost_temperature},
     * {@code duration_hours}, {@code schedule_override}, {@code call_for_heat}.
     *
     * @throws BoostValidationException if a value is invalid; no change is applied in this case
     */
    void updateSettings(Map<String, Object> values) {
        DeviceSettings updated = settings;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case "boost_temperature" -> updated = updated.withBoostTemperature(getBounds().clamp(toDouble(entry.getKey(), value)));
                case "duration_hours" -> updated = updated.withDurationHours(toDurationHours(value));
                case "schedule_override" -> updated = updated.withScheduleOverride(toBoolean(entry.getKey(), value));
                case "call_for_heat" -> updated = updated.withCallForHeatEnabled(toBoolean(entry.getKey(), value));
                default -> throw new BoostValidationException("Unknown setting '" + entry.getKey() + "'.");
            }
        }
        if (updated.equals(settings)) {
            return;
        }
        log.info("Settings changed: {}", values);
        saveSettings(updated);
        publish();
    }

    private double toDurationHours(Object value) {
        double hours = toDouble("duration_hours", value);
        if (hours < 0) {
            throw new BoostValidationException("duration_hours must be >= 0.");
        }
        double clamped = Math.min(hours, deps.maxDurationHours());
        return Math.round(clamped * 2) / 2.0;
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number number && Double.isFinite(number.doubleValue())) {
            return number.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new BoostValidationException("Invalid number for '" + key + "': '" + value + "'.");
            }
        }
        throw new BoostValidationException("Invalid number for '" + key + "': '" + value + "'.");
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("on")) {
            return true;
        }
        if (s.equals("false") || s.equals("off")) {
            return false;
        }
        throw new BoostValidationException("Invalid boolean for '" + key + "': '" + value + "'.");
    }

    private void saveSettings(DeviceSettings updated) {
        if (updated.callForHeatEnabled() != settings.callForHeatEnabled()) {
            deps.callForHeat().setEnabled(device.deviceId(), updated.callForHeatEnabled());
        }
        settings = updated;
        try {
            deps.settingsStore().save(device.deviceId(), updated);
        } catch (UncheckedIOException e) {
            log.error("Failed to persist settings: {}", e.getLocalizedMessage());
        }
    }

    /**
     * Recomputes the temperature bounds and clamps the temperature selector into them.
     *
     * @return true if the bounds changed
     */
    private boolean updateBounds(EntityState thermostat) {
        if (thermostat != null && thermostat.getFriendlyName() != null) {
            friendlyName = thermostat.getFriendlyName();
        }
        try {
            unit = deps.api().getTemperatureUnit();
        } catch (RuntimeException e) {
            log.warn("Failed to look up temperature unit, keeping {}: {}", unit, e.getLocalizedMessage());
        }
        TemperatureBounds updated = thermostat == null
                ? BoundsCalculator.calculate(null, null, unit)
                : BoundsCalculator.calculate(thermostat.getMinTemp(), thermostat.getMaxTemp(), unit);
        if (updated.equals(bounds)) {
            return false;
        }
        log.debug("Boost temperature range: [{}, {}]", updated.min(), updated.max());
        bounds = updated;
        Double selected = settings.boostTemperature();
        if (selected == null && thermostat != null) {
            selected = getDefaultTemperature(thermostat);
        }
        if (selected != null) {
            saveSettings(settings.withBoostTemperature(updated.clamp(selected)));
        }
        return true;
    }

    private TemperatureBounds getBounds() {
        if (bounds == null) {
            bounds = BoundsCalculator.calculate(null, null, unit);
        }
        return bounds;
    }

    private Duration resolveDuration(Duration requested) {
        Duration duration = requested;
        if (duration == null) {
            if (settings.durationHours() <= 0) {
                throw new BoostValidationException("No boost duration selected.");
            }
            duration = DurationParser.ofHours(settings.durationHours());
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new BoostValidationException("Boost duration has to be positive.");
        }
        if (duration.compareTo(deps.maxDuration()) > 0) {
            log.debug("Limit boost duration {} to {}.", duration, deps.maxDuration());
            return deps.maxDuration();
        }
        return duration;
    }

    private double resolveTemperature(Double requested, EntityState thermostat) {
        Double temperature = requested;
        if (temperature == null) {
            temperature = settings.boostTemperature();
        }
        if (temperature == null) {
            temperature = getDefaultTemperature(thermostat);
        }
        if (temperature == null || !Double.isFinite(temperature)) {
            throw new BoostValidationException("Unable to determine boost temperature.");
        }
        return getBounds().clamp(temperature);
    }

    private static Double getDefaultTemperature(EntityState thermostat) {
        if (thermostat.getTemperature() != null) {
            return thermostat.getTemperature();
        }
        return thermostat.getCurrentTemperature();
    }

    private EntityState readThermostat() {
        EntityState thermostat;
        try {
            thermostat = deps.api().getState(device.deviceId());
        } catch (RuntimeException e) {
            throw new BoostActuationException("Failed to read thermostat state", e);
        }
        if (thermostat == null || !thermostat.isAvailable()) {
            throw new BoostActuationException("Thermostat " + device.deviceId() + " is not available", null);
        }
        return thermostat;
    }

    private List<ScheduleSwitchState> captureSchedules() {
        try {
            return deps.schedules().capture(device.deviceId(), device.getDisplayName(friendlyName));
        } catch (RuntimeException e) {
            log.warn("Failed to look up schedule switches. Boosting without schedule handling: {}",
                    e.getLocalizedMessage());
            return null;
        }
    }

    private void setTargetTemperature(double temperature) {
        try {
            deps.api().setTargetTemperature(device.deviceId(), temperature);
        } catch (RuntimeException e) {
            throw new BoostActuationException("Failed to set boost temperature " + temperature, e);
        }
    }

    private String getScheduleInfo() {
        if (scheduleSnapshot == null) {
            return "";
        }
        return " (disabled schedules: " + scheduleSnapshot.stream().map(ScheduleSwitchState::switchId).toList() + ")";
    }

    void publish() {
        DeviceBoostState current = new DeviceBoostState(device, state, endTimestamp, getBounds(), settings,
                deps.maxDurationHours(), unit);
        view = current;
        deps.stateListener().onDeviceStateChanged(current);
    }

    DeviceBoostState getView() {
        return view;
    }

    ThermostatDevice getDevice() {
        return device;
    }

    DeviceSettings getSettings() {
        return settings;
    }

    SessionState getState() {
        return state;
    }

    Instant getEndTimestamp() {
        return endTimestamp;
    }

    Double getPreBoostTemperature() {
        return preBoostTemperature;
    }

    List<ScheduleSwitchState> getScheduleSnapshot() {
        return scheduleSnapshot;
    }
}
