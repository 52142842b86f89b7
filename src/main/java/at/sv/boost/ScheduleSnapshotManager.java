package at.sv.boost;

import at.sv.boost.api.EntityState;
import at.sv.boost.api.HomeAssistantApi;
import at.sv.boost.retry.RetryAttempt;
import at.sv.boost.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Finds the schedule switches controlling a thermostat, captures their on/off state, and turns them off for the
 * duration of a boost.
 * <p>
 * A switch controls a thermostat if it lists the thermostat in its {@code entities} attribute. Switches without an
 * {@code entities} attribute match if one of their tags contains the thermostat's display name (ignoring case).
 */
@Slf4j
public final class ScheduleSnapshotManager {

    private final HomeAssistantApi api;
    private final RetryExecutor retryExecutor;

    public ScheduleSnapshotManager(HomeAssistantApi api, RetryExecutor retryExecutor) {
        this.api = api;
        this.retryExecutor = retryExecutor;
    }

    /**
     * Captures the state of all available switches controlling the given thermostat.
     *
     * @return the captured states, null if no matching switch exists
     */
    public List<ScheduleSwitchState> capture(String thermostatId, String displayName) {
        List<String> switchIds = api.getScheduleSwitchIds();
        if (switchIds.isEmpty()) {
            log.debug("No schedule switches found.");
            return null;
        }
        Map<String, EntityState> states = api.getStates().stream()
                                             .collect(Collectors.toMap(EntityState::getEntityId, Function.identity(),
                                                     (first, second) -> first));
        List<ScheduleSwitchState> snapshot = new ArrayList<>();
        for (String switchId : switchIds) {
            EntityState state = states.get(switchId);
            if (state == null || !state.isAvailable() || !matches(state, thermostatId, displayName)) {
                continue;
            }
            snapshot.add(new ScheduleSwitchState(switchId, state.isOn()));
        }
        if (snapshot.isEmpty()) {
            log.debug("No schedule switch controls '{}'.", displayName);
            return null;
        }
        log.debug("Captured schedule switches: {}", snapshot);
        return List.copyOf(snapshot);
    }

    static boolean matches(EntityState scheduleSwitch, String thermostatId, String displayName) {
        List<String> associated = scheduleSwitch.getAssociatedEntities();
        if (!associated.isEmpty()) {
            return associated.contains(thermostatId);
        }
        if (displayName == null || displayName.isBlank()) {
            return false;
        }
        String name = displayName.toLowerCase(Locale.ROOT);
        return scheduleSwitch.getTags().stream()
                             .anyMatch(tag -> tag.toLowerCase(Locale.ROOT).contains(name));
    }

    /**
     * Turns off all switches of the snapshot in the background.
     */
    public List<RetryAttempt> disable(List<ScheduleSwitchState> snapshot) {
        if (snapshot == null) {
            return List.of();
        }
        return snapshot.stream()
                       .map(entry -> retryExecutor.attempt("disable schedule", entry.switchId(),
                               () -> api.turnOff(entry.switchId())))
                       .collect(Collectors.toList());
    }

    /**
     * Returns each switch of the snapshot to its captured state. Switches that were on are additionally asked to
     * apply their schedule right away, since turning a switch on does not re-apply its current action.
     *
     * @return the running restores by switch id
     */
    public Map<String, RetryAttempt> restore(List<ScheduleSwitchState> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return Map.of();
        }
        log.debug("Restore schedule switches: {}", snapshot);
        Map<String, RetryAttempt> restores = new LinkedHashMap<>();
        snapshot.forEach(entry -> restores.put(entry.switchId(), restore(entry)));
        return restores;
    }

    private RetryAttempt restore(ScheduleSwitchState entry) {
        String switchId = entry.switchId();
        if (entry.wasOn()) {
            return retryExecutor.attempt("re-enable schedule", switchId, () -> {
                api.turnOn(switchId);
                api.runScheduleAction(switchId);
            });
        }
        return retryExecutor.attempt("keep schedule disabled", switchId, () -> api.turnOff(switchId));
    }
}
