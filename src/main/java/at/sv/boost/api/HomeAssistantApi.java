package at.sv.boost.api;

import at.sv.boost.TemperatureUnit;

import java.util.List;
import java.util.Map;

public interface HomeAssistantApi {

    /**
     * @throws HassConnectionFailure     if Home Assistant is not reachable or not fully started yet
     * @throws HassAuthenticationFailure if the access token was rejected
     */
    void assertConnection();

    /**
     * @return the current state of the given entity, or null if the entity is not present
     * @throws HassConnectionFailure if Home Assistant could not be reached
     * @throws ApiFailure            if Home Assistant returned an error
     */
    EntityState getState(String entityId);

    List<EntityState> getStates();

    /**
     * Convenience check used before acting on an entity. Never throws; lookup failures count as unavailable.
     *
     * @return true, if the entity is present and its state is neither unknown nor unavailable
     */
    default boolean isAvailable(String entityId) {
        try {
            EntityState state = getState(entityId);
            return state != null && state.isAvailable();
        } catch (RuntimeException e) {
            return false;
        }
    }

    void setTargetTemperature(String climateEntityId, double temperature);

    void turnOn(String switchEntityId);

    void turnOff(String switchEntityId);

    /**
     * Asks the scheduler integration to apply the action of the given schedule right now.
     */
    void runScheduleAction(String switchEntityId);

    void callService(String domain, String service, Map<String, Object> data);

    /**
     * Publishes (creates or updates) a state for the given entity id in the Home Assistant state machine.
     */
    void publishState(String entityId, String state, Map<String, Object> attributes);

    TemperatureUnit getTemperatureUnit();

    /**
     * @return the ids of all schedule-control switches known to Home Assistant
     */
    List<String> getScheduleSwitchIds();

    void clearCaches();
}
