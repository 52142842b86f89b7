package at.sv.boost.api;

import java.util.List;
import java.util.Map;

/**
 * Receives the events of the Home Assistant event stream relevant for boosting.
 */
public interface BoostEventListener {

    /**
     * @param oldState the previous state, null if the entity was just added
     * @param newState the new state, null if the entity was removed
     */
    void onStateChanged(String entityId, EntityState oldState, EntityState newState);

    /**
     * @param time        the raw requested duration (string, map, or number of hours), may be null
     * @param temperature the requested boost temperature, may be null
     */
    void onStartRequested(List<String> deviceIds, Object time, Double temperature);

    void onFinishRequested(List<String> deviceIds);

    void onSettingsChangeRequested(String deviceId, Map<String, Object> values);
}
