package at.sv.boost.api.hass.registry;

import java.util.List;

public interface HassEntityRegistry {
    /**
     * @return the entity ids of all enabled switches provided by the scheduler integration
     * @throws HassWebSocketException if the registry could not be read
     */
    List<String> getScheduleSwitchIds();

    /**
     * Clears the cached registry, forcing fresh data to be fetched on next lookup.
     */
    void clearCaches();
}
