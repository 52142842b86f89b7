package at.sv.boost;

import java.time.Instant;

/**
 * Read-only view of a device, as exposed to Home Assistant.
 *
 * @param endTimestamp null unless the boost is active
 */
public record DeviceBoostState(ThermostatDevice device, SessionState state, Instant endTimestamp,
                               TemperatureBounds bounds, DeviceSettings settings, double maxDurationHours,
                               TemperatureUnit unit) {

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }
}
