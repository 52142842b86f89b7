package at.sv.boost;

import at.sv.boost.api.hass.HassApiUtils;

/**
 * A configured thermostat. The climate entity id doubles as the device id.
 *
 * @param name                  the display name used for schedule tag matching, null to use the thermostat's
 *                              friendly name
 * @param callForHeatByDefault initial call-for-heat flag, used until a persisted value exists
 */
public record ThermostatDevice(String deviceId, String name, boolean callForHeatByDefault) {

    public static final String CALL_FOR_HEAT_ACTIVE_ENTITY = "binary_sensor.thermostat_boost_call_for_heat_active";

    public String getObjectId() {
        return HassApiUtils.getObjectId(deviceId);
    }

    public String getBoostActiveEntity() {
        return "binary_sensor." + getObjectId() + "_boost_active";
    }

    public String getBoostFinishEntity() {
        return "sensor." + getObjectId() + "_boost_finish";
    }

    public String getBoostTemperatureEntity() {
        return "sensor." + getObjectId() + "_boost_temperature";
    }

    public String getTimeSelectorEntity() {
        return "sensor." + getObjectId() + "_boost_time_selector";
    }

    public String getDisableSchedulesEntity() {
        return "binary_sensor." + getObjectId() + "_disable_schedules";
    }

    public String getCallForHeatEnabledEntity() {
        return "binary_sensor." + getObjectId() + "_call_for_heat_enabled";
    }

    /**
     * @param friendlyName the current friendly name of the thermostat, may be null
     */
    public String getDisplayName(String friendlyName) {
        if (name != null) {
            return name;
        }
        if (friendlyName != null && !friendlyName.isBlank()) {
            return friendlyName;
        }
        return HassApiUtils.toDisplayName(deviceId);
    }
}
