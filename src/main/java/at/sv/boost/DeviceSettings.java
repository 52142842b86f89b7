package at.sv.boost;

/**
 * The user-facing selectors and flags of a single device.
 *
 * @param boostTemperature   the selected boost temperature, null if none was selected yet
 * @param durationHours      the selected boost duration in hours, 0 if none
 * @param scheduleOverride   if true, schedule switches are never touched by a boost
 * @param callForHeatEnabled if true, the device contributes to the aggregated call-for-heat signal
 */
public record DeviceSettings(Double boostTemperature, double durationHours, boolean scheduleOverride,
                             boolean callForHeatEnabled) {

    public static DeviceSettings defaults(boolean callForHeatEnabled) {
        return new DeviceSettings(null, 0, false, callForHeatEnabled);
    }

    public DeviceSettings withBoostTemperature(Double boostTemperature) {
        return new DeviceSettings(boostTemperature, durationHours, scheduleOverride, callForHeatEnabled);
    }

    public DeviceSettings withDurationHours(double durationHours) {
        return new DeviceSettings(boostTemperature, durationHours, scheduleOverride, callForHeatEnabled);
    }

    public DeviceSettings withScheduleOverride(boolean scheduleOverride) {
        return new DeviceSettings(boostTemperature, durationHours, scheduleOverride, callForHeatEnabled);
    }

    public DeviceSettings withCallForHeatEnabled(boolean callForHeatEnabled) {
        return new DeviceSettings(boostTemperature, durationHours, scheduleOverride, callForHeatEnabled);
    }
}
