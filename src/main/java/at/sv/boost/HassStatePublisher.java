package at.sv.boost;

import at.sv.boost.api.HomeAssistantApi;
import lombok.extern.slf4j.Slf4j;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes the boost state of each device as a set of entities into the Home Assistant state machine.
 * Failures are logged and otherwise ignored; the next change publishes the full state again.
 */
@Slf4j
public final class HassStatePublisher implements BoostStateListener {

    private static final String INACTIVE = "inactive";

    private final HomeAssistantApi api;
    private final ZoneId zone;

    public HassStatePublisher(HomeAssistantApi api, ZoneId zone) {
        this.api = api;
        this.zone = zone;
    }

    @Override
    public void onDeviceStateChanged(DeviceBoostState state) {
        ThermostatDevice device = state.device();
        String name = device.getDisplayName(null);
        publish(device.getBoostActiveEntity(), onOff(state.isActive()), Map.of("friendly_name", name + " Boost Active"));
        publishFinish(state, name);
        publishTemperatureSelector(state, name);
        publish(device.getTimeSelectorEntity(), formatNumber(state.settings().durationHours()),
                Map.of("friendly_name", name + " Boost Time Selector",
                        "min", 0,
                        "max", state.maxDurationHours(),
                        "step", 0.5,
                        "unit_of_measurement", "h"));
        publish(device.getDisableSchedulesEntity(), onOff(state.settings().scheduleOverride()),
                Map.of("friendly_name", name + " Disable Schedules"));
        publish(device.getCallForHeatEnabledEntity(), onOff(state.settings().callForHeatEnabled()),
                Map.of("friendly_name", name + " Call For Heat"));
    }

    private void publishFinish(DeviceBoostState state, String name) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("friendly_name", name + " Boost Finish");
        if (state.isActive()) {
            String end = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(state.endTimestamp().atZone(zone));
            attributes.put("status", "active");
            attributes.put("end_time", end);
            attributes.put("device_class", "timestamp");
            publish(state.device().getBoostFinishEntity(), end, attributes);
        } else {
            attributes.put("status", "idle");
            publish(state.device().getBoostFinishEntity(), INACTIVE, attributes);
        }
    }

    private void publishTemperatureSelector(DeviceBoostState state, String name) {
        Double value = state.settings().boostTemperature();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("friendly_name", name + " Boost Temperature");
        attributes.put("min", state.bounds().min());
        attributes.put("max", state.bounds().max());
        attributes.put("step", 0.5);
        attributes.put("unit_of_measurement", state.unit().getSymbol());
        publish(state.device().getBoostTemperatureEntity(), value != null ? formatNumber(value) : "unknown", attributes);
    }

    @Override
    public void onCallForHeatChanged(boolean active) {
        publish(ThermostatDevice.CALL_FOR_HEAT_ACTIVE_ENTITY, onOff(active),
                Map.of("friendly_name", "Thermostat Boost Call For Heat", "device_class", "heat"));
    }

    private void publish(String entityId, String state, Map<String, Object> attributes) {
        try {
            api.publishState(entityId, state, attributes);
        } catch (RuntimeException e) {
            log.warn("Failed to publish state of {}: {}", entityId, e.getLocalizedMessage());
        }
    }

    private static String onOff(boolean value) {
        return value ? "on" : "off";
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
