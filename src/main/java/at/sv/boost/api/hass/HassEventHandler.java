package at.sv.boost.api.hass;

import at.sv.boost.api.BoostEventListener;
import at.sv.boost.api.HassAuthenticationFailure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public final class HassEventHandler {

    static final String BOOST_START_EVENT = "thermostat_boost_start";
    static final String BOOST_FINISH_EVENT = "thermostat_boost_finish";
    static final String BOOST_SET_EVENT = "thermostat_boost_set";

    private final ObjectMapper objectMapper;
    private final BoostEventListener eventListener;
    private final HassAvailabilityEventListener availabilityListener;

    public HassEventHandler(BoostEventListener eventListener, HassAvailabilityEventListener availabilityListener) {
        this.eventListener = eventListener;
        this.availabilityListener = availabilityListener;
        objectMapper = new ObjectMapper();
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void onMessage(String text) {
        Event event;
        try {
            event = objectMapper.readValue(text, Event.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse event message", e);
        }
        if ("auth_invalid".equals(event.type)) {
            throw new HassAuthenticationFailure();
        }
        if (!"event".equals(event.type) || event.event == null || event.event.event_type == null) {
            return;
        }
        EventData data = event.event.data != null ? event.event.data : new EventData();
        switch (event.event.event_type) {
            case "state_changed" -> eventListener.onStateChanged(data.entity_id,
                    data.old_state != null ? data.old_state.toEntityState() : null,
                    data.new_state != null ? data.new_state.toEntityState() : null);
            case "homeassistant_started" -> availabilityListener.onStarted();
            case BOOST_START_EVENT -> eventListener.onStartRequested(getDeviceIds(data.device_id), data.time,
                    toDouble(data.temperature));
            case BOOST_FINISH_EVENT -> eventListener.onFinishRequested(getDeviceIds(data.device_id));
            case BOOST_SET_EVENT -> getDeviceIds(data.device_id)
                    .forEach(deviceId -> eventListener.onSettingsChangeRequested(deviceId, getSettingValues(data)));
            default -> {
            }
        }
    }

    private static List<String> getDeviceIds(Object deviceId) {
        if (deviceId == null) {
            return List.of();
        }
        if (deviceId instanceof Collection<?> ids) {
            return ids.stream()
                      .filter(Objects::nonNull)
                      .map(Object::toString)
                      .collect(Collectors.toList());
        }
        return List.of(deviceId.toString());
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid temperature '" + s + "'", e);
            }
        }
        return null;
    }

    private static Map<String, Object> getSettingValues(EventData data) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (data.boost_temperature != null) {
            values.put("boost_temperature", data.boost_temperature);
        }
        if (data.duration_hours != null) {
            values.put("duration_hours", data.duration_hours);
        }
        if (data.schedule_override != null) {
            values.put("schedule_override", data.schedule_override);
        }
        if (data.call_for_heat != null) {
            values.put("call_for_heat", data.call_for_heat);
        }
        return values;
    }

    @Data
    private static final class Event {
        int id;
        String type;
        EventDetails event;
    }

    @Data
    private static final class EventDetails {
        String event_type;
        EventData data;
    }

    @Data
    private static final class EventData {
        String entity_id;
        State old_state;
        State new_state;
        Object device_id;
        Object time;
        Object temperature;
        Object boost_temperature;
        Object duration_hours;
        Object schedule_override;
        Object call_for_heat;
    }
}
