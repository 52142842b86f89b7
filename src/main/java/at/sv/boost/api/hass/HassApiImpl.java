package at.sv.boost.api.hass;

import at.sv.boost.TemperatureUnit;
import at.sv.boost.api.ApiFailure;
import at.sv.boost.api.EntityState;
import at.sv.boost.api.HassConnectionFailure;
import at.sv.boost.api.HomeAssistantApi;
import at.sv.boost.api.HttpResourceProvider;
import at.sv.boost.api.ResourceNotFoundException;
import at.sv.boost.api.hass.registry.HassEntityRegistry;
import at.sv.boost.api.hass.registry.HassWebSocketException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class HassApiImpl implements HomeAssistantApi {

    private final HttpResourceProvider httpResourceProvider;
    private final HassEntityRegistry entityRegistry;
    private final HassAvailabilityListener availabilityListener;
    private final ObjectMapper mapper;
    private final String baseUrl;

    private volatile TemperatureUnit temperatureUnit;

    public HassApiImpl(String origin, HttpResourceProvider httpResourceProvider, HassEntityRegistry entityRegistry,
                       HassAvailabilityListener availabilityListener) {
        baseUrl = origin + "/api";
        this.httpResourceProvider = httpResourceProvider;
        this.entityRegistry = entityRegistry;
        this.availabilityListener = availabilityListener;
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public void assertConnection() {
        boolean started = availabilityListener.probeStarted(() -> {
            try {
                return !lookupStates().isEmpty();
            } catch (ApiFailure e) {
                log.trace("Probe failed: {}", e.getLocalizedMessage());
                return false;
            }
        });
        if (!started) {
            throw new HassConnectionFailure("HA not fully started yet. Waiting for startup to complete...");
        }
    }

    @Override
    public EntityState getState(String entityId) {
        String response;
        try {
            response = httpResourceProvider.getResource(createUrl("/states/" + entityId));
        } catch (ResourceNotFoundException e) {
            return null;
        }
        try {
            return mapper.readValue(response, State.class).toEntityState();
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse state response '" + response + "' for id " + entityId, e);
        }
    }

    @Override
    public List<EntityState> getStates() {
        return lookupStates().stream()
                             .map(State::toEntityState)
                             .collect(Collectors.toList());
    }

    private List<State> lookupStates() {
        String response = httpResourceProvider.getResource(createUrl("/states"));
        try {
            return mapper.readValue(response, new TypeReference<>() {
            });
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse states response", e);
        }
    }

    @Override
    public void setTargetTemperature(String climateEntityId, double temperature) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entity_id", climateEntityId);
        data.put("temperature", temperature);
        callService("climate", "set_temperature", data);
    }

    @Override
    public void turnOn(String switchEntityId) {
        callService("switch", "turn_on", Map.of("entity_id", switchEntityId));
    }

    @Override
    public void turnOff(String switchEntityId) {
        callService("switch", "turn_off", Map.of("entity_id", switchEntityId));
    }

    @Override
    public void runScheduleAction(String switchEntityId) {
        callService("scheduler", "run_action", Map.of("entity_id", switchEntityId));
    }

    @Override
    public void callService(String domain, String service, Map<String, Object> data) {
        httpResourceProvider.postResource(createUrl("/services/" + domain + "/" + service), getBody(data));
    }

    @Override
    public void publishState(String entityId, String state, Map<String, Object> attributes) {
        httpResourceProvider.postResource(createUrl("/states/" + entityId),
                getBody(new ChangeState(state, attributes)));
    }

    @Override
    public TemperatureUnit getTemperatureUnit() {
        TemperatureUnit unit = temperatureUnit;
        if (unit == null) {
            unit = lookupTemperatureUnit();
            temperatureUnit = unit;
        }
        return unit;
    }

    private TemperatureUnit lookupTemperatureUnit() {
        String response = httpResourceProvider.getResource(createUrl("/config"));
        try {
            JsonNode config = mapper.readTree(response);
            return TemperatureUnit.fromHassUnit(config.path("unit_system").path("temperature").asText(null));
        } catch (JsonProcessingException e) {
            throw new ApiFailure("Failed to parse config response", e);
        }
    }

    @Override
    public List<String> getScheduleSwitchIds() {
        try {
            return entityRegistry.getScheduleSwitchIds();
        } catch (HassWebSocketException e) {
            log.warn("Failed to read entity registry, falling back to 'switch.schedule_*' entities: {}", e.getMessage());
            return lookupStates().stream()
                                 .map(State::getEntity_id)
                                 .filter(id -> id != null && id.startsWith("switch.schedule_"))
                                 .collect(Collectors.toList());
        }
    }

    @Override
    public void clearCaches() {
        temperatureUnit = null;
        entityRegistry.clearCaches();
    }

    private URL createUrl(String url) {
        try {
            return new URI(baseUrl + url).toURL();
        } catch (MalformedURLException | URISyntaxException e) {
            throw new IllegalArgumentException("Failed to construct API url", e);
        }
    }

    private String getBody(Object object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to create request body", e);
        }
    }

    @Data
    @AllArgsConstructor
    private static final class ChangeState {
        String state;
        Map<String, Object> attributes;
    }
}
