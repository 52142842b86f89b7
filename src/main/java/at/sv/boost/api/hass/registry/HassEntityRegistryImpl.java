package at.sv.boost.api.hass.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
public class HassEntityRegistryImpl implements HassEntityRegistry {

    private static final String CACHE_KEY = "schedule-switches";

    private final HassWebSocketClient webSocketClient;
    private final ObjectMapper mapper;
    private final Cache<String, List<String>> scheduleSwitchCache;

    public HassEntityRegistryImpl(HassWebSocketClient webSocketClient, Ticker ticker, Duration cacheDuration) {
        this.webSocketClient = webSocketClient;
        this.mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        scheduleSwitchCache = Caffeine.newBuilder()
                                      .ticker(ticker)
                                      .expireAfterWrite(cacheDuration)
                                      .build();
    }

    @Override
    public List<String> getScheduleSwitchIds() {
        return scheduleSwitchCache.get(CACHE_KEY, key -> lookupScheduleSwitchIds());
    }

    private List<String> lookupScheduleSwitchIds() {
        String response = webSocketClient.sendCommand("config/entity_registry/list");
        EntityRegistryResponse registryResponse;
        try {
            registryResponse = mapper.readValue(response, EntityRegistryResponse.class);
        } catch (JsonProcessingException e) {
            throw new HassWebSocketException("Failed to parse entity registry response", e);
        }
        if (!registryResponse.isSuccess() || registryResponse.getResult() == null) {
            throw new HassWebSocketException("Failed to get entity registry: " + response);
        }
        List<String> ids = registryResponse.getResult().stream()
                                           .filter(EntityRegistryEntry::isScheduleSwitch)
                                           .filter(EntityRegistryEntry::isEnabled)
                                           .map(EntityRegistryEntry::getEntity_id)
                                           .collect(Collectors.toList());
        log.debug("Found {} schedule switches in entity registry.", ids.size());
        return ids;
    }

    @Override
    public void clearCaches() {
        scheduleSwitchCache.invalidateAll();
    }

    @Data
    @NoArgsConstructor
    private static class EntityRegistryResponse {
        private int id;
        private String type;
        private boolean success;
        private List<EntityRegistryEntry> result;
    }
}
