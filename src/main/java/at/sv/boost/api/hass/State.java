package at.sv.boost.api.hass;

import at.sv.boost.api.EntityState;
import lombok.Data;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Data
final class State {
    String entity_id;
    String state;
    StateAttributes attributes;

    EntityState toEntityState() {
        StateAttributes attr = attributes != null ? attributes : new StateAttributes();
        return EntityState.builder()
                          .entityId(entity_id)
                          .state(state)
                          .friendlyName(attr.friendly_name)
                          .temperature(toDouble(attr.temperature))
                          .currentTemperature(toDouble(attr.current_temperature))
                          .minTemp(attr.min_temp)
                          .maxTemp(attr.max_temp)
                          .hvacAction(attr.hvac_action)
                          .tags(toStringList(attr.tags))
                          .associatedEntities(toStringList(attr.entities))
                          .build();
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<String> toStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                             .filter(Objects::nonNull)
                             .map(Object::toString)
                             .collect(Collectors.toList());
        }
        return List.of(value.toString());
    }
}
