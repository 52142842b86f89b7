package at.sv.boost.api.hass.registry;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
class EntityRegistryEntry {
    private String entity_id;
    private String platform;
    private String disabled_by;

    boolean isScheduleSwitch() {
        return entity_id != null && entity_id.startsWith("switch.") && "scheduler".equals(platform);
    }

    boolean isEnabled() {
        return disabled_by == null;
    }
}
