package at.sv.boost.api.hass;

import lombok.Data;

@Data
final class StateAttributes {
    String friendly_name;
    Object temperature;
    Object current_temperature;
    Object min_temp;
    Object max_temp;
    String hvac_action;
    /**
     * Either a single tag or a list of tags.
     */
    Object tags;
    Object entities;
}
