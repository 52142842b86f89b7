package at.sv.boost.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Locale;

/**
 * Snapshot of a single Home Assistant entity, reduced to the attributes the boost engine cares about.
 */
@Data
@AllArgsConstructor
@Builder
public final class EntityState {
    private final String entityId;
    private final String state;
    private final String friendlyName;
    /**
     * The current target temperature of a climate entity.
     */
    private final Double temperature;
    private final Double currentTemperature;
    /**
     * Raw {@code min_temp} attribute, may be missing or non-numeric.
     */
    private final Object minTemp;
    /**
     * Raw {@code max_temp} attribute, may be missing or non-numeric.
     */
    private final Object maxTemp;
    private final String hvacAction;
    @Builder.Default
    private final List<String> tags = List.of();
    /**
     * Entities a scheduler switch declares to control.
     */
    @Builder.Default
    private final List<String> associatedEntities = List.of();

    public boolean isAvailable() {
        return state != null && !"unavailable".equals(state) && !"unknown".equals(state);
    }

    public boolean isOn() {
        return "on".equals(state);
    }

    public boolean isHeating() {
        return hvacAction != null && "heating".equals(hvacAction.toLowerCase(Locale.ROOT));
    }
}
