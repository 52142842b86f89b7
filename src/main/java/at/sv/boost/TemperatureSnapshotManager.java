package at.sv.boost;

import at.sv.boost.api.EntityState;
import at.sv.boost.api.HomeAssistantApi;
import at.sv.boost.retry.RetryAttempt;
import at.sv.boost.retry.RetryExecutor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class TemperatureSnapshotManager {

    private final HomeAssistantApi api;
    private final RetryExecutor retryExecutor;

    public TemperatureSnapshotManager(HomeAssistantApi api, RetryExecutor retryExecutor) {
        this.api = api;
        this.retryExecutor = retryExecutor;
    }

    /**
     * @return the current target temperature of the thermostat, null if it does not report one
     */
    public Double capture(EntityState thermostat) {
        Double temperature = thermostat.getTemperature();
        if (temperature == null) {
            log.debug("{} reports no target temperature. Nothing to restore after the boost.", thermostat.getEntityId());
        }
        return temperature;
    }

    public RetryAttempt restore(String thermostatId, double temperature) {
        log.debug("Restore target temperature {}.", temperature);
        return retryExecutor.attempt("restore temperature " + temperature, thermostatId,
                () -> api.setTargetTemperature(thermostatId, temperature));
    }

    /**
     * Single immediate restore attempt, used when a start has to be rolled back.
     */
    public void restoreNow(String thermostatId, double temperature) {
        try {
            api.setTargetTemperature(thermostatId, temperature);
        } catch (RuntimeException e) {
            log.warn("Failed to roll back target temperature to {}: {}", temperature, e.getLocalizedMessage());
        }
    }
}
