package at.sv.boost;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Derives a single demand signal from all devices with call-for-heat enabled: active as long as at least one of
 * them is heating. Listeners are only notified when the aggregate flips.
 */
@Slf4j
public final class CallForHeatAggregator {

    private final Consumer<Boolean> onAggregateChanged;
    private final Set<String> enabledDevices = new HashSet<>();
    private final Map<String, Boolean> heating = new HashMap<>();
    private Boolean active;

    public CallForHeatAggregator(Consumer<Boolean> onAggregateChanged) {
        this.onAggregateChanged = onAggregateChanged;
    }

    public synchronized void setEnabled(String deviceId, boolean enabled) {
        if (enabled) {
            enabledDevices.add(deviceId);
        } else {
            enabledDevices.remove(deviceId);
        }
        recompute();
    }

    public synchronized void onHeatingChanged(String deviceId, boolean isHeating) {
        Boolean previous = heating.put(deviceId, isHeating);
        if (previous != null && previous == isHeating) {
            return;
        }
        recompute();
    }

    public synchronized boolean isActive() {
        return active != null && active;
    }

    /**
     * Notifies while still holding the lock, so listeners see the flips in the order they happened.
     */
    private void recompute() {
        boolean result = enabledDevices.stream().anyMatch(id -> heating.getOrDefault(id, false));
        if (active != null && active == result) {
            return;
        }
        active = result;
        log.info("Call for heat {}.", result ? "active" : "inactive");
        onAggregateChanged.accept(result);
    }
}
