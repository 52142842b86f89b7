package at.sv.boost.api.hass;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Tracks whether Home Assistant is fully started, either because it was already running when we connected, or
 * because it announced its start. Every start announcement after that is a restart, which means all published boost
 * entities are gone and have to be published again.
 */
@Slf4j
public class HassAvailabilityListener implements HassAvailabilityEventListener {

    private final AtomicBoolean started = new AtomicBoolean();
    private final Runnable onRestartedCallback;

    public HassAvailabilityListener(Runnable onRestartedCallback) {
        this.onRestartedCallback = onRestartedCallback;
    }

    @Override
    public void onStarted() {
        if (started.compareAndSet(false, true)) {
            log.info("Home Assistant finished starting.");
            return;
        }
        log.info("Home Assistant restarted. Publishing boost state again.");
        onRestartedCallback.run();
    }

    public boolean isFullyStarted() {
        return started.get();
    }

    /**
     * Probes whether Home Assistant is already running. The probe is skipped once a start is known.
     *
     * @return true if Home Assistant is fully started
     */
    public boolean probeStarted(BooleanSupplier probe) {
        if (started.get()) {
            return true;
        }
        if (probe.getAsBoolean() && started.compareAndSet(false, true)) {
            log.info("Home Assistant already running.");
        }
        return started.get();
    }
}
