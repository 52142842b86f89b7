package at.sv.boost;

import at.sv.boost.store.PersistedBoostRecord;
import at.sv.boost.store.TimerStore;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Reconciles persisted boosts with the wall clock after a restart: boosts that ended while the service was down are
 * finished right away, all others are resumed with a new end timer. Runs at most once per process.
 */
@Slf4j
public final class RecoveryCoordinator {

    private final TimerStore timerStore;
    private final BoostManager boostManager;
    private final Supplier<Instant> currentTime;
    private final AtomicBoolean started = new AtomicBoolean();

    public RecoveryCoordinator(TimerStore timerStore, BoostManager boostManager, Supplier<Instant> currentTime) {
        this.timerStore = timerStore;
        this.boostManager = boostManager;
        this.currentTime = currentTime;
    }

    /**
     * @return completes once every persisted boost was resumed or finished
     */
    public CompletableFuture<Void> startup() {
        if (!started.compareAndSet(false, true)) {
            log.debug("Recovery already performed.");
            return CompletableFuture.completedFuture(null);
        }
        MDC.put("context", "recovery");
        try {
            Map<String, PersistedBoostRecord> records = timerStore.getAll();
            Instant now = currentTime.get();
            log.info("Recovering {} persisted boosts.", records.size());
            List<CompletableFuture<Void>> recovered = new ArrayList<>();
            records.forEach((deviceId, record) -> {
                if (!boostManager.isConfigured(deviceId)) {
                    discard(deviceId);
                } else if (!Instant.ofEpochMilli(record.endTimestamp()).isAfter(now)) {
                    log.info("Boost of {} expired while offline. Finishing it.", deviceId);
                    recovered.add(boostManager.finishExpiredBoost(deviceId, record));
                } else {
                    log.info("Resuming boost of {} until {}.", deviceId, Instant.ofEpochMilli(record.endTimestamp()));
                    recovered.add(boostManager.resumeBoost(deviceId, record));
                }
            });
            return CompletableFuture.allOf(recovered.toArray(CompletableFuture[]::new))
                                    .whenComplete((ignored, e) -> {
                                        if (e != null) {
                                            log.error("Recovery failed: {}", e.getLocalizedMessage(), e);
                                        }
                                    });
        } finally {
            MDC.remove("context");
        }
    }

    private void discard(String deviceId) {
        log.warn("Discarding persisted boost of unknown device {}.", deviceId);
        try {
            timerStore.remove(deviceId);
        } catch (UncheckedIOException e) {
            log.error("Failed to discard persisted boost of {}: {}", deviceId, e.getLocalizedMessage());
        }
    }
}
