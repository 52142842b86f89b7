package at.sv.boost.store;

import java.util.Map;

/**
 * Durable mapping from device id to the record of its active boost.
 */
public interface TimerStore {

    Map<String, PersistedBoostRecord> getAll();

    /**
     * @return the record of the given device, null if it has no active boost
     */
    PersistedBoostRecord get(String deviceId);

    /**
     * @throws java.io.UncheckedIOException if the record could not be persisted
     */
    void save(String deviceId, PersistedBoostRecord record);

    /**
     * @throws java.io.UncheckedIOException if the removal could not be persisted
     */
    void remove(String deviceId);
}
