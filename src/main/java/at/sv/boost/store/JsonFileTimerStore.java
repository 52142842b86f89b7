package at.sv.boost.store;

import java.util.Map;

public final class JsonFileTimerStore implements TimerStore {

    private final JsonFileStorage storage;

    public JsonFileTimerStore(JsonFileStorage storage) {
        this.storage = storage;
    }

    @Override
    public Map<String, PersistedBoostRecord> getAll() {
        return storage.read(document -> Map.copyOf(document.getTimers()));
    }

    @Override
    public PersistedBoostRecord get(String deviceId) {
        return storage.read(document -> document.getTimers().get(deviceId));
    }

    @Override
    public void save(String deviceId, PersistedBoostRecord record) {
        storage.update(document -> document.getTimers().put(deviceId, record));
    }

    @Override
    public void remove(String deviceId) {
        if (get(deviceId) == null) {
            return;
        }
        storage.update(document -> document.getTimers().remove(deviceId));
    }
}
