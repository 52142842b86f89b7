package at.sv.boost.store;

import at.sv.boost.DeviceSettings;

import java.util.Map;
import java.util.Objects;

public final class JsonFileSettingsStore implements DeviceSettingsStore {

    private final JsonFileStorage storage;

    public JsonFileSettingsStore(JsonFileStorage storage) {
        this.storage = storage;
    }

    @Override
    public Map<String, DeviceSettings> getAll() {
        return storage.read(document -> Map.copyOf(document.getSettings()));
    }

    @Override
    public void save(String deviceId, DeviceSettings settings) {
        boolean unchanged = storage.read(document -> Objects.equals(document.getSettings().get(deviceId), settings));
        if (unchanged) {
            return;
        }
        storage.update(document -> document.getSettings().put(deviceId, settings));
    }

    @Override
    public void remove(String deviceId) {
        if (storage.read(document -> !document.getSettings().containsKey(deviceId))) {
            return;
        }
        storage.update(document -> document.getSettings().remove(deviceId));
    }
}
