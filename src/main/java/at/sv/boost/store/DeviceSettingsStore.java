package at.sv.boost.store;

import at.sv.boost.DeviceSettings;

import java.util.Map;

public interface DeviceSettingsStore {

    Map<String, DeviceSettings> getAll();

    /**
     * @throws java.io.UncheckedIOException if the settings could not be persisted
     */
    void save(String deviceId, DeviceSettings settings);

    void remove(String deviceId);
}
