package at.sv.boost.store;

import at.sv.boost.DeviceSettings;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
final class StorageDocument {
    static final int CURRENT_VERSION = 1;

    private int version = CURRENT_VERSION;
    private Map<String, PersistedBoostRecord> timers = new LinkedHashMap<>();
    private Map<String, DeviceSettings> settings = new LinkedHashMap<>();

    StorageDocument copy() {
        StorageDocument copy = new StorageDocument();
        copy.version = version;
        copy.timers = new LinkedHashMap<>(timers);
        copy.settings = new LinkedHashMap<>(settings);
        return copy;
    }
}
