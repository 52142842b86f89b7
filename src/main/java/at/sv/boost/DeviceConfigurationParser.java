package at.sv.boost;

import at.sv.boost.api.hass.HassApiUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses the device configuration file. Each line names one thermostat, followed by optional properties:
 * <pre>
 * climate.living_room    name:Living Room    call-for-heat:true
 * </pre>
 */
public final class DeviceConfigurationParser {

    public List<ThermostatDevice> parse(List<String> lines) {
        List<ThermostatDevice> devices = new ArrayList<>();
        Set<String> deviceIds = new HashSet<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("//") || trimmed.startsWith("#")) {
                continue;
            }
            ThermostatDevice device = parse(trimmed);
            if (!deviceIds.add(device.deviceId())) {
                throw new InvalidConfigurationLine("Duplicate device '" + device.deviceId() + "'.");
            }
            devices.add(device);
        }
        return devices;
    }

    public ThermostatDevice parse(String input) {
        String[] parts = input.split("\\t+|\\s{2,}");
        String deviceId = parts[0].trim();
        if (!"climate".equals(HassApiUtils.getDomain(deviceId)) || HassApiUtils.getObjectId(deviceId).isBlank()
            || deviceId.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidConfigurationLine("Invalid thermostat '" + deviceId + "': only climate entities are supported." +
                                               " Make sure to use either tabs or at least two spaces to separate the different configuration parts.");
        }
        String name = null;
        boolean callForHeat = false;
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i].trim();
            String[] typeAndValue = part.split(":", 2);
            if (typeAndValue.length != 2 || typeAndValue[1].isBlank()) {
                throw new InvalidConfigurationLine("Invalid device property '" + part + "': missing value. Expected format: 'type:value'");
            }
            String value = typeAndValue[1].trim();
            switch (typeAndValue[0].trim().toLowerCase(Locale.ROOT)) {
                case "name" -> name = value;
                case "call-for-heat" -> callForHeat = parseBoolean(value);
                default -> throw new InvalidConfigurationLine("Unknown device property '" + typeAndValue[0] +
                                                              "' in line '" + input + "'. Supported: " +
                                                              Arrays.asList("name", "call-for-heat"));
            }
        }
        return new ThermostatDevice(deviceId, name, callForHeat);
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new InvalidPropertyValue("Invalid boolean value '" + value + "'. Expected 'true' or 'false'.");
    }
}
