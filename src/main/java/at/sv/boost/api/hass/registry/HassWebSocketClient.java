package at.sv.boost.api.hass.registry;

public interface HassWebSocketClient {
    /**
     * Sends a command to the Home Assistant WebSocket API and returns its response synchronously.
     *
     * @param commandType the type of command to send, e.g. {@code config/entity_registry/list}
     * @return the raw JSON response
     * @throws HassWebSocketException if authentication fails, the connection fails, or a timeout occurs
     */
    String sendCommand(String commandType);
}
