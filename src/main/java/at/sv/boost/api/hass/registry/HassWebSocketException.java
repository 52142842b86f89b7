package at.sv.boost.api.hass.registry;

public class HassWebSocketException extends RuntimeException {
    public HassWebSocketException(String message) {
        super(message);
    }

    public HassWebSocketException(String message, Throwable cause) {
        super(message, cause);
    }
}
