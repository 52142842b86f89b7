package at.sv.boost.api;

/**
 * Exception to signal that Home Assistant could not be reached, or is not fully started yet.
 */
public final class HassConnectionFailure extends RuntimeException {

    public HassConnectionFailure(String message) {
        super(message);
    }

    public HassConnectionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
