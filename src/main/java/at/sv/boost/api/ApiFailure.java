package at.sv.boost.api;

/**
 * Exception to signal a backend error of Home Assistant (5xx, 429), a rejected service call, or a response that
 * could not be parsed. Callers treat it as a transient failure.
 */
public class ApiFailure extends RuntimeException {
    public ApiFailure(String message) {
        super(message);
    }

    public ApiFailure(String message, Throwable cause) {
        super(message, cause);
    }
}
