package at.sv.boost;

/**
 * Writing the boost temperature (or persisting the started boost) failed. The start was rolled back.
 */
public final class BoostActuationException extends RuntimeException {
    public BoostActuationException(String message, Throwable cause) {
        super(message, cause);
    }
}
