package at.sv.boost;

/**
 * A boost request was rejected. No state was changed.
 */
public final class BoostValidationException extends RuntimeException {
    public BoostValidationException(String message) {
        super(message);
    }
}
