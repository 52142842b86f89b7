package at.sv.boost;

public final class InvalidPropertyValue extends RuntimeException {
    public InvalidPropertyValue(String message) {
        super(message);
    }
}
