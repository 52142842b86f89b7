package at.sv.boost;

public final class InvalidConfigurationLine extends RuntimeException {
    public InvalidConfigurationLine(String message) {
        super(message);
    }
}
