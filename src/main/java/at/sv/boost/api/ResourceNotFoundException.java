package at.sv.boost.api;

public final class ResourceNotFoundException extends ApiFailure {
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
