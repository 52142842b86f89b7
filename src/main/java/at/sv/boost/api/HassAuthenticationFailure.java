package at.sv.boost.api;

public final class HassAuthenticationFailure extends RuntimeException {
    public HassAuthenticationFailure() {
        super("Access token was rejected by Home Assistant");
    }
}
