package at.sv.boost.api.hass;

public interface HassAvailabilityEventListener {
    void onStarted();
}
