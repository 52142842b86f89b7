package at.sv.boost;

public interface BoostStateListener {

    void onDeviceStateChanged(DeviceBoostState state);

    void onCallForHeatChanged(boolean active);
}
