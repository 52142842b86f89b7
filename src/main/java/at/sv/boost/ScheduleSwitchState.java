package at.sv.boost;

/**
 * On/off state of a schedule-control switch, captured when a boost starts.
 */
public record ScheduleSwitchState(String switchId, boolean wasOn) {
}
