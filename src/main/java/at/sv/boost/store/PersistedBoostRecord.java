package at.sv.boost.store;

import at.sv.boost.ScheduleSwitchState;

import java.util.List;

/**
 * Durable record of an active boost. Exists exactly as long as the boost of its device is active.
 *
 * @param endTimestamp           the end of the boost in epoch milliseconds
 * @param preBoostTemperature    the target temperature before the boost started, null if unknown
 * @param scheduleSnapshot       the schedule switches disabled for the boost, null if none were touched
 * @param scheduleOverrideActive whether schedule handling was skipped when the boost started
 */
public record PersistedBoostRecord(long endTimestamp, Double preBoostTemperature,
                                   List<ScheduleSwitchState> scheduleSnapshot, boolean scheduleOverrideActive) {
}
