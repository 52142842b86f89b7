package at.sv.boost;

public enum FinishReason {
    /**
     * Finish requested by a user or automation.
     */
    REQUESTED,
    TIMER_EXPIRED,
    /**
     * The boost ended while the service was not running.
     */
    OFFLINE_EXPIRED
}
