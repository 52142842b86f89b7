package at.sv.boost;

public enum SessionState {
    IDLE,
    ACTIVE
}
