package pipeline;

/** Lifecycle of one batch run. */
public enum BatchState {
    IDLE,
    ENUMERATING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FATAL_ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FATAL_ERROR;
    }
}
