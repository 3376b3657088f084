package com.polarroute.shared.enums;

/**
 * Lifecycle state of an asynchronous route calculation task.
 * A task id with no recorded state is PENDING.
 */
public enum JobState {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,
    REVOKED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILURE || this == REVOKED;
    }
}
