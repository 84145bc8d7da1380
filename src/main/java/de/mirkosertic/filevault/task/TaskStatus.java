package de.mirkosertic.filevault.task;

/**
 * Lifecycle of an index rebuild task.
 */
public enum TaskStatus {
    IDLE,
    RUNNING,
    SUCCESSFUL,
    FAILED,
    CANCELLED;

    public boolean isFinished() {
        return this == SUCCESSFUL || this == FAILED || this == CANCELLED;
    }
}
