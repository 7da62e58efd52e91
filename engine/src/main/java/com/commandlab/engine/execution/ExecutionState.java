package com.commandlab.engine.execution;

/**
 * Phases of one execution attempt, in order. An attempt ends in
 * {@link #SUCCEEDED} or {@link #FAILED}; the executor is {@link #IDLE}
 * between attempts.
 */
public enum ExecutionState {
    IDLE,
    SAFETY_CHECKING,
    SNAPSHOT_CREATING,
    MONITORING,
    INVOKING,
    MONITORING_STOPPING,
    RESULT_CAPTURING,
    SUCCEEDED,
    FAILED
}
