package com.commandlab.engine.execution;

import com.commandlab.engine.detection.SideEffect;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one execution attempt. Produced for every attempt, including
 * the ones rejected before invocation.
 *
 * @param returnValue present only when {@code success}
 * @param error       present only when not {@code success}
 * @param snapshotId  id of the pre-run snapshot, null when none was taken
 */
public record ExecutionResult(
        String              commandId,
        Map<String, Object> parameters,
        boolean             success,
        Instant             startTime,
        Instant             endTime,
        long                durationMs,
        Object              returnValue,
        ExecutionError      error,
        List<SideEffect>    sideEffects,
        String              snapshotId) {

    public ExecutionResult {
        parameters  = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    public static ExecutionResult succeeded(String commandId, Map<String, Object> parameters,
                                            Instant start, Instant end, Object returnValue,
                                            List<SideEffect> sideEffects, String snapshotId) {
        return new ExecutionResult(commandId, parameters, true, start, end,
                Duration.between(start, end).toMillis(), returnValue, null, sideEffects, snapshotId);
    }

    public static ExecutionResult failed(String commandId, Map<String, Object> parameters,
                                         Instant start, Instant end, ExecutionError error,
                                         List<SideEffect> sideEffects, String snapshotId) {
        return new ExecutionResult(commandId, parameters, false, start, end,
                Duration.between(start, end).toMillis(), null, error, sideEffects, snapshotId);
    }

    public ExecutionResult withReturnValue(Object value) {
        return new ExecutionResult(commandId, parameters, success, startTime, endTime, durationMs,
                value, error, sideEffects, snapshotId);
    }
}
