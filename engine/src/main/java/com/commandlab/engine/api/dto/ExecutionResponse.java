package com.commandlab.engine.api.dto;

import com.commandlab.engine.detection.SideEffect;
import com.commandlab.engine.execution.ExecutionError;
import com.commandlab.engine.execution.ExecutionResult;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /executions. Always 200: a failed attempt is a
 * normal outcome and carries its {@code error}.
 */
public record ExecutionResponse(
        String           commandId,
        boolean          success,
        Instant          startTime,
        Instant          endTime,
        long             durationMs,
        Object           returnValue,
        ExecutionError   error,
        List<SideEffect> sideEffects,
        String           snapshotId
) {
    public static ExecutionResponse from(ExecutionResult r) {
        return new ExecutionResponse(
                r.commandId(),
                r.success(),
                r.startTime(),
                r.endTime(),
                r.durationMs(),
                r.returnValue(),
                r.error(),
                r.sideEffects(),
                r.snapshotId()
        );
    }
}
