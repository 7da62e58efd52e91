package com.commandlab.engine.execution;

import com.commandlab.engine.command.CommandDescriptor;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one attempt needs. Built fresh for every attempt.
 *
 * @param parameters    caller values by parameter name, insertion order kept
 * @param timeout       null for the configured default
 * @param confirmed     the operator explicitly confirmed this attempt;
 *                      required for destructive commands
 * @param callerContext free-form values recorded with the result
 */
public record ExecutionContext(
        CommandDescriptor   descriptor,
        Map<String, Object> parameters,
        Duration            timeout,
        boolean             createSnapshot,
        boolean             confirmed,
        Map<String, Object> callerContext) {

    public ExecutionContext {
        parameters    = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        callerContext = callerContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(callerContext));
    }

    public static ExecutionContext of(CommandDescriptor descriptor, Map<String, Object> parameters) {
        return new ExecutionContext(descriptor, parameters, null, false, false, Map.of());
    }

    public ExecutionContext withTimeout(Duration newTimeout) {
        return new ExecutionContext(descriptor, parameters, newTimeout, createSnapshot, confirmed, callerContext);
    }

    public ExecutionContext withSnapshot() {
        return new ExecutionContext(descriptor, parameters, timeout, true, confirmed, callerContext);
    }

    public ExecutionContext withConfirmation() {
        return new ExecutionContext(descriptor, parameters, timeout, createSnapshot, true, callerContext);
    }
}
