package com.commandlab.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /executions.
 *
 * Required: commandId
 * Optional: parameters, timeoutMs (server default when null or not positive),
 *   createSnapshot, confirmed (mandatory for destructive commands),
 *   capture (defaults to true), notes, context (stored with the result).
 */
public record ExecuteRequest(String              commandId,
                             Map<String, Object> parameters,
                             Long                timeoutMs,
                             boolean             createSnapshot,
                             boolean             confirmed,
                             Boolean             capture,
                             String              notes,
                             Map<String, Object> context) {

    public ExecuteRequest {
        if (parameters == null) parameters = Map.of();
        if (capture == null) capture = Boolean.TRUE;
        if (context == null) context = Map.of();
    }
}
