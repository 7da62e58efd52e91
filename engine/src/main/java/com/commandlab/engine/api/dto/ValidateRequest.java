package com.commandlab.engine.api.dto;

import java.util.Map;

/** Request body for POST /commands/{id}/validate. */
public record ValidateRequest(Map<String, Object> parameters) {

    public ValidateRequest {
        if (parameters == null) parameters = Map.of();
    }
}
