package com.commandlab.engine.validation;

/**
 * A single validation error or warning.
 *
 * @param suggestion how to fix it; null when there is nothing to suggest
 */
public record ValidationIssue(
        String         parameterName,
        ValidationCode code,
        String         message,
        String         suggestion) {

    static ValidationIssue of(String parameterName, ValidationCode code, String message) {
        return new ValidationIssue(parameterName, code, message, null);
    }
}
