package com.commandlab.engine.validation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating a value map against a signature.
 *
 * {@code coercedValues} holds only parameters that were present and
 * validated cleanly, in signature order.
 */
public record ValidationOutcome(
        boolean               valid,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings,
        Map<String, Object>   coercedValues) {

    public ValidationOutcome {
        errors        = List.copyOf(errors);
        warnings      = List.copyOf(warnings);
        coercedValues = Collections.unmodifiableMap(new LinkedHashMap<>(coercedValues));
    }

    static ValidationOutcome of(List<ValidationIssue> errors,
                                List<ValidationIssue> warnings,
                                Map<String, Object> coercedValues) {
        return new ValidationOutcome(errors.isEmpty(), errors, warnings, coercedValues);
    }
}
