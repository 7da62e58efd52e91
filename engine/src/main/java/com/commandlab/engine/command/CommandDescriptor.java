package com.commandlab.engine.command;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Identity, classification and signature of a registered command.
 *
 * @param id                   unique command id, e.g. "workspace.writeFile"
 * @param category             top-level grouping used in tags and reports
 * @param subcategory          finer grouping, may be null
 * @param displayName          human-readable name
 * @param description          one-sentence summary
 * @param riskTier             declared danger
 * @param contextRequirements  host state checked before invocation
 * @param signature            ordered parameters; null when the command
 *                             publishes no signature (no validation is done)
 */
public record CommandDescriptor(
        String                   id,
        String                   category,
        String                   subcategory,
        String                   displayName,
        String                   description,
        RiskTier                 riskTier,
        List<ContextRequirement> contextRequirements,
        List<ParameterSpec>      signature) {

    public CommandDescriptor {
        contextRequirements = contextRequirements == null ? List.of() : List.copyOf(contextRequirements);
        signature = signature == null ? null : List.copyOf(signature);
    }

    @JsonIgnore
    public boolean hasSignature() {
        return signature != null;
    }

    public boolean requires(ContextRequirement requirement) {
        return contextRequirements.contains(requirement);
    }
}
