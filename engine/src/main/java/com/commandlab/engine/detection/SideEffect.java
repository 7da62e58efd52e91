package com.commandlab.engine.detection;

import java.time.Instant;

/**
 * One observed change to workspace, editor or settings state.
 *
 * @param resource file path, document URI or setting key; null when the
 *                 change has no single subject (e.g. no active document)
 */
public record SideEffect(
        SideEffectType type,
        String         resource,
        Instant        timestamp,
        String         description,
        Severity       severity,
        EffectCategory category,
        EffectDetails  details) {

    public SideEffect {
        details = details == null ? EffectDetails.NONE : details;
    }

    public static SideEffect of(SideEffectType type, String resource, Instant timestamp,
                                String description, EffectDetails details) {
        return new SideEffect(type, resource, timestamp, description,
                type.defaultSeverity(), type.defaultCategory(), details);
    }

    public SideEffect inCategory(EffectCategory newCategory) {
        return new SideEffect(type, resource, timestamp, description, severity, newCategory, details);
    }
}
