package com.commandlab.engine.detection;

import java.util.Locale;

/**
 * Kinds of observable state change, with their default severity and
 * category. Visible-editor changes reuse the view types under
 * {@link EffectCategory#VIEWS}.
 */
public enum SideEffectType {

    FILE_CREATED(Severity.LOW, EffectCategory.FILE_SYSTEM),
    FILE_MODIFIED(Severity.LOW, EffectCategory.FILE_SYSTEM),
    FILE_DELETED(Severity.MEDIUM, EffectCategory.FILE_SYSTEM),
    SETTING_CHANGED(Severity.MEDIUM, EffectCategory.SETTINGS),
    VIEW_OPENED(Severity.LOW, EffectCategory.EDITOR),
    VIEW_CLOSED(Severity.LOW, EffectCategory.EDITOR);

    private final Severity       defaultSeverity;
    private final EffectCategory defaultCategory;

    SideEffectType(Severity defaultSeverity, EffectCategory defaultCategory) {
        this.defaultSeverity = defaultSeverity;
        this.defaultCategory = defaultCategory;
    }

    public Severity defaultSeverity() { return defaultSeverity; }
    public EffectCategory defaultCategory() { return defaultCategory; }

    /** Lower-case form used in tags and reports, e.g. "file_deleted". */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
