package com.commandlab.engine.capture;

import java.util.Locale;

public enum ExportFormat {
    JSON, CSV, MARKDOWN;

    /** @throws IllegalArgumentException for unsupported formats */
    public static ExportFormat parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported export format: " + value, e);
        }
    }
}
