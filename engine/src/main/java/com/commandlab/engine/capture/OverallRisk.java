package com.commandlab.engine.capture;

import java.util.Locale;

/** Composite risk tier derived from the additive risk score. */
public enum OverallRisk {
    VERY_LOW, LOW, MEDIUM, HIGH, VERY_HIGH;

    public static OverallRisk fromScore(int score) {
        if (score >= 6) return VERY_HIGH;
        if (score >= 4) return HIGH;
        if (score >= 2) return MEDIUM;
        if (score >= 1) return LOW;
        return VERY_LOW;
    }

    /** Accepts "very_high", "VERY_HIGH" or "very-high". */
    public static OverallRisk parse(String value) {
        return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
