package com.commandlab.engine.capture;

public enum AutomationSuitability {
    EXCELLENT, GOOD, FAIR, POOR, UNSUITABLE;

    public static AutomationSuitability of(OverallRisk risk, boolean success) {
        if (risk == OverallRisk.VERY_LOW && success) return EXCELLENT;
        if (risk == OverallRisk.LOW && success) return GOOD;
        if (risk == OverallRisk.MEDIUM) return FAIR;
        if (risk == OverallRisk.HIGH) return POOR;
        return UNSUITABLE;
    }
}
