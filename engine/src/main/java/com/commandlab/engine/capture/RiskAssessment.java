package com.commandlab.engine.capture;

import java.util.List;

public record RiskAssessment(
        int                   riskScore,
        OverallRisk           overallRisk,
        List<String>          riskFactors,
        AutomationSuitability automationSuitability,
        List<String>          precautions,
        boolean               requiresSpecialHandling) {}
