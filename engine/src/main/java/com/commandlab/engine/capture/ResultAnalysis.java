package com.commandlab.engine.capture;

import java.util.List;

public record ResultAnalysis(
        PerformanceAnalysis performance,
        SideEffectAnalysis  sideEffectAnalysis,
        ReturnValueAnalysis returnValueAnalysis,
        RiskAssessment      riskAssessment,
        List<String>        recommendations) {}
