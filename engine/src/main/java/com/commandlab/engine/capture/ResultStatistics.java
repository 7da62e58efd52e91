package com.commandlab.engine.capture;

import java.util.Map;

public record ResultStatistics(
        int               totalResults,
        int               successfulResults,
        int               failedResults,
        double            successRate,
        int               commandsCovered,
        double            averageExecutionTimeMs,
        Map<String, Long> riskDistribution,
        Map<String, Long> tagDistribution) {}
