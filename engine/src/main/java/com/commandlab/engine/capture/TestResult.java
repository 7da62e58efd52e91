package com.commandlab.engine.capture;

import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.execution.ExecutionResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A captured execution outcome with its analysis. Immutable; held in
 * memory by {@link ResultCapture} until cleared.
 */
public record TestResult(
        String              id,
        String              commandId,
        CommandDescriptor   descriptor,
        Map<String, Object> parameters,
        ExecutionResult     executionResult,
        TestSession         session,
        ResultAnalysis      analysis,
        Instant             timestamp,
        List<String>        tags,
        String              notes) {

    public TestResult {
        tags = List.copyOf(tags);
    }

    public OverallRisk overallRisk() {
        return analysis.riskAssessment().overallRisk();
    }

    public boolean hasNotes() {
        return notes != null && !notes.isBlank();
    }
}
