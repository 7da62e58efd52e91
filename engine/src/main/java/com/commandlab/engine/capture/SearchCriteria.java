package com.commandlab.engine.capture;

import java.time.Instant;
import java.util.List;

/**
 * Filter over captured results. Null fields do not filter; all tags must
 * be present; the date range is inclusive on both ends.
 */
public record SearchCriteria(
        String       commandId,
        Boolean      success,
        OverallRisk  riskLevel,
        List<String> tags,
        Instant      from,
        Instant      to,
        Boolean      hasNotes) {

    public static SearchCriteria any() {
        return new SearchCriteria(null, null, null, null, null, null, null);
    }

    public static SearchCriteria forCommand(String commandId) {
        return new SearchCriteria(commandId, null, null, null, null, null, null);
    }

    public boolean matches(TestResult result) {
        if (commandId != null && !commandId.equals(result.commandId())) {
            return false;
        }
        if (success != null && success != result.executionResult().success()) {
            return false;
        }
        if (riskLevel != null && riskLevel != result.overallRisk()) {
            return false;
        }
        if (tags != null && !result.tags().containsAll(tags)) {
            return false;
        }
        if (from != null && result.timestamp().isBefore(from)) {
            return false;
        }
        if (to != null && result.timestamp().isAfter(to)) {
            return false;
        }
        return hasNotes == null || hasNotes == result.hasNotes();
    }
}
