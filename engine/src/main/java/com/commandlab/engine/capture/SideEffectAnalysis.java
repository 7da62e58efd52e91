package com.commandlab.engine.capture;

import com.commandlab.engine.detection.SideEffect;

import java.util.List;
import java.util.Map;

/**
 * @param effectsByType       counts keyed by effect label, e.g. "file_deleted"
 * @param significantEffects  at most five deletions or setting changes
 */
public record SideEffectAnalysis(
        int                  totalEffects,
        Map<String, Integer> effectsByType,
        Risk                 riskLevel,
        List<SideEffect>     significantEffects,
        WorkspaceChanges     workspaceChanges) {

    public enum Risk { NONE, LOW, MEDIUM, HIGH }

    public record WorkspaceChanges(
            int filesCreated,
            int filesModified,
            int filesDeleted,
            int settingsChanged,
            int viewsOpened,
            int viewsClosed) {}
}
