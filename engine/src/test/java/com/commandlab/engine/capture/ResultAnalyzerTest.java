package com.commandlab.engine.capture;

import com.commandlab.engine.capture.PerformanceAnalysis.Consistency;
import com.commandlab.engine.capture.PerformanceAnalysis.DurationCategory;
import com.commandlab.engine.capture.PerformanceAnalysis.RelativePerformance;
import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.command.RiskTier;
import com.commandlab.engine.detection.EffectDetails;
import com.commandlab.engine.detection.SideEffect;
import com.commandlab.engine.detection.SideEffectType;
import com.commandlab.engine.execution.CommandExecutionException;
import com.commandlab.engine.execution.ExecutionError;
import com.commandlab.engine.execution.ExecutionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResultAnalyzer: scoring, classification and recommendations.
 */
class ResultAnalyzerTest {

    static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    final ResultAnalyzer analyzer = new ResultAnalyzer(new ObjectMapper().registerModule(new JavaTimeModule()));

    // ------------------------------------------------------------------
    // End-to-end scenarios
    // ------------------------------------------------------------------

    @Test
    void safeFastCommandWithoutEffects_isExcellentForAutomation() {
        ExecutionResult result = ExecutionResult.succeeded("workspace.readFile", Map.of(),
                START, START.plusMillis(50), "content", List.of(), null);

        ResultAnalysis analysis = analyzer.analyze(descriptor(RiskTier.SAFE), result, List.of());

        assertThat(analysis.performance().durationCategory()).isEqualTo(DurationCategory.FAST);
        assertThat(analysis.riskAssessment().riskScore()).isZero();
        assertThat(analysis.riskAssessment().overallRisk()).isEqualTo(OverallRisk.VERY_LOW);
        assertThat(analysis.riskAssessment().automationSuitability()).isEqualTo(AutomationSuitability.EXCELLENT);
        assertThat(analysis.riskAssessment().precautions()).isEmpty();
        assertThat(analysis.recommendations()).isEmpty();
    }

    @Test
    void failedDestructiveCommandThatDeletedAFile_isUnsuitable() {
        SideEffect deleted = SideEffect.of(SideEffectType.FILE_DELETED, "/ws/a.txt", START,
                "File deleted: /ws/a.txt", EffectDetails.NONE);
        ExecutionResult result = ExecutionResult.failed("workspace.deleteFile", Map.of(),
                START, START.plusMillis(20),
                ExecutionError.from(CommandExecutionException.Kind.INVOCATION_FAILED, new IllegalStateException("disk")),
                List.of(deleted), null);

        ResultAnalysis analysis = analyzer.analyze(descriptor(RiskTier.DESTRUCTIVE), result, List.of());

        RiskAssessment risk = analysis.riskAssessment();
        assertThat(risk.riskScore()).isEqualTo(7);
        assertThat(risk.overallRisk()).isEqualTo(OverallRisk.VERY_HIGH);
        assertThat(risk.automationSuitability()).isEqualTo(AutomationSuitability.UNSUITABLE);
        assertThat(risk.requiresSpecialHandling()).isTrue();
        assertThat(risk.precautions()).containsExactly(
                "Create a workspace snapshot before running",
                "Require explicit confirmation before running");
        assertThat(analysis.sideEffectAnalysis().significantEffects()).containsExactly(deleted);
        assertThat(analysis.recommendations()).contains(
                "Investigate the failure and retry with different parameters",
                "Avoid unattended use without manual oversight");
    }

    @Test
    void sameOutcome_scoresHigherForDestructiveThanSafe() {
        SideEffect modified = effect(SideEffectType.FILE_MODIFIED);
        ExecutionResult result = ExecutionResult.succeeded("workspace.touch", Map.of(),
                START, START.plusMillis(30), null, List.of(modified), null);

        int safe        = analyzer.analyze(descriptor(RiskTier.SAFE), result, List.of()).riskAssessment().riskScore();
        int moderate    = analyzer.analyze(descriptor(RiskTier.MODERATE), result, List.of()).riskAssessment().riskScore();
        int destructive = analyzer.analyze(descriptor(RiskTier.DESTRUCTIVE), result, List.of()).riskAssessment().riskScore();

        assertThat(moderate).isGreaterThan(safe);
        assertThat(destructive).isGreaterThan(moderate);
    }

    // ------------------------------------------------------------------
    // Performance
    // ------------------------------------------------------------------

    @Test
    void durationCategories_followThresholds() {
        assertThat(DurationCategory.of(99)).isEqualTo(DurationCategory.FAST);
        assertThat(DurationCategory.of(100)).isEqualTo(DurationCategory.MODERATE);
        assertThat(DurationCategory.of(1000)).isEqualTo(DurationCategory.SLOW);
        assertThat(DurationCategory.of(5000)).isEqualTo(DurationCategory.VERY_SLOW);
    }

    @Test
    void relativePerformance_usesTwentyFivePercentBand() {
        List<Long> history = List.of(100L, 100L);

        assertThat(analyzer.analyzePerformance(70, history).relativePerformance()).isEqualTo(RelativePerformance.FASTER);
        assertThat(analyzer.analyzePerformance(110, history).relativePerformance()).isEqualTo(RelativePerformance.SIMILAR);
        assertThat(analyzer.analyzePerformance(130, history).relativePerformance()).isEqualTo(RelativePerformance.SLOWER);
        assertThat(analyzer.analyzePerformance(130, List.of()).relativePerformance()).isEqualTo(RelativePerformance.UNKNOWN);
    }

    @Test
    void consistency_needsTwoPreviousRuns() {
        assertThat(analyzer.analyzePerformance(10, List.of(10L)).consistency()).isEqualTo(Consistency.UNKNOWN);
        assertThat(analyzer.analyzePerformance(10, List.of(11L, 9L)).consistency()).isEqualTo(Consistency.CONSISTENT);
        assertThat(analyzer.analyzePerformance(1000, List.of(10L, 10L)).consistency()).isEqualTo(Consistency.VARIABLE);
    }

    // ------------------------------------------------------------------
    // Side effects
    // ------------------------------------------------------------------

    @Test
    void sideEffectRisk_isDrivenByWorstEffect() {
        assertThat(analyzer.analyzeSideEffects(List.of()).riskLevel()).isEqualTo(SideEffectAnalysis.Risk.NONE);
        assertThat(analyzer.analyzeSideEffects(List.of(effect(SideEffectType.VIEW_OPENED))).riskLevel())
                .isEqualTo(SideEffectAnalysis.Risk.LOW);
        assertThat(analyzer.analyzeSideEffects(List.of(effect(SideEffectType.FILE_CREATED))).riskLevel())
                .isEqualTo(SideEffectAnalysis.Risk.LOW);
        assertThat(analyzer.analyzeSideEffects(List.of(
                effect(SideEffectType.FILE_CREATED), effect(SideEffectType.SETTING_CHANGED))).riskLevel())
                .isEqualTo(SideEffectAnalysis.Risk.MEDIUM);
    }

    @Test
    void significantEffects_cappedAtFive() {
        List<SideEffect> many = Collections.nCopies(8, effect(SideEffectType.SETTING_CHANGED));

        SideEffectAnalysis analysis = analyzer.analyzeSideEffects(many);

        assertThat(analysis.significantEffects()).hasSize(ResultAnalyzer.MAX_SIGNIFICANT_EFFECTS);
        assertThat(analysis.effectsByType()).containsEntry("setting_changed", 8);
        assertThat(analysis.workspaceChanges().settingsChanged()).isEqualTo(8);
    }

    // ------------------------------------------------------------------
    // Return value
    // ------------------------------------------------------------------

    @Test
    void nestedObject_reportsStructure() {
        ReturnValueAnalysis rv = analyzer.analyzeReturnValue(Map.of("a", Map.of("b", List.of(1, 2))));

        assertThat(rv.returnType()).isEqualTo(ReturnValueAnalysis.ReturnType.OBJECT);
        assertThat(rv.structure().keyCount()).isEqualTo(1);
        assertThat(rv.structure().nestedLevels()).isEqualTo(2);
        assertThat(rv.serialization().isSerializable()).isTrue();
        assertThat(rv.containsSensitiveData()).isFalse();
    }

    @Test
    void sensitiveKeyword_addsTwoToScore() {
        ExecutionResult result = ExecutionResult.succeeded("x", Map.of(), START, START.plusMillis(5),
                Map.of("apiToken", "abc"), List.of(), null);

        ResultAnalysis analysis = analyzer.analyze(descriptor(RiskTier.SAFE), result, List.of());

        assertThat(analysis.returnValueAnalysis().containsSensitiveData()).isTrue();
        assertThat(analysis.riskAssessment().riskScore()).isEqualTo(2);
        assertThat(analysis.riskAssessment().precautions()).containsExactly("Sanitize return values before logging");
    }

    @Test
    void unserializableValue_isFlaggedComplex() {
        ReturnValueAnalysis rv = analyzer.analyzeReturnValue(new Object());

        assertThat(rv.serialization().isSerializable()).isFalse();
        assertThat(rv.serialization().complexity()).isEqualTo(ReturnValueAnalysis.Complexity.COMPLEX);
        assertThat(rv.structure()).isNull();
    }

    @Test
    void returnType_classification() {
        assertThat(ResultAnalyzer.returnType(null)).isEqualTo(ReturnValueAnalysis.ReturnType.NONE);
        assertThat(ResultAnalyzer.returnType(3)).isEqualTo(ReturnValueAnalysis.ReturnType.NUMBER);
        assertThat(ResultAnalyzer.returnType(List.of())).isEqualTo(ReturnValueAnalysis.ReturnType.ARRAY);
        assertThat(ResultAnalyzer.returnType(true)).isEqualTo(ReturnValueAnalysis.ReturnType.BOOLEAN);
    }

    // ------------------------------------------------------------------
    // Scoring table and tags
    // ------------------------------------------------------------------

    @Test
    void scoreToRisk_mapping() {
        assertThat(OverallRisk.fromScore(0)).isEqualTo(OverallRisk.VERY_LOW);
        assertThat(OverallRisk.fromScore(1)).isEqualTo(OverallRisk.LOW);
        assertThat(OverallRisk.fromScore(3)).isEqualTo(OverallRisk.MEDIUM);
        assertThat(OverallRisk.fromScore(5)).isEqualTo(OverallRisk.HIGH);
        assertThat(OverallRisk.fromScore(6)).isEqualTo(OverallRisk.VERY_HIGH);
    }

    @Test
    void suitability_failedLowRiskIsUnsuitable() {
        assertThat(AutomationSuitability.of(OverallRisk.LOW, false)).isEqualTo(AutomationSuitability.UNSUITABLE);
        assertThat(AutomationSuitability.of(OverallRisk.MEDIUM, false)).isEqualTo(AutomationSuitability.FAIR);
    }

    @Test
    void tags_areLowerCaseAndDeduplicated() {
        CommandDescriptor d = new CommandDescriptor("workspace.writeFile", "Workspace", "workspace",
                "Write", "w", RiskTier.MODERATE, List.of(), null);
        ExecutionResult result = ExecutionResult.succeeded(d.id(), Map.of(), START, START.plusMillis(5),
                null, List.of(effect(SideEffectType.FILE_CREATED)), null);

        List<String> tags = analyzer.tags(d, result, analyzer.analyze(d, result, List.of()));

        assertThat(tags).containsExactly("workspace", "moderate", "success", "fast", "medium", "has_side_effects");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static CommandDescriptor descriptor(RiskTier tier) {
        return new CommandDescriptor("test.command", "test", null, "Test", "t", tier, List.of(), null);
    }

    private static SideEffect effect(SideEffectType type) {
        return SideEffect.of(type, "r", START, type.label(), EffectDetails.NONE);
    }
}
