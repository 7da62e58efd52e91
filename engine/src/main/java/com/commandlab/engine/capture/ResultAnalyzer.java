package com.commandlab.engine.capture;

import com.commandlab.engine.capture.PerformanceAnalysis.Consistency;
import com.commandlab.engine.capture.PerformanceAnalysis.DurationCategory;
import com.commandlab.engine.capture.PerformanceAnalysis.RelativePerformance;
import com.commandlab.engine.capture.ReturnValueAnalysis.Complexity;
import com.commandlab.engine.capture.ReturnValueAnalysis.ReturnType;
import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.command.RiskTier;
import com.commandlab.engine.detection.SideEffect;
import com.commandlab.engine.detection.SideEffectType;
import com.commandlab.engine.execution.ExecutionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives performance, side-effect, return-value and risk analyses from
 * an {@link ExecutionResult}. Stateless; history for relative performance
 * is passed in by the caller.
 *
 * <p>Risk score:
 * <pre>
 *   tier            destructive +3, moderate +2, safe 0
 *   side effects    high +3, medium +2, low +1
 *   failed          +1
 *   sensitive data  +2
 * </pre>
 * The sensitive-data check is a keyword heuristic and flags false
 * positives (any "key" in a result) as readily as it misses real secrets.
 */
@Component
public class ResultAnalyzer {

    static final int MAX_SIGNIFICANT_EFFECTS = 5;
    static final int MANY_EFFECTS = 5;

    private static final Pattern SENSITIVE = Pattern.compile(
            "password|token|key|secret|credential|auth", Pattern.CASE_INSENSITIVE);

    private static final Set<SideEffectType> SIGNIFICANT =
            EnumSet.of(SideEffectType.FILE_DELETED, SideEffectType.SETTING_CHANGED);

    // Relative performance and consistency thresholds.
    private static final double SIMILAR_BAND   = 0.25;
    private static final double VARIABLE_RATIO = 0.5;

    private final ObjectMapper objectMapper;

    public ResultAnalyzer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ResultAnalysis analyze(CommandDescriptor descriptor, ExecutionResult result, List<Long> previousDurations) {
        PerformanceAnalysis performance = analyzePerformance(result.durationMs(), previousDurations);
        SideEffectAnalysis effects = analyzeSideEffects(result.sideEffects());
        ReturnValueAnalysis returnValue = analyzeReturnValue(result.returnValue());
        RiskAssessment risk = assessRisk(descriptor.riskTier(), result.success(), effects, returnValue);
        List<String> recommendations = recommend(result.success(), performance, effects, risk);
        return new ResultAnalysis(performance, effects, returnValue, risk, recommendations);
    }

    // ------------------------------------------------------------------
    // Performance
    // ------------------------------------------------------------------

    PerformanceAnalysis analyzePerformance(long durationMs, List<Long> previous) {
        RelativePerformance relative = RelativePerformance.UNKNOWN;
        Consistency consistency = Consistency.UNKNOWN;
        if (!previous.isEmpty()) {
            double mean = previous.stream().mapToLong(Long::longValue).average().orElse(0);
            if (mean <= 0) {
                relative = durationMs == 0 ? RelativePerformance.SIMILAR : RelativePerformance.SLOWER;
            } else if (durationMs < mean * (1 - SIMILAR_BAND)) {
                relative = RelativePerformance.FASTER;
            } else if (durationMs > mean * (1 + SIMILAR_BAND)) {
                relative = RelativePerformance.SLOWER;
            } else {
                relative = RelativePerformance.SIMILAR;
            }
        }
        if (previous.size() >= 2) {
            List<Long> all = new ArrayList<>(previous);
            all.add(durationMs);
            double mean = all.stream().mapToLong(Long::longValue).average().orElse(0);
            double variance = all.stream().mapToDouble(d -> (d - mean) * (d - mean)).sum() / all.size();
            consistency = mean == 0 || Math.sqrt(variance) / mean <= VARIABLE_RATIO
                    ? Consistency.CONSISTENT : Consistency.VARIABLE;
        }
        return new PerformanceAnalysis(durationMs, DurationCategory.of(durationMs), relative, consistency);
    }

    // ------------------------------------------------------------------
    // Side effects
    // ------------------------------------------------------------------

    SideEffectAnalysis analyzeSideEffects(List<SideEffect> effects) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (SideEffect e : effects) {
            byType.merge(e.type().label(), 1, Integer::sum);
        }

        SideEffectAnalysis.Risk risk;
        if (effects.isEmpty()) {
            risk = SideEffectAnalysis.Risk.NONE;
        } else if (effects.stream().anyMatch(e -> e.type() == SideEffectType.FILE_DELETED)) {
            risk = SideEffectAnalysis.Risk.HIGH;
        } else if (effects.stream().anyMatch(e -> e.type() == SideEffectType.FILE_MODIFIED
                || e.type() == SideEffectType.SETTING_CHANGED)) {
            risk = SideEffectAnalysis.Risk.MEDIUM;
        } else {
            risk = SideEffectAnalysis.Risk.LOW;
        }

        List<SideEffect> significant = effects.stream()
                .filter(e -> SIGNIFICANT.contains(e.type()))
                .limit(MAX_SIGNIFICANT_EFFECTS)
                .toList();

        var changes = new SideEffectAnalysis.WorkspaceChanges(
                count(byType, SideEffectType.FILE_CREATED),
                count(byType, SideEffectType.FILE_MODIFIED),
                count(byType, SideEffectType.FILE_DELETED),
                count(byType, SideEffectType.SETTING_CHANGED),
                count(byType, SideEffectType.VIEW_OPENED),
                count(byType, SideEffectType.VIEW_CLOSED));

        return new SideEffectAnalysis(effects.size(), byType, risk, significant, changes);
    }

    private static int count(Map<String, Integer> byType, SideEffectType type) {
        return byType.getOrDefault(type.label(), 0);
    }

    // ------------------------------------------------------------------
    // Return value
    // ------------------------------------------------------------------

    ReturnValueAnalysis analyzeReturnValue(Object value) {
        ReturnType type = returnType(value);
        boolean sensitive = false;
        ReturnValueAnalysis.Structure structure = null;
        ReturnValueAnalysis.Serialization serialization;

        if (value instanceof CharSequence s) {
            sensitive = SENSITIVE.matcher(s).find();
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException | RuntimeException e) {
            json = null;
        }

        if (json == null) {
            serialization = new ReturnValueAnalysis.Serialization(false, null, Complexity.COMPLEX);
            if (type == ReturnType.OBJECT || type == ReturnType.ARRAY) {
                sensitive = SENSITIVE.matcher(String.valueOf(value)).find();
            }
        } else {
            int size = json.length();
            Complexity complexity = size > 10_000 ? Complexity.COMPLEX
                    : size > 1_000 ? Complexity.MODERATE
                    : Complexity.SIMPLE;
            serialization = new ReturnValueAnalysis.Serialization(true, size, complexity);
            if (type == ReturnType.OBJECT || type == ReturnType.ARRAY) {
                JsonNode tree = objectMapper.valueToTree(value);
                structure = new ReturnValueAnalysis.Structure(
                        tree.isObject(), tree.isArray(),
                        tree.isObject() ? tree.size() : null,
                        tree.isArray() ? tree.size() : null,
                        nestingLevel(tree));
                sensitive = SENSITIVE.matcher(json).find();
            }
        }
        return new ReturnValueAnalysis(type, structure, sensitive, serialization);
    }

    static ReturnType returnType(Object value) {
        if (value == null) return ReturnType.NONE;
        if (value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>) return ReturnType.STRING;
        if (value instanceof Number) return ReturnType.NUMBER;
        if (value instanceof Boolean) return ReturnType.BOOLEAN;
        if (value instanceof Collection<?> || value.getClass().isArray()) return ReturnType.ARRAY;
        return ReturnType.OBJECT;
    }

    /** 0 for a flat container; +1 for each level of nested containers. */
    static int nestingLevel(JsonNode node) {
        int max = 0;
        Iterator<JsonNode> children = node.elements();
        while (children.hasNext()) {
            JsonNode child = children.next();
            if (child.isContainerNode()) {
                max = Math.max(max, 1 + nestingLevel(child));
            }
        }
        return max;
    }

    // ------------------------------------------------------------------
    // Risk and recommendations
    // ------------------------------------------------------------------

    RiskAssessment assessRisk(RiskTier tier, boolean success,
                              SideEffectAnalysis effects, ReturnValueAnalysis returnValue) {
        List<String> factors = new ArrayList<>();
        int score = 0;

        switch (tier) {
            case DESTRUCTIVE -> {
                score += 3;
                factors.add("Command marked as destructive");
            }
            case MODERATE -> {
                score += 2;
                factors.add("Command marked as moderate risk");
            }
            case SAFE -> { }
        }
        switch (effects.riskLevel()) {
            case HIGH -> {
                score += 3;
                factors.add("High-risk side effects detected");
            }
            case MEDIUM -> {
                score += 2;
                factors.add("Medium-risk side effects detected");
            }
            case LOW -> {
                score += 1;
                factors.add("Low-risk side effects detected");
            }
            case NONE -> { }
        }
        if (!success) {
            score += 1;
            factors.add("Command execution failed");
        }
        if (returnValue.containsSensitiveData()) {
            score += 2;
            factors.add("Return value contains sensitive data");
        }

        OverallRisk overall = OverallRisk.fromScore(score);

        List<String> precautions = new ArrayList<>();
        if (effects.riskLevel() != SideEffectAnalysis.Risk.NONE) {
            precautions.add("Create a workspace snapshot before running");
        }
        if (tier == RiskTier.DESTRUCTIVE) {
            precautions.add("Require explicit confirmation before running");
        }
        if (returnValue.containsSensitiveData()) {
            precautions.add("Sanitize return values before logging");
        }

        boolean special = overall == OverallRisk.HIGH || overall == OverallRisk.VERY_HIGH;
        return new RiskAssessment(score, overall, factors,
                AutomationSuitability.of(overall, success), precautions, special);
    }

    List<String> recommend(boolean success, PerformanceAnalysis performance,
                           SideEffectAnalysis effects, RiskAssessment risk) {
        List<String> out = new ArrayList<>();
        if (!success) {
            out.add("Investigate the failure and retry with different parameters");
        }
        if (performance.durationCategory() == DurationCategory.VERY_SLOW) {
            out.add("Extend the timeout before using this command in automation");
        }
        if (effects.totalEffects() > MANY_EFFECTS) {
            out.add("Test with a workspace snapshot to understand all side effects");
        }
        if (risk.requiresSpecialHandling()) {
            out.add("Avoid unattended use without manual oversight");
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Tags
    // ------------------------------------------------------------------

    public List<String> tags(CommandDescriptor descriptor, ExecutionResult result, ResultAnalysis analysis) {
        List<String> tags = new ArrayList<>();
        addTag(tags, descriptor.category());
        addTag(tags, descriptor.subcategory());
        addTag(tags, descriptor.riskTier().name());
        tags.add(result.success() ? "success" : "failure");
        addTag(tags, analysis.performance().durationCategory().name());
        tags.add(analysis.riskAssessment().overallRisk().label());
        if (analysis.sideEffectAnalysis().totalEffects() > 0) {
            tags.add("has_side_effects");
        }
        if (analysis.returnValueAnalysis().containsSensitiveData()) {
            tags.add("sensitive_data");
        }
        if (analysis.riskAssessment().requiresSpecialHandling()) {
            tags.add("special_handling");
        }
        return tags;
    }

    private static void addTag(List<String> tags, String value) {
        if (value != null && !value.isBlank()) {
            String tag = value.trim().toLowerCase(Locale.ROOT);
            if (!tags.contains(tag)) {
                tags.add(tag);
            }
        }
    }
}
