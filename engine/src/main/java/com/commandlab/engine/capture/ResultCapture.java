package com.commandlab.engine.capture;

import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.detection.DetectionProperties;
import com.commandlab.engine.execution.ExecutionResult;
import com.commandlab.engine.host.DocumentInfo;
import com.commandlab.engine.host.EditorHost;
import com.commandlab.engine.host.WorkspaceFileSystem;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory store of captured results with search, statistics and export.
 *
 * Results are kept in capture order and never persisted; they live until
 * {@link #clearResults()} or shutdown.
 */
@Service
public class ResultCapture {

    private static final Logger log = LoggerFactory.getLogger(ResultCapture.class);

    private static final List<String> ENVIRONMENT_VARIABLES = List.of("JAVA_HOME", "TERM", "SPRING_PROFILES_ACTIVE");

    private static final Comparator<TestResult> NEWEST_FIRST =
            Comparator.comparing(TestResult::timestamp).reversed();

    private final ResultAnalyzer      analyzer;
    private final ResultExporter      exporter;
    private final EditorHost          editor;
    private final WorkspaceFileSystem fileSystem;
    private final DetectionProperties detectionProps;
    private final MeterRegistry       meterRegistry;

    private final Map<String, TestResult> results = Collections.synchronizedMap(new LinkedHashMap<>());
    private final AtomicLong resultCounter  = new AtomicLong();
    private final AtomicLong sessionCounter = new AtomicLong();

    public ResultCapture(ResultAnalyzer analyzer,
                         ResultExporter exporter,
                         EditorHost editor,
                         WorkspaceFileSystem fileSystem,
                         DetectionProperties detectionProps,
                         MeterRegistry meterRegistry) {
        this.analyzer       = analyzer;
        this.exporter       = exporter;
        this.editor         = editor;
        this.fileSystem     = fileSystem;
        this.detectionProps = detectionProps;
        this.meterRegistry  = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Capture
    // ------------------------------------------------------------------

    public TestResult captureResult(CommandDescriptor descriptor,
                                    Map<String, Object> parameters,
                                    ExecutionResult executionResult,
                                    TestConfiguration configuration,
                                    String notes) {
        Instant now = Instant.now();
        String id = "result_" + resultCounter.incrementAndGet() + "_" + now.toEpochMilli();

        List<Long> history = getResultsForCommand(descriptor.id()).stream()
                .map(r -> r.executionResult().durationMs())
                .toList();

        TestSession session = gatherSession(configuration);
        ResultAnalysis analysis = analyzer.analyze(descriptor, executionResult, history);
        List<String> tags = analyzer.tags(descriptor, executionResult, analysis);

        // Keep stored results exportable even when the command returned something Jackson cannot write.
        ExecutionResult stored = analysis.returnValueAnalysis().serialization().isSerializable()
                ? executionResult
                : executionResult.withReturnValue(String.valueOf(executionResult.returnValue()));

        TestResult result = new TestResult(id, descriptor.id(), descriptor, parameters, stored,
                session, analysis, now, tags, notes);
        results.put(id, result);

        meterRegistry.counter("commandlab.results.captured",
                "risk", analysis.riskAssessment().overallRisk().label()).increment();
        log.info("Captured result {} for '{}': success={} risk={} effects={}",
                id, descriptor.id(), executionResult.success(),
                analysis.riskAssessment().overallRisk().label(),
                analysis.sideEffectAnalysis().totalEffects());
        return result;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Optional<TestResult> getResult(String resultId) {
        return Optional.ofNullable(results.get(resultId));
    }

    /** Results for one command, newest first. */
    public List<TestResult> getResultsForCommand(String commandId) {
        return searchResults(SearchCriteria.forCommand(commandId));
    }

    /** Matching results, newest first. */
    public List<TestResult> searchResults(SearchCriteria criteria) {
        List<TestResult> snapshot = snapshot();
        Collections.reverse(snapshot);
        return snapshot.stream()
                .filter(criteria::matches)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    public ResultStatistics getStatistics() {
        List<TestResult> all = snapshot();
        int total = all.size();
        int successful = (int) all.stream().filter(r -> r.executionResult().success()).count();
        int commands = (int) all.stream().map(TestResult::commandId).distinct().count();
        double avg = all.stream().mapToLong(r -> r.executionResult().durationMs()).average().orElse(0);

        Map<String, Long> risk = all.stream().collect(Collectors.groupingBy(
                r -> r.overallRisk().label(), TreeMap::new, Collectors.counting()));
        Map<String, Long> tags = all.stream()
                .flatMap(r -> r.tags().stream())
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));

        return new ResultStatistics(total, successful, total - successful,
                total == 0 ? 0 : (double) successful / total,
                commands, avg, risk, tags);
    }

    /** Export matching results (all results when {@code criteria} is null). */
    public String exportResults(ExportFormat format, SearchCriteria criteria) {
        List<TestResult> selected = criteria == null ? snapshot() : searchResults(criteria);
        return exporter.export(selected, format);
    }

    public void clearResults() {
        int count = results.size();
        results.clear();
        log.info("Cleared {} captured results", count);
    }

    private List<TestResult> snapshot() {
        synchronized (results) {
            return new ArrayList<>(results.values());
        }
    }

    // ------------------------------------------------------------------
    // Session
    // ------------------------------------------------------------------

    private TestSession gatherSession(TestConfiguration configuration) {
        String sessionId = "session_" + sessionCounter.incrementAndGet() + "_" + System.currentTimeMillis();

        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("java.version", System.getProperty("java.version"));
        for (String name : ENVIRONMENT_VARIABLES) {
            String value = System.getenv(name);
            if (value != null && !value.isEmpty()) {
                environment.put(name, value);
            }
        }
        return new TestSession(sessionId, editor.hostVersion(), gatherWorkspace(), environment, configuration);
    }

    private WorkspaceInfo gatherWorkspace() {
        List<Path> roots = fileSystem.listWorkspaceRoots();
        String name = null;
        String rootPath = null;
        if (!roots.isEmpty()) {
            Path first = roots.get(0);
            name = first.getFileName() != null ? first.getFileName().toString() : first.toString();
            rootPath = first.toString();
        }

        List<DocumentInfo> docs = editor.getOpenDocuments();
        WorkspaceInfo.ActiveFile activeFile = editor.getActiveDocument()
                .flatMap(uri -> docs.stream().filter(d -> d.uri().equals(uri)).findFirst())
                .map(d -> new WorkspaceInfo.ActiveFile(d.uri(), d.languageId(), d.lineCount()))
                .orElse(null);

        Map<String, Object> settings = new LinkedHashMap<>();
        for (String key : detectionProps.getWatchedSettings()) {
            try {
                editor.getSetting(key).ifPresent(v -> settings.put(key, v));
            } catch (RuntimeException e) {
                log.debug("Setting {} not readable: {}", key, e.getMessage());
            }
        }
        return new WorkspaceInfo(name, rootPath, roots.size(), docs.size(), activeFile, settings);
    }
}
