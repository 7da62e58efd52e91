package com.commandlab.engine.execution;

import com.commandlab.engine.capture.MonitoringLevel;
import com.commandlab.engine.capture.ResultCapture;
import com.commandlab.engine.capture.TestConfiguration;
import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.command.ContextRequirement;
import com.commandlab.engine.command.ParameterSpec;
import com.commandlab.engine.command.RiskTier;
import com.commandlab.engine.detection.SideEffect;
import com.commandlab.engine.detection.SideEffectDetector;
import com.commandlab.engine.detection.WorkspaceSnapshot;
import com.commandlab.engine.execution.CommandExecutionException.Kind;
import com.commandlab.engine.host.CommandHost;
import com.commandlab.engine.host.EditorHost;
import com.commandlab.engine.host.WorkspaceFileSystem;
import com.commandlab.engine.logging.MdcContext;
import com.commandlab.engine.validation.ParameterValidator;
import com.commandlab.engine.validation.ValidationOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one command attempt at a time under safety checks, a timeout and
 * side-effect monitoring.
 *
 * <p>Attempt phases (see {@link ExecutionState}):
 * <ol>
 *   <li>Safety checks: confirmation for destructive commands, context
 *       requirements, single in-flight attempt, parameter validation.</li>
 *   <li>Optional pre-run snapshot, kept for {@link #restoreSnapshot}.</li>
 *   <li>Monitoring start, invocation raced against the timeout, monitoring
 *       stop. A timed-out invocation is not cancelled; it gets a short grace
 *       period so its late side effects are still recorded.</li>
 *   <li>Result assembly and optional capture.</li>
 * </ol>
 *
 * {@link #execute} never throws: every failure becomes a failed
 * {@link ExecutionResult} with an error code.
 */
@Service
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private final CommandHost         host;
    private final ParameterValidator  validator;
    private final SideEffectDetector  detector;
    private final ResultCapture       resultCapture;
    private final WorkspaceFileSystem fileSystem;
    private final EditorHost          editor;
    private final ExecutorProperties  props;
    private final MeterRegistry       meterRegistry;

    private final ExecutorService invoker;
    private final AtomicBoolean   inFlight = new AtomicBoolean();
    private final Map<String, WorkspaceSnapshot> snapshots = new ConcurrentHashMap<>();

    private volatile ExecutionState state = ExecutionState.IDLE;

    public CommandExecutor(CommandHost host,
                           ParameterValidator validator,
                           SideEffectDetector detector,
                           ResultCapture resultCapture,
                           WorkspaceFileSystem fileSystem,
                           EditorHost editor,
                           ExecutorProperties props,
                           MeterRegistry meterRegistry) {
        this.host          = host;
        this.validator     = validator;
        this.detector      = detector;
        this.resultCapture = resultCapture;
        this.fileSystem    = fileSystem;
        this.editor        = editor;
        this.props         = props;
        this.meterRegistry = meterRegistry;

        AtomicInteger threadCounter = new AtomicInteger();
        this.invoker = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "command-invoker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ExecutionState currentState() {
        return state;
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public ExecutionResult execute(ExecutionContext context) {
        return execute(context, true, null);
    }

    public ExecutionResult execute(ExecutionContext context, boolean captureResult, String notes) {
        CommandDescriptor descriptor = context.descriptor();
        String commandId = descriptor.id();
        String attemptId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setAttempt(commandId, attemptId);

        Instant start = Instant.now();
        Timer.Sample sample = Timer.start(meterRegistry);
        // Only the attempt holding the in-flight flag drives the executor state.
        boolean acquired = inFlight.compareAndSet(false, true);
        ExecutionResult result;
        try {
            log.info("Starting execution of '{}' (tier={}, snapshot={})",
                    commandId, descriptor.riskTier(), context.createSnapshot());
            if (acquired) {
                state = ExecutionState.SAFETY_CHECKING;
            }
            if (!acquired) {
                throw new CommandExecutionException(Kind.CONCURRENT_EXECUTION,
                        "Another command execution is already in progress");
            }
            checkConfirmation(context);
            checkPreconditions(descriptor);
            List<Object> args = prepareArguments(context);
            result = runMonitored(context, args, start);
        } catch (CommandExecutionException e) {
            log.warn("Execution of '{}' rejected before invocation: [{}] {}", commandId, e.getKind(), e.getMessage());
            result = ExecutionResult.failed(commandId, context.parameters(), start, Instant.now(),
                    ExecutionError.from(e.getKind(), e), List.of(), null);
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing '{}'", commandId, e);
            result = ExecutionResult.failed(commandId, context.parameters(), start, Instant.now(),
                    ExecutionError.from(Kind.INVOCATION_FAILED, e), List.of(), null);
        }

        try {
            if (captureResult) {
                if (acquired) {
                    state = ExecutionState.RESULT_CAPTURING;
                }
                capture(context, result, notes);
            }
            if (acquired) {
                state = result.success() ? ExecutionState.SUCCEEDED : ExecutionState.FAILED;
            }
            record(commandId, result, sample);
            if (result.success()) {
                log.info("Command '{}' succeeded in {} ms with {} side effects",
                        commandId, result.durationMs(), result.sideEffects().size());
            } else {
                log.warn("Command '{}' failed in {} ms: [{}] {}", commandId, result.durationMs(),
                        result.error().code(), result.error().message());
            }
            return result;
        } finally {
            if (acquired) {
                inFlight.set(false);
            }
            MdcContext.clear();
        }
    }

    private void checkConfirmation(ExecutionContext context) {
        if (context.descriptor().riskTier() == RiskTier.DESTRUCTIVE && !context.confirmed()) {
            throw new CommandExecutionException(Kind.CONFIRMATION_REQUIRED,
                    "Destructive commands require explicit confirmation");
        }
    }

    private void checkPreconditions(CommandDescriptor descriptor) {
        if (descriptor.requires(ContextRequirement.OPEN_WORKSPACE) && fileSystem.listWorkspaceRoots().isEmpty()) {
            throw new CommandExecutionException(Kind.PRECONDITION_FAILED, "Command requires an open workspace");
        }
        if (descriptor.requires(ContextRequirement.ACTIVE_EDITOR) && editor.getActiveDocument().isEmpty()) {
            throw new CommandExecutionException(Kind.PRECONDITION_FAILED, "Command requires an active file editor");
        }
    }

    /** Validate and return positional arguments in signature order. */
    private List<Object> prepareArguments(ExecutionContext context) {
        CommandDescriptor descriptor = context.descriptor();
        if (!descriptor.hasSignature()) {
            return Collections.unmodifiableList(new ArrayList<>(context.parameters().values()));
        }
        ValidationOutcome outcome = validator.validate(descriptor.signature(), context.parameters());
        if (!outcome.valid()) {
            throw new CommandExecutionException(Kind.VALIDATION_FAILED,
                    "Parameter validation failed: " + ParameterValidator.formatErrors(outcome.errors()));
        }
        if (!outcome.warnings().isEmpty()) {
            log.debug("{}", ParameterValidator.formatWarnings(outcome.warnings()));
        }
        List<Object> args = new ArrayList<>();
        for (ParameterSpec spec : descriptor.signature()) {
            args.add(outcome.coercedValues().get(spec.name()));
        }
        while (!args.isEmpty() && args.get(args.size() - 1) == null) {
            args.remove(args.size() - 1);
        }
        return Collections.unmodifiableList(args);
    }

    private ExecutionResult runMonitored(ExecutionContext context, List<Object> args, Instant start) {
        String commandId = context.descriptor().id();

        String snapshotId = null;
        if (context.createSnapshot()) {
            state = ExecutionState.SNAPSHOT_CREATING;
            snapshotId = createSnapshot();
        }

        state = ExecutionState.MONITORING;
        try {
            detector.startMonitoring();
        } catch (RuntimeException e) {
            if (snapshotId != null) {
                snapshots.remove(snapshotId);
            }
            throw new CommandExecutionException(Kind.MONITORING_FAILED,
                    "Failed to start side-effect monitoring: " + e.getMessage(), e);
        }

        state = ExecutionState.INVOKING;
        Duration timeout = effectiveTimeout(context);
        Object value = null;
        ExecutionError error = null;
        CompletableFuture<Object> call = CompletableFuture.supplyAsync(
                MdcContext.propagate(() -> host.invokeCommand(commandId, args)), invoker);
        try {
            value = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            error = ExecutionError.from(Kind.TIMEOUT, new CommandExecutionException(Kind.TIMEOUT,
                    "Command execution timeout after " + timeout.toMillis() + " ms"));
            log.warn("Command '{}' did not finish within {} ms; leaving it running", commandId, timeout.toMillis());
            awaitGrace(call);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            error = ExecutionError.from(Kind.INVOCATION_FAILED, cause);
            log.debug("Command '{}' threw", commandId, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = ExecutionError.from(Kind.INVOCATION_FAILED, new CommandExecutionException(
                    Kind.INVOCATION_FAILED, "Command execution cancelled: caller interrupted"));
        }

        state = ExecutionState.MONITORING_STOPPING;
        List<SideEffect> effects = stopMonitoringSafely();

        Instant end = Instant.now();
        return error == null
                ? ExecutionResult.succeeded(commandId, context.parameters(), start, end, value, effects, snapshotId)
                : ExecutionResult.failed(commandId, context.parameters(), start, end, error, effects, snapshotId);
    }

    private Duration effectiveTimeout(ExecutionContext context) {
        Duration timeout = context.timeout();
        return timeout == null || timeout.isZero() || timeout.isNegative() ? props.getDefaultTimeout() : timeout;
    }

    // Waits for a timed-out call to settle, bounded by the grace period; never throws.
    private void awaitGrace(CompletableFuture<Object> call) {
        long graceMs = props.getTimeoutGrace().toMillis();
        if (graceMs <= 0) {
            return;
        }
        call.handle((v, t) -> Boolean.TRUE)
                .completeOnTimeout(Boolean.FALSE, graceMs, TimeUnit.MILLISECONDS)
                .join();
    }

    private List<SideEffect> stopMonitoringSafely() {
        try {
            return detector.stopMonitoring();
        } catch (RuntimeException e) {
            log.warn("Failed to stop side-effect monitoring: {}", e.getMessage(), e);
            detector.dispose();
            return List.of();
        }
    }

    private void capture(ExecutionContext context, ExecutionResult result, String notes) {
        try {
            TestConfiguration configuration = new TestConfiguration(
                    effectiveTimeout(context).toMillis(),
                    context.createSnapshot(),
                    context.confirmed(),
                    MonitoringLevel.COMPREHENSIVE,
                    context.callerContext());
            resultCapture.captureResult(context.descriptor(), context.parameters(), result, configuration, notes);
        } catch (RuntimeException e) {
            log.warn("Failed to capture result for '{}': {}", context.descriptor().id(), e.getMessage(), e);
        }
    }

    private void record(String commandId, ExecutionResult result, Timer.Sample sample) {
        String code = result.success() ? "none" : result.error().code().name().toLowerCase();
        meterRegistry.counter("commandlab.execution.attempts",
                "command", commandId,
                "outcome", result.success() ? "succeeded" : "failed",
                "code", code).increment();
        sample.stop(meterRegistry.timer("commandlab.execution.duration", "command", commandId));
    }

    // ------------------------------------------------------------------
    // Snapshots and rollback
    // ------------------------------------------------------------------

    /**
     * Capture and keep a workspace snapshot.
     *
     * @throws CommandExecutionException with {@link Kind#SNAPSHOT_FAILED}
     */
    public String createSnapshot() {
        try {
            WorkspaceSnapshot snapshot = detector.createSnapshot();
            snapshots.put(snapshot.id(), snapshot);
            log.info("Created snapshot {} ({} files, {} documents)",
                    snapshot.id(), snapshot.fileCount(), snapshot.documentContents().size());
            return snapshot.id();
        } catch (RuntimeException e) {
            throw new CommandExecutionException(Kind.SNAPSHOT_FAILED,
                    "Failed to create workspace snapshot: " + e.getMessage(), e);
        }
    }

    /**
     * Replay captured document contents and re-show the active document
     * with its selection. File creations, deletions and setting changes are
     * not undone. Per-document failures are logged and skipped.
     *
     * @return number of documents whose content was replaced
     * @throws SnapshotNotFoundException for an unknown id
     */
    public int restoreSnapshot(String snapshotId) {
        WorkspaceSnapshot snapshot = snapshots.get(snapshotId);
        if (snapshot == null) {
            throw new SnapshotNotFoundException(snapshotId);
        }
        log.info("Restoring snapshot {}", snapshotId);

        int restored = 0;
        for (Map.Entry<String, String> doc : snapshot.documentContents().entrySet()) {
            try {
                String current = editor.getOpenDocuments().stream()
                        .anyMatch(d -> d.uri().equals(doc.getKey()))
                        ? editor.getDocumentText(doc.getKey()) : null;
                if (!doc.getValue().equals(current)) {
                    editor.replaceDocumentText(doc.getKey(), doc.getValue());
                    restored++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to restore document {}: {}", doc.getKey(), e.getMessage());
            }
        }
        if (snapshot.activeDocument() != null) {
            try {
                editor.showDocument(snapshot.activeDocument(), snapshot.activeSelection());
            } catch (RuntimeException e) {
                log.warn("Failed to restore active editor {}: {}", snapshot.activeDocument(), e.getMessage());
            }
        }
        log.info("Restored snapshot {} ({} documents replaced)", snapshotId, restored);
        return restored;
    }

    public List<SnapshotSummary> listSnapshots() {
        return snapshots.values().stream()
                .sorted(Comparator.comparing(WorkspaceSnapshot::timestamp))
                .map(s -> new SnapshotSummary(s.id(), s.timestamp(), s.fileCount(), s.documentContents().size()))
                .toList();
    }

    public boolean deleteSnapshot(String snapshotId) {
        boolean deleted = snapshots.remove(snapshotId) != null;
        if (deleted) {
            log.info("Deleted snapshot {}", snapshotId);
        }
        return deleted;
    }

    public void clearAllSnapshots() {
        int count = snapshots.size();
        snapshots.clear();
        log.info("Cleared {} snapshots", count);
    }

    /** Drop snapshots, stop any monitoring session and the invoker threads. */
    @PreDestroy
    public void dispose() {
        snapshots.clear();
        detector.dispose();
        invoker.shutdownNow();
        state = ExecutionState.IDLE;
    }
}
