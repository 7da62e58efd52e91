package com.commandlab.engine.detection;

import com.commandlab.engine.host.DocumentInfo;
import com.commandlab.engine.host.EditorHost;
import com.commandlab.engine.host.EditorInfo;
import com.commandlab.engine.host.HostEvents;
import com.commandlab.engine.host.Subscription;
import com.commandlab.engine.host.WorkspaceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Observes workspace, editor and settings changes around a command.
 *
 * <p>Two sources feed one effect list:
 * <ol>
 *   <li>Live host events recorded while monitoring is active, bounded by
 *       {@code maxSideEffects}.</li>
 *   <li>A baseline/final snapshot diff taken at stop time. Diff effects
 *       that duplicate a live one (same type and resource, less than a
 *       second apart) are dropped.</li>
 * </ol>
 *
 * One monitoring session at a time. Event callbacks may arrive on any
 * thread; the buffer and session fields are guarded by {@code lock}.
 */
@Component
public class SideEffectDetector {

    private static final Logger log = LoggerFactory.getLogger(SideEffectDetector.class);

    static final long DEDUP_WINDOW_MS = 1000;

    private final EditorHost          editor;
    private final HostEvents          events;
    private final WorkspaceScanner    scanner;
    private final DetectionProperties props;
    private final AtomicLong          snapshotCounter = new AtomicLong();

    private final Object             lock          = new Object();
    private final List<SideEffect>   effects       = new ArrayList<>();
    private final List<Subscription> subscriptions = new ArrayList<>();

    private boolean           active;
    private boolean           overflowLogged;
    private Instant           monitoringStart;
    private WorkspaceSnapshot baseline;
    private Set<String>       lastVisible = Set.of();

    public SideEffectDetector(WorkspaceFileSystem fileSystem,
                              EditorHost editor,
                              HostEvents events,
                              DetectionProperties props) {
        this.editor  = editor;
        this.events  = events;
        this.props   = props;
        this.scanner = new WorkspaceScanner(fileSystem, props);
    }

    // ------------------------------------------------------------------
    // Snapshots
    // ------------------------------------------------------------------

    public WorkspaceSnapshot createSnapshot() {
        Instant now = Instant.now();
        String id = "snapshot_" + snapshotCounter.incrementAndGet() + "_" + now.toEpochMilli();

        WorkspaceScanner.ScanResult scan = scanner.scan();

        Map<String, Object> settings = new LinkedHashMap<>();
        for (String key : props.getWatchedSettings()) {
            editor.getSetting(key).ifPresent(v -> settings.put(key, v));
        }

        List<DocumentInfo> docs = editor.getOpenDocuments();
        Map<String, String> contents = new HashMap<>();
        for (DocumentInfo doc : docs) {
            try {
                contents.put(doc.uri(), editor.getDocumentText(doc.uri()));
            } catch (RuntimeException e) {
                log.debug("Document {} not captured: {}", doc.uri(), e.getMessage());
            }
        }

        WorkspaceSnapshot snapshot = new WorkspaceSnapshot(id, now,
                scan.files(), scan.directories(), settings, docs, contents,
                editor.getActiveDocument().orElse(null),
                editor.getActiveSelection().orElse(null),
                editor.getVisibleEditors());
        log.debug("Snapshot {} captured: {} files, {} documents", id, snapshot.fileCount(), docs.size());
        return snapshot;
    }

    public List<SideEffect> compare(WorkspaceSnapshot before, WorkspaceSnapshot after) {
        return SnapshotDiffer.diff(before, after, after.timestamp());
    }

    // ------------------------------------------------------------------
    // Monitoring lifecycle
    // ------------------------------------------------------------------

    /**
     * Clear the buffer, take the baseline snapshot and subscribe to host
     * events.
     *
     * @throws IllegalStateException if monitoring is already active
     */
    public void startMonitoring() {
        synchronized (lock) {
            if (active) {
                throw new IllegalStateException("Side-effect monitoring is already active");
            }
            effects.clear();
            overflowLogged = false;
            baseline = createSnapshot();
            monitoringStart = Instant.now();
            lastVisible = SnapshotDiffer.visible(baseline.visibleEditors());
            active = true;
            subscribe();
        }
        log.info("Side-effect monitoring started (baseline {})", baseline.id());
    }

    /**
     * Unsubscribe, diff against a final snapshot and return every effect of
     * the session sorted by timestamp. Returns an empty list when no
     * session is active.
     */
    public List<SideEffect> stopMonitoring() {
        WorkspaceSnapshot before;
        synchronized (lock) {
            if (!active) {
                return List.of();
            }
            unsubscribeAll();
            before = baseline;
        }

        WorkspaceSnapshot after = createSnapshot();
        List<SideEffect> diffEffects = compare(before, after);

        List<SideEffect> result;
        synchronized (lock) {
            int added = 0;
            for (SideEffect candidate : diffEffects) {
                boolean duplicate = effects.stream().anyMatch(live -> sameEffect(live, candidate));
                if (!duplicate) {
                    effects.add(candidate);
                    added++;
                }
            }
            active = false;
            baseline = null;
            result = effects.stream()
                    .sorted(Comparator.comparing(SideEffect::timestamp))
                    .toList();
            log.info("Side-effect monitoring stopped: {} effects ({} from snapshot diff)",
                    result.size(), added);
        }
        return result;
    }

    /** Copy of the effects recorded so far; never blocks on the host. */
    public List<SideEffect> getCurrentEffects() {
        synchronized (lock) {
            return List.copyOf(effects);
        }
    }

    public boolean isActive() {
        synchronized (lock) {
            return active;
        }
    }

    /** Drop every subscription and end any session without diffing. */
    public void dispose() {
        synchronized (lock) {
            unsubscribeAll();
            active = false;
            baseline = null;
        }
    }

    static boolean sameEffect(SideEffect a, SideEffect b) {
        return a.type() == b.type()
                && Objects.equals(a.resource(), b.resource())
                && Math.abs(a.timestamp().toEpochMilli() - b.timestamp().toEpochMilli()) < DEDUP_WINDOW_MS;
    }

    // ------------------------------------------------------------------
    // Live recording
    // ------------------------------------------------------------------

    private void subscribe() {
        subscriptions.add(events.onFileCreated(p -> onFileEvent(SideEffectType.FILE_CREATED, p)));
        subscriptions.add(events.onFileChanged(p -> onFileEvent(SideEffectType.FILE_MODIFIED, p)));
        subscriptions.add(events.onFileDeleted(p -> onFileEvent(SideEffectType.FILE_DELETED, p)));
        subscriptions.add(events.onDocumentOpened(doc -> record(SideEffect.of(SideEffectType.VIEW_OPENED,
                doc.uri(), Instant.now(), "Document opened: " + doc.uri(),
                EffectDetails.metadata(Map.of(
                        "languageId", Objects.requireNonNullElse(doc.languageId(), "plaintext"),
                        "lineCount", doc.lineCount()))))));
        subscriptions.add(events.onDocumentClosed(doc -> record(SideEffect.of(SideEffectType.VIEW_CLOSED,
                doc.uri(), Instant.now(), "Document closed: " + doc.uri(), EffectDetails.NONE))));
        subscriptions.add(events.onActiveDocumentChanged(this::onActiveDocument));
        subscriptions.add(events.onVisibleEditorsChanged(this::onVisibleEditors));
        subscriptions.add(events.onSettingChanged(this::onSetting));
    }

    private void unsubscribeAll() {
        for (Subscription s : subscriptions) {
            s.unsubscribe();
        }
        subscriptions.clear();
    }

    private void onFileEvent(SideEffectType type, Path path) {
        if (scanner.isExcluded(path, false)) {
            return;
        }
        EffectDetails details = EffectDetails.NONE;
        if (type != SideEffectType.FILE_DELETED) {
            // Only the after side is known for live events.
            FileInfo info = scanner.describe(path);
            if (info != null) {
                details = EffectDetails.fileChange(
                        new Change<>(type == SideEffectType.FILE_CREATED ? 0L : null, info.size()),
                        info.contentHash() != null ? new Change<>(null, info.contentHash()) : null,
                        info.lineCount() != null ? new Change<>(null, info.lineCount()) : null);
            }
        }
        String verb = switch (type) {
            case FILE_CREATED -> "File created: ";
            case FILE_DELETED -> "File deleted: ";
            default -> "File modified: ";
        };
        record(SideEffect.of(type, path.toString(), Instant.now(), verb + path, details));
    }

    private void onActiveDocument(String uri) {
        if (uri == null) {
            return;
        }
        record(SideEffect.of(SideEffectType.VIEW_OPENED, uri, Instant.now(),
                "Active editor changed: " + uri, EffectDetails.activeView()));
    }

    private void onVisibleEditors(List<EditorInfo> editors) {
        Set<String> now = SnapshotDiffer.visible(editors);
        Set<String> previous;
        synchronized (lock) {
            previous = lastVisible;
            lastVisible = now;
        }
        Instant at = Instant.now();
        for (String view : now) {
            if (!previous.contains(view)) {
                record(SideEffect.of(SideEffectType.VIEW_OPENED, view, at, "View opened: " + view,
                        EffectDetails.NONE).inCategory(EffectCategory.VIEWS));
            }
        }
        for (String view : new LinkedHashSet<>(previous)) {
            if (!now.contains(view)) {
                record(SideEffect.of(SideEffectType.VIEW_CLOSED, view, at, "View closed: " + view,
                        EffectDetails.NONE).inCategory(EffectCategory.VIEWS));
            }
        }
    }

    private void onSetting(String key) {
        if (!props.getWatchedSettings().contains(key)) {
            return;
        }
        Object before;
        synchronized (lock) {
            before = baseline == null ? null : baseline.settings().get(key);
        }
        Object after = editor.getSetting(key).orElse(null);
        record(SideEffect.of(SideEffectType.SETTING_CHANGED, key, Instant.now(),
                "Setting changed: " + key, EffectDetails.setting(before, after)));
    }

    private void record(SideEffect effect) {
        synchronized (lock) {
            if (!active) {
                return;
            }
            if (monitoringStart != null && effect.timestamp().isBefore(monitoringStart)) {
                return;
            }
            if (effects.size() >= props.getMaxSideEffects()) {
                if (!overflowLogged) {
                    log.warn("Maximum side effects ({}) reached, ignoring further live effects",
                            props.getMaxSideEffects());
                    overflowLogged = true;
                }
                log.debug("Dropped {} on {}", effect.type(), effect.resource());
                return;
            }
            effects.add(effect);
        }
    }
}
