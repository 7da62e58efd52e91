package com.commandlab.engine.detection;

import com.commandlab.engine.host.DocumentInfo;
import com.commandlab.engine.host.EditorInfo;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure comparison of two {@link WorkspaceSnapshot}s. Every effect produced
 * by one call carries the same timestamp.
 */
public final class SnapshotDiffer {

    private SnapshotDiffer() {}

    public static List<SideEffect> diff(WorkspaceSnapshot before, WorkspaceSnapshot after, Instant at) {
        List<SideEffect> effects = new ArrayList<>();
        diffFiles(before.files(), after.files(), at, effects);
        diffDocuments(before, after, at, effects);
        diffSettings(before.settings(), after.settings(), at, effects);
        diffVisibleEditors(before.visibleEditors(), after.visibleEditors(), at, effects);
        return effects;
    }

    // ------------------------------------------------------------------
    // Files
    // ------------------------------------------------------------------

    private static void diffFiles(Map<String, FileInfo> before, Map<String, FileInfo> after,
                                  Instant at, List<SideEffect> out) {
        after.forEach((path, info) -> {
            if (!before.containsKey(path)) {
                out.add(SideEffect.of(SideEffectType.FILE_CREATED, path, at, "File created: " + path,
                        EffectDetails.fileChange(new Change<>(0L, info.size()), null, null)));
            }
        });
        before.keySet().stream()
                .filter(path -> !after.containsKey(path))
                .forEach(path -> out.add(SideEffect.of(SideEffectType.FILE_DELETED, path, at,
                        "File deleted: " + path, EffectDetails.NONE)));
        after.forEach((path, a) -> {
            FileInfo b = before.get(path);
            if (b != null && isModified(b, a)) {
                Change<Long> sizes = b.size() != a.size() ? new Change<>(b.size(), a.size()) : null;
                Change<String> hashes = b.contentHash() != null && a.contentHash() != null
                        && !b.contentHash().equals(a.contentHash())
                        ? new Change<>(b.contentHash(), a.contentHash()) : null;
                Change<Integer> lines = b.lineCount() != null && a.lineCount() != null
                        && !b.lineCount().equals(a.lineCount())
                        ? new Change<>(b.lineCount(), a.lineCount()) : null;
                out.add(SideEffect.of(SideEffectType.FILE_MODIFIED, path, at, "File modified: " + path,
                        EffectDetails.fileChange(sizes, hashes, lines)));
            }
        });
    }

    static boolean isModified(FileInfo before, FileInfo after) {
        if (before.size() != after.size()) {
            return true;
        }
        if (!Objects.equals(before.lastModified(), after.lastModified())) {
            return true;
        }
        return before.contentHash() != null && after.contentHash() != null
                && !before.contentHash().equals(after.contentHash());
    }

    // ------------------------------------------------------------------
    // Editor
    // ------------------------------------------------------------------

    private static void diffDocuments(WorkspaceSnapshot before, WorkspaceSnapshot after,
                                      Instant at, List<SideEffect> out) {
        Set<String> beforeUris = uris(before.openDocuments());
        Set<String> afterUris  = uris(after.openDocuments());
        for (DocumentInfo doc : after.openDocuments()) {
            if (!beforeUris.contains(doc.uri())) {
                out.add(SideEffect.of(SideEffectType.VIEW_OPENED, doc.uri(), at, "Document opened: " + doc.uri(),
                        EffectDetails.metadata(Map.of("languageId", Objects.requireNonNullElse(doc.languageId(), "plaintext"),
                                "lineCount", doc.lineCount()))));
            }
        }
        for (DocumentInfo doc : before.openDocuments()) {
            if (!afterUris.contains(doc.uri())) {
                out.add(SideEffect.of(SideEffectType.VIEW_CLOSED, doc.uri(), at,
                        "Document closed: " + doc.uri(), EffectDetails.NONE));
            }
        }
        // A cleared active document is already reported by the close above.
        String active = after.activeDocument();
        if (active != null && !active.equals(before.activeDocument())) {
            out.add(SideEffect.of(SideEffectType.VIEW_OPENED, active, at,
                    "Active document changed: " + active, EffectDetails.activeView()));
        }
    }

    private static Set<String> uris(List<DocumentInfo> docs) {
        return docs.stream().map(DocumentInfo::uri).collect(Collectors.toSet());
    }

    // ------------------------------------------------------------------
    // Settings and views
    // ------------------------------------------------------------------

    private static void diffSettings(Map<String, Object> before, Map<String, Object> after,
                                     Instant at, List<SideEffect> out) {
        Set<String> keys = new LinkedHashSet<>(before.keySet());
        keys.addAll(after.keySet());
        for (String key : keys) {
            Object b = before.get(key);
            Object a = after.get(key);
            if (!Objects.equals(b, a)) {
                out.add(SideEffect.of(SideEffectType.SETTING_CHANGED, key, at,
                        "Setting changed: " + key, EffectDetails.setting(b, a)));
            }
        }
    }

    private static void diffVisibleEditors(List<EditorInfo> before, List<EditorInfo> after,
                                           Instant at, List<SideEffect> out) {
        Set<String> beforeViews = visible(before);
        Set<String> afterViews  = visible(after);
        for (String view : afterViews) {
            if (!beforeViews.contains(view)) {
                out.add(SideEffect.of(SideEffectType.VIEW_OPENED, view, at, "View opened: " + view,
                        EffectDetails.NONE).inCategory(EffectCategory.VIEWS));
            }
        }
        for (String view : beforeViews) {
            if (!afterViews.contains(view)) {
                out.add(SideEffect.of(SideEffectType.VIEW_CLOSED, view, at, "View closed: " + view,
                        EffectDetails.NONE).inCategory(EffectCategory.VIEWS));
            }
        }
    }

    static Set<String> visible(List<EditorInfo> editors) {
        return editors.stream()
                .map(EditorInfo::documentUri)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
