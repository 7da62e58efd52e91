package com.commandlab.engine.detection;

import com.commandlab.engine.host.DocumentInfo;
import com.commandlab.engine.host.EditorInfo;
import com.commandlab.engine.host.Selection;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time capture of everything the detector compares.
 *
 * {@code files} is keyed by absolute path; {@code documentContents} by
 * document URI and is what a rollback replays. Immutable once built.
 */
public record WorkspaceSnapshot(
        String                id,
        Instant               timestamp,
        Map<String, FileInfo> files,
        Set<String>           directories,
        Map<String, Object>   settings,
        List<DocumentInfo>    openDocuments,
        Map<String, String>   documentContents,
        String                activeDocument,
        Selection             activeSelection,
        List<EditorInfo>      visibleEditors) {

    public WorkspaceSnapshot {
        files            = Map.copyOf(files);
        directories      = Set.copyOf(directories);
        settings         = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
        openDocuments    = List.copyOf(openDocuments);
        documentContents = Map.copyOf(documentContents);
        visibleEditors   = List.copyOf(visibleEditors);
    }

    public int fileCount() {
        return files.size();
    }
}
