package com.commandlab.engine.host.local;

import com.commandlab.engine.detection.ContentHasher;
import com.commandlab.engine.host.DocumentInfo;
import com.commandlab.engine.host.EditorHost;
import com.commandlab.engine.host.EditorInfo;
import com.commandlab.engine.host.Selection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Editor state kept in memory.
 *
 * Every mutation is published on the {@link WorkspaceEventBus} after the
 * state change, outside of the lock, so listeners can read back the new
 * state without deadlocking.
 */
public class InMemoryEditorHost implements EditorHost {

    private final WorkspaceEventBus   events;
    private final String              hostVersion;
    private final Object              lock      = new Object();
    private final Map<String, Buffer> documents = new LinkedHashMap<>();
    private final Map<String, Object> settings  = new LinkedHashMap<>();

    private String    activeUri;
    private Selection activeSelection;

    public InMemoryEditorHost(WorkspaceEventBus events, String hostVersion, Map<String, Object> initialSettings) {
        this.events      = events;
        this.hostVersion = hostVersion;
        this.settings.putAll(initialSettings);
    }

    @Override
    public String hostVersion() {
        return hostVersion;
    }

    // ------------------------------------------------------------------
    // Settings
    // ------------------------------------------------------------------

    @Override
    public Optional<Object> getSetting(String key) {
        synchronized (lock) {
            return Optional.ofNullable(settings.get(key));
        }
    }

    /** Sets (or, with a null value, removes) a setting and publishes the change. */
    public void updateSetting(String key, Object value) {
        synchronized (lock) {
            if (value == null) {
                settings.remove(key);
            } else {
                settings.put(key, value);
            }
        }
        events.publishSettingChanged(key);
    }

    // ------------------------------------------------------------------
    // Documents
    // ------------------------------------------------------------------

    @Override
    public List<DocumentInfo> getOpenDocuments() {
        synchronized (lock) {
            List<DocumentInfo> out = new ArrayList<>(documents.size());
            documents.forEach((uri, buffer) -> out.add(buffer.info(uri)));
            return out;
        }
    }

    /** Opens a document; a no-op when it is already open. */
    public DocumentInfo openDocument(String uri, String languageId, String text) {
        DocumentInfo info;
        synchronized (lock) {
            Buffer existing = documents.get(uri);
            if (existing != null) {
                return existing.info(uri);
            }
            Buffer buffer = new Buffer(languageId == null ? "plaintext" : languageId, text);
            documents.put(uri, buffer);
            info = buffer.info(uri);
        }
        events.publishDocumentOpened(info);
        return info;
    }

    /** Closes a document; returns false when it was not open. */
    public boolean closeDocument(String uri) {
        DocumentInfo info;
        boolean wasActive;
        List<EditorInfo> visible;
        synchronized (lock) {
            Buffer removed = documents.remove(uri);
            if (removed == null) {
                return false;
            }
            info = removed.info(uri);
            wasActive = uri.equals(activeUri);
            if (wasActive) {
                activeUri = null;
                activeSelection = null;
            }
            visible = visibleEditorsLocked();
        }
        events.publishDocumentClosed(info);
        if (wasActive) {
            events.publishActiveDocumentChanged(null);
            events.publishVisibleEditorsChanged(visible);
        }
        return true;
    }

    @Override
    public String getDocumentText(String uri) {
        synchronized (lock) {
            Buffer buffer = documents.get(uri);
            if (buffer == null) {
                throw new IllegalArgumentException("Document not open: " + uri);
            }
            return buffer.text;
        }
    }

    @Override
    public void replaceDocumentText(String uri, String text) {
        DocumentInfo opened = null;
        synchronized (lock) {
            Buffer buffer = documents.get(uri);
            if (buffer == null) {
                buffer = new Buffer("plaintext", text);
                documents.put(uri, buffer);
                opened = buffer.info(uri);
            } else {
                buffer.text  = text;
                buffer.dirty = true;
            }
        }
        if (opened != null) {
            events.publishDocumentOpened(opened);
        }
    }

    // ------------------------------------------------------------------
    // Views
    // ------------------------------------------------------------------

    @Override
    public Optional<String> getActiveDocument() {
        synchronized (lock) {
            return Optional.ofNullable(activeUri);
        }
    }

    @Override
    public Optional<Selection> getActiveSelection() {
        synchronized (lock) {
            return Optional.ofNullable(activeSelection);
        }
    }

    @Override
    public List<EditorInfo> getVisibleEditors() {
        synchronized (lock) {
            return visibleEditorsLocked();
        }
    }

    @Override
    public void showDocument(String uri, Selection selection) {
        boolean changed;
        List<EditorInfo> visible;
        synchronized (lock) {
            if (!documents.containsKey(uri)) {
                throw new IllegalArgumentException("Document not open: " + uri);
            }
            changed = !uri.equals(activeUri);
            activeUri = uri;
            activeSelection = selection == null ? Selection.cursorAtStart() : selection;
            visible = visibleEditorsLocked();
        }
        if (changed) {
            events.publishActiveDocumentChanged(uri);
            events.publishVisibleEditorsChanged(visible);
        }
    }

    // Single editor column: only the active document is visible.
    private List<EditorInfo> visibleEditorsLocked() {
        if (activeUri == null) {
            return List.of();
        }
        return List.of(new EditorInfo(activeUri, 1, activeSelection));
    }

    private static final class Buffer {
        final String languageId;
        String  text;
        boolean dirty;

        Buffer(String languageId, String text) {
            this.languageId = languageId;
            this.text       = text == null ? "" : text;
        }

        DocumentInfo info(String uri) {
            return new DocumentInfo(uri, languageId, dirty,
                    ContentHasher.lineCount(text), ContentHasher.hash(text));
        }
    }
}
