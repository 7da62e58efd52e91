package com.commandlab.engine.host;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Live event streams emitted by the host.
 *
 * Every registration returns its own {@link Subscription}; listeners are
 * invoked on the publishing thread.
 */
public interface HostEvents {

    Subscription onFileCreated(Consumer<Path> listener);

    Subscription onFileChanged(Consumer<Path> listener);

    Subscription onFileDeleted(Consumer<Path> listener);

    Subscription onDocumentOpened(Consumer<DocumentInfo> listener);

    Subscription onDocumentClosed(Consumer<DocumentInfo> listener);

    /** Receives the URI of the new active document, or null when none is active. */
    Subscription onActiveDocumentChanged(Consumer<String> listener);

    Subscription onVisibleEditorsChanged(Consumer<List<EditorInfo>> listener);

    /** Receives the key of the setting that changed. */
    Subscription onSettingChanged(Consumer<String> listener);
}
