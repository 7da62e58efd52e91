package com.commandlab.engine.host;

import java.util.List;
import java.util.Optional;

/**
 * Editor state exposed by the host: settings, open documents and views.
 */
public interface EditorHost {

    String hostVersion();

    /** Empty when the key is unknown or not readable. */
    Optional<Object> getSetting(String key);

    List<DocumentInfo> getOpenDocuments();

    Optional<String> getActiveDocument();

    Optional<Selection> getActiveSelection();

    List<EditorInfo> getVisibleEditors();

    /** @throws IllegalArgumentException if the document is not open */
    String getDocumentText(String uri);

    /** Replaces the whole buffer; opens the document first if needed. */
    void replaceDocumentText(String uri, String text);

    /** Makes {@code uri} the active document and applies the selection. */
    void showDocument(String uri, Selection selection);
}
