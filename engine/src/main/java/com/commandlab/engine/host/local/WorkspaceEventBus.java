package com.commandlab.engine.host.local;

import com.commandlab.engine.host.DocumentInfo;
import com.commandlab.engine.host.EditorInfo;
import com.commandlab.engine.host.HostEvents;
import com.commandlab.engine.host.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub implementation of {@link HostEvents}.
 * <p>
 * Built-in commands and the in-memory editor publish here; the side-effect
 * detector subscribes. Thread-safe for concurrent publish and subscribe.
 */
public class WorkspaceEventBus implements HostEvents {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceEventBus.class);

    private final Topic<Path>             fileCreated    = new Topic<>("fileCreated");
    private final Topic<Path>             fileChanged    = new Topic<>("fileChanged");
    private final Topic<Path>             fileDeleted    = new Topic<>("fileDeleted");
    private final Topic<DocumentInfo>     docOpened      = new Topic<>("documentOpened");
    private final Topic<DocumentInfo>     docClosed      = new Topic<>("documentClosed");
    private final Topic<String>           activeChanged  = new Topic<>("activeDocumentChanged");
    private final Topic<List<EditorInfo>> visibleChanged = new Topic<>("visibleEditorsChanged");
    private final Topic<String>           settingChanged = new Topic<>("settingChanged");

    // ------------------------------------------------------------------
    // Subscribe
    // ------------------------------------------------------------------

    @Override public Subscription onFileCreated(Consumer<Path> l)                     { return fileCreated.subscribe(l); }
    @Override public Subscription onFileChanged(Consumer<Path> l)                     { return fileChanged.subscribe(l); }
    @Override public Subscription onFileDeleted(Consumer<Path> l)                     { return fileDeleted.subscribe(l); }
    @Override public Subscription onDocumentOpened(Consumer<DocumentInfo> l)          { return docOpened.subscribe(l); }
    @Override public Subscription onDocumentClosed(Consumer<DocumentInfo> l)          { return docClosed.subscribe(l); }
    @Override public Subscription onActiveDocumentChanged(Consumer<String> l)         { return activeChanged.subscribe(l); }
    @Override public Subscription onVisibleEditorsChanged(Consumer<List<EditorInfo>> l) { return visibleChanged.subscribe(l); }
    @Override public Subscription onSettingChanged(Consumer<String> l)                { return settingChanged.subscribe(l); }

    // ------------------------------------------------------------------
    // Publish
    // ------------------------------------------------------------------

    public void publishFileCreated(Path path)                   { fileCreated.publish(path); }
    public void publishFileChanged(Path path)                   { fileChanged.publish(path); }
    public void publishFileDeleted(Path path)                   { fileDeleted.publish(path); }
    public void publishDocumentOpened(DocumentInfo doc)         { docOpened.publish(doc); }
    public void publishDocumentClosed(DocumentInfo doc)         { docClosed.publish(doc); }
    public void publishActiveDocumentChanged(String uri)        { activeChanged.publish(uri); }
    public void publishVisibleEditorsChanged(List<EditorInfo> e) { visibleChanged.publish(e); }
    public void publishSettingChanged(String key)               { settingChanged.publish(key); }

    /** Total live listeners across every stream. */
    public int subscriberCount() {
        return fileCreated.size() + fileChanged.size() + fileDeleted.size()
                + docOpened.size() + docClosed.size() + activeChanged.size()
                + visibleChanged.size() + settingChanged.size();
    }

    private static final class Topic<T> {

        private final String name;
        private final CopyOnWriteArrayList<Consumer<T>> listeners = new CopyOnWriteArrayList<>();

        Topic(String name) {
            this.name = name;
        }

        Subscription subscribe(Consumer<T> listener) {
            listeners.add(listener);
            log.debug("Subscribed to {}", name);
            return () -> listeners.remove(listener);
        }

        void publish(T payload) {
            log.debug("Publishing {}: {}", name, payload);
            for (Consumer<T> listener : listeners) {
                try {
                    listener.accept(payload);
                } catch (Exception e) {
                    log.warn("Listener threw exception processing {}: {}", name, e.getMessage(), e);
                }
            }
        }

        int size() {
            return listeners.size();
        }
    }
}
