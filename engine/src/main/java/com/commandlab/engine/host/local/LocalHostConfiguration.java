package com.commandlab.engine.host.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the in-process host: local file system, event bus and editor.
 */
@Configuration
public class LocalHostConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LocalHostConfiguration.class);

    @Bean
    public WorkspaceEventBus workspaceEventBus() {
        return new WorkspaceEventBus();
    }

    @Bean
    public LocalWorkspaceFileSystem workspaceFileSystem(WorkspaceProperties props) {
        List<Path> roots = new ArrayList<>();
        for (String root : props.getRoots()) {
            Path path = Path.of(root).toAbsolutePath().normalize();
            if (!Files.isDirectory(path)) {
                if (!props.isCreateMissing()) {
                    log.warn("Workspace root {} does not exist, skipping", path);
                    continue;
                }
                try {
                    Files.createDirectories(path);
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot create workspace root " + path, e);
                }
            }
            roots.add(path);
        }
        log.info("Workspace roots: {}", roots);
        return new LocalWorkspaceFileSystem(roots);
    }

    @Bean
    public InMemoryEditorHost editorHost(WorkspaceEventBus events, WorkspaceProperties props) {
        return new InMemoryEditorHost(events, props.getHostVersion(), props.getSettings());
    }
}
