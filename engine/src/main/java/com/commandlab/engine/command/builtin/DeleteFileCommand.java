package com.commandlab.engine.command.builtin;

import com.commandlab.engine.command.*;
import com.commandlab.engine.host.local.WorkspaceEventBus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
public class DeleteFileCommand implements HostCommand {

    private static final CommandDescriptor DESCRIPTOR = new CommandDescriptor(
            "workspace.deleteFile", "workspace", "file", "Delete File",
            "Permanently delete a workspace file.",
            RiskTier.DESTRUCTIVE,
            List.of(ContextRequirement.OPEN_WORKSPACE),
            List.of(ParameterSpec.required("path", ParameterType.URI)));

    private final WorkspacePaths    paths;
    private final WorkspaceEventBus events;

    public DeleteFileCommand(WorkspacePaths paths, WorkspaceEventBus events) {
        this.paths  = paths;
        this.events = events;
    }

    @Override public CommandDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(List<Object> args) {
        Path file = paths.resolve(WorkspacePaths.arg(args, 0));
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File not found: " + paths.relative(file));
        }
        try {
            Files.delete(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + paths.relative(file), e);
        }
        events.publishFileDeleted(file);
        return Map.of("path", paths.relative(file), "deleted", true);
    }
}
