package com.commandlab.engine.command.builtin;

import com.commandlab.engine.command.*;
import com.commandlab.engine.host.local.WorkspaceEventBus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Write content to a workspace file, creating parent directories as needed. */
@Component
public class WriteFileCommand implements HostCommand {

    private static final CommandDescriptor DESCRIPTOR = new CommandDescriptor(
            "workspace.writeFile", "workspace", "file", "Write File",
            "Write text to a workspace file (creates parent directories).",
            RiskTier.MODERATE,
            List.of(ContextRequirement.OPEN_WORKSPACE),
            List.of(ParameterSpec.required("path", ParameterType.URI),
                    ParameterSpec.required("content", ParameterType.STRING)));

    private final WorkspacePaths    paths;
    private final WorkspaceEventBus events;

    public WriteFileCommand(WorkspacePaths paths, WorkspaceEventBus events) {
        this.paths  = paths;
        this.events = events;
    }

    @Override public CommandDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(List<Object> args) {
        Path file = paths.resolve(WorkspacePaths.arg(args, 0));
        Object content = WorkspacePaths.arg(args, 1);
        String text = content == null ? "" : content.toString();

        boolean existed = Files.exists(file);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, text);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + paths.relative(file), e);
        }
        if (existed) {
            events.publishFileChanged(file);
        } else {
            events.publishFileCreated(file);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("path", paths.relative(file));
        result.put("bytes", text.getBytes(StandardCharsets.UTF_8).length);
        result.put("created", !existed);
        return result;
    }
}
