package com.commandlab.engine.command.builtin;

import com.commandlab.engine.command.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class ReadFileCommand implements HostCommand {

    private static final CommandDescriptor DESCRIPTOR = new CommandDescriptor(
            "workspace.readFile", "workspace", "file", "Read File",
            "Return the text content of a workspace file.",
            RiskTier.SAFE,
            List.of(ContextRequirement.OPEN_WORKSPACE),
            List.of(ParameterSpec.required("path", ParameterType.URI)));

    private final WorkspacePaths paths;

    public ReadFileCommand(WorkspacePaths paths) {
        this.paths = paths;
    }

    @Override public CommandDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(List<Object> args) {
        Path file = paths.resolve(WorkspacePaths.arg(args, 0));
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File not found: " + paths.relative(file));
        }
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + paths.relative(file), e);
        }
    }
}
