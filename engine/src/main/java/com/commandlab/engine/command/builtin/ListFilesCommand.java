package com.commandlab.engine.command.builtin;

import com.commandlab.engine.command.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Lists regular files below a workspace directory (the root by default),
 * skipping VCS and dependency folders.
 */
@Component
public class ListFilesCommand implements HostCommand {

    private static final Set<String> IGNORE_DIRS = Set.of(".git", "node_modules", "target", "build", "dist");
    private static final int MAX_RESULTS = 1000;

    private static final CommandDescriptor DESCRIPTOR = new CommandDescriptor(
            "workspace.listFiles", "workspace", "file", "List Files",
            "List workspace-relative paths of files below a directory.",
            RiskTier.SAFE,
            List.of(ContextRequirement.OPEN_WORKSPACE),
            List.of(ParameterSpec.optional("path", ParameterType.parse("uri|string"))));

    private final WorkspacePaths paths;

    public ListFilesCommand(WorkspacePaths paths) {
        this.paths = paths;
    }

    @Override public CommandDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public Object execute(List<Object> args) {
        Object arg = WorkspacePaths.arg(args, 0);
        Path dir = arg == null ? paths.primaryRoot() : paths.resolve(arg);
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Directory not found: " + paths.relative(dir));
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(dir.relativize(p)))
                    .map(paths::relative)
                    .sorted()
                    .limit(MAX_RESULTS)
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + paths.relative(dir), e);
        }
    }

    private static boolean isIgnored(Path relative) {
        for (Path part : relative) {
            if (IGNORE_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
