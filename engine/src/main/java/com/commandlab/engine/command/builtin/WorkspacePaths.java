package com.commandlab.engine.command.builtin;

import com.commandlab.engine.host.WorkspaceFileSystem;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * Resolves command path arguments against the workspace roots.
 *
 * Accepts a {@code file:} URI, a {@link Path} or a string. Relative paths
 * resolve against the first root; anything that ends up outside every
 * root is rejected.
 */
@Component
public class WorkspacePaths {

    private final WorkspaceFileSystem fileSystem;

    public WorkspacePaths(WorkspaceFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    public Path primaryRoot() {
        List<Path> roots = fileSystem.listWorkspaceRoots();
        if (roots.isEmpty()) {
            throw new IllegalStateException("No workspace is open");
        }
        return roots.get(0);
    }

    public Path resolve(Object arg) {
        if (arg == null) {
            throw new IllegalArgumentException("invalid parameter: path is required");
        }
        Path path;
        if (arg instanceof URI uri) {
            if (!"file".equalsIgnoreCase(uri.getScheme())) {
                throw new IllegalArgumentException(
                        "invalid parameter: unsupported URI scheme '" + uri.getScheme() + "'");
            }
            path = Path.of(uri);
        } else if (arg instanceof Path p) {
            path = p;
        } else {
            path = Path.of(arg.toString());
        }
        Path resolved = (path.isAbsolute() ? path : primaryRoot().resolve(path)).normalize();
        for (Path root : fileSystem.listWorkspaceRoots()) {
            if (resolved.startsWith(root)) {
                return resolved;
            }
        }
        throw new IllegalArgumentException("invalid parameter: path escapes the workspace: " + arg);
    }

    /** Workspace-relative form with '/' separators, for results. */
    public String relative(Path path) {
        for (Path root : fileSystem.listWorkspaceRoots()) {
            if (path.startsWith(root)) {
                return root.relativize(path).toString().replace('\\', '/');
            }
        }
        return path.toString();
    }

    static Object arg(List<Object> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }
}
