package com.commandlab.engine.detection;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Glob-based exclusion of workspace paths.
 *
 * Patterns are matched against the root-relative path with a leading
 * '/', so {@code **}{@code /node_modules/**} also matches a top-level
 * {@code node_modules}. A directory is excluded when a file directly
 * inside it would be.
 */
public class ExclusionMatcher {

    private final List<PathMatcher> matchers;

    public ExclusionMatcher(List<String> globs) {
        this.matchers = globs.stream()
                .map(g -> FileSystems.getDefault().getPathMatcher("glob:" + g))
                .toList();
    }

    public boolean isExcluded(Path root, Path path, boolean directory) {
        if (!path.startsWith(root) || path.equals(root)) {
            return false;
        }
        String relative = "/" + root.relativize(path).toString().replace('\\', '/');
        if (matches(relative)) {
            return true;
        }
        return directory && matches(relative + "/_");
    }

    private boolean matches(String relative) {
        Path candidate = Path.of(relative);
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(candidate)) {
                return true;
            }
        }
        return false;
    }
}
