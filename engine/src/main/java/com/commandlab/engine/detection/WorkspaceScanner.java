package com.commandlab.engine.detection;

import com.commandlab.engine.host.FileStat;
import com.commandlab.engine.host.WorkspaceFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Walks the workspace roots and records every regular file that is not
 * excluded.
 * <p>
 * Recursion stops {@code maxDepth} levels below each root. Text files under
 * the size limit are read once for a line count and content hash. Entries
 * that cannot be stat'ed are skipped; unreadable directories are logged and
 * skipped without failing the scan.
 */
public class WorkspaceScanner {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceScanner.class);

    private final WorkspaceFileSystem fileSystem;
    private final ExclusionMatcher    exclusions;
    private final Set<String>         textExtensions;
    private final int                 maxDepth;
    private final long                textSizeLimit;

    public WorkspaceScanner(WorkspaceFileSystem fileSystem, DetectionProperties props) {
        this.fileSystem     = fileSystem;
        this.exclusions     = new ExclusionMatcher(props.getExcludePatterns());
        this.textExtensions = Set.copyOf(props.getTextExtensions().stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .toList());
        this.maxDepth       = props.getMaxDepth();
        this.textSizeLimit  = props.getTextSizeLimitBytes();
    }

    public record ScanResult(Map<String, FileInfo> files, Set<String> directories) {}

    public ScanResult scan() {
        Map<String, FileInfo> files = new HashMap<>();
        Set<String> directories = new HashSet<>();
        for (Path root : fileSystem.listWorkspaceRoots()) {
            scanDirectory(root, root, 1, files, directories);
        }
        return new ScanResult(files, directories);
    }

    /** Stat and fingerprint a single file, or null when it cannot be stat'ed. */
    public FileInfo describe(Path file) {
        FileStat stat;
        try {
            stat = fileSystem.statFile(file);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return null;
        }
        if (stat.kind() != FileStat.Kind.FILE) {
            return null;
        }
        String hash = null;
        Integer lines = null;
        boolean readable = true;
        if (isTextFile(file) && stat.size() < textSizeLimit) {
            try {
                String content = fileSystem.readFileText(file);
                hash  = ContentHasher.hash(content);
                lines = ContentHasher.lineCount(content);
            } catch (IOException e) {
                readable = false;
            }
        }
        return new FileInfo(file.toString(), stat.size(), stat.lastModified(), hash, lines, readable);
    }

    public boolean isExcluded(Path path, boolean directory) {
        for (Path root : fileSystem.listWorkspaceRoots()) {
            if (path.startsWith(root)) {
                return exclusions.isExcluded(root, path, directory);
            }
        }
        return false;
    }

    private void scanDirectory(Path root, Path dir, int depth,
                               Map<String, FileInfo> files, Set<String> directories) {
        List<Path> children;
        try {
            children = fileSystem.listDirectory(dir);
        } catch (IOException e) {
            log.warn("Failed to read directory {}: {}", dir, e.getMessage());
            return;
        }
        for (Path child : children) {
            FileStat stat;
            try {
                stat = fileSystem.statFile(child);
            } catch (IOException e) {
                log.debug("Skipping {}: {}", child, e.getMessage());
                continue;
            }
            boolean isDir = stat.isDirectory();
            if (exclusions.isExcluded(root, child, isDir)) {
                continue;
            }
            if (isDir) {
                directories.add(child.toString());
                if (depth < maxDepth) {
                    scanDirectory(root, child, depth + 1, files, directories);
                }
            } else if (stat.kind() == FileStat.Kind.FILE) {
                FileInfo info = describe(child);
                if (info != null) {
                    files.put(info.path(), info);
                }
            }
        }
    }

    private boolean isTextFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && textExtensions.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }
}
