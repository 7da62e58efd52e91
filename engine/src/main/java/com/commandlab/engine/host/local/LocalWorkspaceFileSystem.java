package com.commandlab.engine.host.local;

import com.commandlab.engine.host.FileStat;
import com.commandlab.engine.host.WorkspaceFileSystem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.stream.Stream;

/**
 * {@link WorkspaceFileSystem} over the local disk.
 * Roots are fixed at construction and normalised to absolute paths.
 */
public class LocalWorkspaceFileSystem implements WorkspaceFileSystem {

    private final List<Path> roots;

    public LocalWorkspaceFileSystem(List<Path> roots) {
        this.roots = roots.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .toList();
    }

    @Override
    public List<Path> listWorkspaceRoots() {
        return roots;
    }

    @Override
    public FileStat statFile(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(
                path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        FileStat.Kind kind = attrs.isSymbolicLink() ? FileStat.Kind.SYMLINK
                : attrs.isDirectory() ? FileStat.Kind.DIRECTORY
                : FileStat.Kind.FILE;
        return new FileStat(attrs.size(), attrs.lastModifiedTime().toInstant(), kind);
    }

    @Override
    public String readFileText(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public List<Path> listDirectory(Path directory) throws IOException {
        try (Stream<Path> children = Files.list(directory)) {
            return children.toList();
        }
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }
}
