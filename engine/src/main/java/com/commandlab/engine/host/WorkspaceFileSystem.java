package com.commandlab.engine.host;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Read access to the files of the open workspace.
 *
 * An empty {@link #listWorkspaceRoots()} means no workspace is open.
 */
public interface WorkspaceFileSystem {

    List<Path> listWorkspaceRoots();

    FileStat statFile(Path path) throws IOException;

    String readFileText(Path path) throws IOException;

    /** Direct children of {@code directory}, in no particular order. */
    List<Path> listDirectory(Path directory) throws IOException;

    boolean exists(Path path);
}
