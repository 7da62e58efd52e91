package com.commandlab.engine.capture;

import java.util.Map;

/**
 * Workspace and editor state at capture time.
 *
 * @param name       file name of the first root, null when no workspace is open
 * @param activeFile null when no document is active
 */
public record WorkspaceInfo(
        String              name,
        String              rootPath,
        int                 folderCount,
        int                 openFileCount,
        ActiveFile          activeFile,
        Map<String, Object> relevantSettings) {

    public record ActiveFile(String uri, String language, int lineCount) {}
}
