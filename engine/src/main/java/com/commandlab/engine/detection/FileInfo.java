package com.commandlab.engine.detection;

import java.time.Instant;

/**
 * Snapshot entry for a regular file. {@code contentHash} and
 * {@code lineCount} are only set for readable text files under the size
 * limit.
 */
public record FileInfo(
        String  path,
        long    size,
        Instant lastModified,
        String  contentHash,
        Integer lineCount,
        boolean readable) {}
