package com.commandlab.engine.host;

import java.time.Instant;

public record FileStat(long size, Instant lastModified, Kind kind) {

    public enum Kind { FILE, DIRECTORY, SYMLINK }

    public boolean isDirectory() {
        return kind == Kind.DIRECTORY;
    }
}
