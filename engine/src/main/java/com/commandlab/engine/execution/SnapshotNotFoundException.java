package com.commandlab.engine.execution;

public class SnapshotNotFoundException extends RuntimeException {
    public SnapshotNotFoundException(String snapshotId) {
        super("Snapshot not found: '" + snapshotId + "'");
    }
}
