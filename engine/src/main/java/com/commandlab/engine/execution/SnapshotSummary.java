package com.commandlab.engine.execution;

import java.time.Instant;

public record SnapshotSummary(String id, Instant timestamp, int fileCount, int documentCount) {}
