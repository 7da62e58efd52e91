package com.commandlab.engine.api.dto;

/** Response body for POST /snapshots/{id}/restore. */
public record RestoreResponse(String snapshotId, int documentsRestored) {}
