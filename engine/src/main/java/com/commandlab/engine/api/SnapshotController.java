package com.commandlab.engine.api;

import com.commandlab.engine.api.dto.RestoreResponse;
import com.commandlab.engine.execution.CommandExecutionException;
import com.commandlab.engine.execution.CommandExecutor;
import com.commandlab.engine.execution.SnapshotNotFoundException;
import com.commandlab.engine.execution.SnapshotSummary;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Workspace snapshots kept by the executor.
 *
 * POST   /snapshots              - take a snapshot now (201)
 * GET    /snapshots              - list kept snapshots, oldest first
 * POST   /snapshots/{id}/restore - replay captured document contents
 * DELETE /snapshots/{id}         - drop one snapshot (204, or 404)
 * DELETE /snapshots              - drop all snapshots (204)
 */
@RestController
@RequestMapping("/snapshots")
public class SnapshotController {

    private final CommandExecutor executor;

    public SnapshotController(CommandExecutor executor) {
        this.executor = executor;
    }

    @PostMapping
    public ResponseEntity<Map<String, String>> create() {
        try {
            String id = executor.createSnapshot();
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("snapshotId", id));
        } catch (CommandExecutionException e) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }
    }

    @GetMapping
    public List<SnapshotSummary> list() {
        return executor.listSnapshots();
    }

    /**
     * Only document contents and the active editor are restored; files
     * created or deleted since the snapshot stay as they are.
     */
    @PostMapping("/{id}/restore")
    public RestoreResponse restore(@PathVariable String id) {
        try {
            return new RestoreResponse(id, executor.restoreSnapshot(id));
        } catch (SnapshotNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        if (!executor.deleteSnapshot(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Snapshot not found: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        executor.clearAllSnapshots();
        return ResponseEntity.noContent().build();
    }
}
