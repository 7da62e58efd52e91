package com.commandlab.engine.api;

import com.commandlab.engine.api.dto.ExecuteRequest;
import com.commandlab.engine.api.dto.ExecutionResponse;
import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.command.CommandRegistry;
import com.commandlab.engine.execution.CommandExecutor;
import com.commandlab.engine.execution.ExecutionContext;
import com.commandlab.engine.execution.ExecutionResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.util.Map;

/**
 * Runs commands through the safe executor.
 *
 * POST /executions       - execute one command; failures come back as a
 *                          200 response with {@code success=false}
 * GET  /executions/state - current executor phase
 */
@RestController
@RequestMapping("/executions")
public class ExecutionController {

    private final CommandRegistry registry;
    private final CommandExecutor executor;

    public ExecutionController(CommandRegistry registry, CommandExecutor executor) {
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/executions \
     *     -H "Content-Type: application/json" \
     *     -d '{"commandId":"workspace.writeFile","parameters":{"path":"notes.txt","content":"hi"}}'
     */
    @PostMapping
    public ExecutionResponse execute(@RequestBody ExecuteRequest req) {
        if (req.commandId() == null || req.commandId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "commandId is required");
        }
        CommandDescriptor descriptor = registry.find(req.commandId()).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Command not found: " + req.commandId()));

        Duration timeout = req.timeoutMs() != null && req.timeoutMs() > 0
                ? Duration.ofMillis(req.timeoutMs()) : null;
        ExecutionContext context = new ExecutionContext(descriptor, req.parameters(), timeout,
                req.createSnapshot(), req.confirmed(), req.context());

        ExecutionResult result = executor.execute(context, req.capture(), req.notes());
        return ExecutionResponse.from(result);
    }

    @GetMapping("/state")
    public Map<String, String> state() {
        return Map.of("state", executor.currentState().name());
    }
}
