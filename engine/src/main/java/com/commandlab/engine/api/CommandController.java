package com.commandlab.engine.api;

import com.commandlab.engine.api.dto.ValidateRequest;
import com.commandlab.engine.command.CommandDescriptor;
import com.commandlab.engine.command.CommandRegistry;
import com.commandlab.engine.validation.ParameterValidator;
import com.commandlab.engine.validation.ValidationOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Read-only catalogue of host commands plus dry-run validation.
 *
 * GET  /commands               - all descriptors, sorted by id
 * GET  /commands/{id}          - one descriptor
 * POST /commands/{id}/validate - validate parameters without executing
 */
@RestController
@RequestMapping("/commands")
public class CommandController {

    private final CommandRegistry    registry;
    private final ParameterValidator validator;

    public CommandController(CommandRegistry registry, ParameterValidator validator) {
        this.registry  = registry;
        this.validator = validator;
    }

    @GetMapping
    public List<CommandDescriptor> list() {
        return registry.descriptors();
    }

    @GetMapping("/{id}")
    public CommandDescriptor get(@PathVariable String id) {
        return find(id);
    }

    /**
     * A command without a declared signature always validates, with its
     * parameters passed through unchanged.
     */
    @PostMapping("/{id}/validate")
    public ValidationOutcome validate(@PathVariable String id, @RequestBody ValidateRequest req) {
        CommandDescriptor descriptor = find(id);
        if (!descriptor.hasSignature()) {
            return new ValidationOutcome(true, List.of(), List.of(), req.parameters());
        }
        return validator.validate(descriptor.signature(), req.parameters());
    }

    private CommandDescriptor find(String id) {
        return registry.find(id).orElseThrow(() -> new ResponseStatusException(
                HttpStatus.NOT_FOUND, "Command not found: " + id));
    }
}
