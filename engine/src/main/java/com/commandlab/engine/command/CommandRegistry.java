package com.commandlab.engine.command;

import com.commandlab.engine.host.CommandHost;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process command registry and the {@link CommandHost} of the local host.
 *
 * All {@link HostCommand} beans are collected at startup via constructor
 * injection. Every invocation is timed and counted:
 * <pre>
 *   commandlab.command.calls{command, status="success|error"}
 *   commandlab.command.duration{command, tier="safe|moderate|destructive"}
 * </pre>
 * Exceptions thrown by a command propagate unchanged.
 */
@Component
public class CommandRegistry implements CommandHost {

    private static final Logger log = LoggerFactory.getLogger(CommandRegistry.class);

    private final Map<String, HostCommand> commands = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public CommandRegistry(List<HostCommand> allCommands, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (HostCommand command : allCommands) {
            CommandDescriptor d = command.descriptor();
            HostCommand previous = commands.put(d.id(), command);
            if (previous != null) {
                throw new IllegalStateException("Duplicate command id: " + d.id());
            }
            log.info("Registered command '{}' [{}] params={}",
                    d.id(), d.riskTier(), d.hasSignature() ? d.signature().size() : "n/a");
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public HostCommand get(String commandId) {
        HostCommand command = commands.get(commandId);
        if (command == null) {
            throw new CommandNotFoundException(commandId);
        }
        return command;
    }

    public Optional<CommandDescriptor> find(String commandId) {
        return Optional.ofNullable(commands.get(commandId)).map(HostCommand::descriptor);
    }

    /** All registered descriptors, sorted by id. */
    public List<CommandDescriptor> descriptors() {
        return commands.values().stream()
                .map(HostCommand::descriptor)
                .sorted(Comparator.comparing(CommandDescriptor::id))
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented dispatch
    // ------------------------------------------------------------------

    @Override
    public Object invokeCommand(String commandId, List<Object> args) {
        HostCommand command = get(commandId);
        String tierTag = command.descriptor().riskTier().name().toLowerCase();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return command.execute(args);
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("commandlab.command.duration",
                    "command", commandId, "tier", tierTag));
            meterRegistry.counter("commandlab.command.calls",
                    "command", commandId, "status", status).increment();
        }
    }
}
