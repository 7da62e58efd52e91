package com.commandlab.engine.command;

import java.util.List;

/**
 * A command the local host can dispatch.
 *
 * Implementations declared as Spring {@code @Component}s are collected by
 * {@link CommandRegistry} at startup.
 */
public interface HostCommand {

    CommandDescriptor descriptor();

    /**
     * Run the command with positional arguments in signature order.
     * Arguments arrive already coerced; trailing optional arguments may be
     * missing and inner optional ones null.
     */
    Object execute(List<Object> args);
}
