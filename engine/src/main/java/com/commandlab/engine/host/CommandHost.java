package com.commandlab.engine.host;

import java.util.List;

/**
 * The host's command dispatch surface.
 *
 * Implementations may block, throw, or never return; callers that need a
 * bound on any of those must provide it themselves.
 */
public interface CommandHost {

    Object invokeCommand(String commandId, List<Object> args);
}
