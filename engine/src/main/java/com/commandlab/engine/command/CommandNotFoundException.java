package com.commandlab.engine.command;

public class CommandNotFoundException extends RuntimeException {
    public CommandNotFoundException(String commandId) {
        super("Command not found: '" + commandId + "'");
    }
}
