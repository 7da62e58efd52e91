package com.commandlab.engine.command;

/** Host state a command needs before it can be invoked. */
public enum ContextRequirement {

    OPEN_WORKSPACE("Open workspace"),
    ACTIVE_EDITOR("Active file editor");

    private final String label;

    ContextRequirement(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
