package com.commandlab.engine.command;

/**
 * Declared danger of a command, set by whoever registers it.
 */
public enum RiskTier {
    /** Read-only; no workspace or setting changes expected. */
    SAFE,
    /** Changes state that can be reverted by hand (file edits, settings). */
    MODERATE,
    /** Removes data or otherwise cannot be undone; needs explicit confirmation. */
    DESTRUCTIVE
}
