package com.commandlab.engine.execution;

/**
 * Thrown inside the executor when an attempt has to stop early.
 *
 * Never escapes {@link CommandExecutor#execute}: the executor turns it
 * into a failed {@link ExecutionResult} whose error code is the
 * {@link Kind}.
 */
public class CommandExecutionException extends RuntimeException {

    public enum Kind {
        VALIDATION_FAILED,
        CONFIRMATION_REQUIRED,
        PRECONDITION_FAILED,
        CONCURRENT_EXECUTION,
        SNAPSHOT_FAILED,
        MONITORING_FAILED,
        TIMEOUT,
        INVOCATION_FAILED
    }

    private final Kind kind;

    public CommandExecutionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CommandExecutionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
