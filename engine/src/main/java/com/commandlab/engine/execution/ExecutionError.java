package com.commandlab.engine.execution;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Structured failure of an attempt.
 *
 * @param type        simple class name of the underlying exception
 * @param recoverable whether a retry (maybe with other parameters) may succeed
 * @param stackTrace  top frames of the underlying exception, may be null
 */
public record ExecutionError(
        String                         message,
        String                         type,
        CommandExecutionException.Kind code,
        boolean                        recoverable,
        String                         stackTrace) {

    private static final Pattern RECOVERABLE = Pattern.compile(
            "timeout|cancelled|not found|permission denied|invalid parameter");

    private static final int MAX_FRAMES = 8;

    public static ExecutionError from(CommandExecutionException.Kind code, Throwable error) {
        Throwable cause = error instanceof CommandExecutionException && error.getCause() != null
                ? error.getCause() : error;
        String message = error.getMessage() != null ? error.getMessage() : cause.getClass().getSimpleName();
        return new ExecutionError(message, cause.getClass().getSimpleName(), code,
                isRecoverable(message), topFrames(cause));
    }

    static boolean isRecoverable(String message) {
        return message != null && RECOVERABLE.matcher(message.toLowerCase(Locale.ROOT)).find();
    }

    private static String topFrames(Throwable t) {
        StackTraceElement[] frames = t.getStackTrace();
        if (frames.length == 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(frames.length, MAX_FRAMES); i++) {
            sb.append("at ").append(frames[i]).append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
