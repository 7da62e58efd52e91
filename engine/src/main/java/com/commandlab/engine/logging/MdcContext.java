package com.commandlab.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * MDC keys for execution attempts, so every log line of an attempt carries
 * the command and attempt ids.
 */
public final class MdcContext {

    public static final String COMMAND_ID = "commandId";
    public static final String ATTEMPT_ID = "attemptId";

    private MdcContext() {}

    public static void setAttempt(String commandId, String attemptId) {
        MDC.put(COMMAND_ID, commandId);
        MDC.put(ATTEMPT_ID, attemptId);
    }

    public static void clear() {
        MDC.remove(COMMAND_ID);
        MDC.remove(ATTEMPT_ID);
    }

    /** Wrap a task so it runs with the caller's MDC on another thread. */
    public static <T> Supplier<T> propagate(Supplier<T> task) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return task.get();
            } finally {
                MDC.clear();
            }
        };
    }
}
