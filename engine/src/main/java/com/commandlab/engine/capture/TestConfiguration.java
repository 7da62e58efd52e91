package com.commandlab.engine.capture;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** How an attempt was configured, recorded with its result. */
public record TestConfiguration(
        long                timeoutMs,
        boolean             snapshotEnabled,
        boolean             confirmationRequired,
        MonitoringLevel     monitoringLevel,
        Map<String, Object> options) {

    public TestConfiguration {
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
