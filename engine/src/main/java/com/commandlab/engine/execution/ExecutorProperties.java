package com.commandlab.engine.execution;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binds {@code commandlab.executor.*}.
 *
 * {@code timeoutGrace} is how long a timed-out invocation may keep running
 * before monitoring stops, so its late side effects are still observed.
 */
@Component
@ConfigurationProperties(prefix = "commandlab.executor")
public class ExecutorProperties {

    private Duration defaultTimeout = Duration.ofSeconds(30);
    private Duration timeoutGrace = Duration.ofMillis(250);

    public Duration getDefaultTimeout() { return defaultTimeout; }
    public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
    public Duration getTimeoutGrace() { return timeoutGrace; }
    public void setTimeoutGrace(Duration timeoutGrace) { this.timeoutGrace = timeoutGrace; }
}
