package com.commandlab.engine.capture;

import java.util.Map;

public record TestSession(
        String              sessionId,
        String              hostVersion,
        WorkspaceInfo       workspace,
        Map<String, String> environment,
        TestConfiguration   configuration) {}
