package com.commandlab.engine.host.local;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binds {@code commandlab.workspace.*}: the directories the local host
 * exposes as workspace roots and the initial editor settings.
 */
@Component
@ConfigurationProperties(prefix = "commandlab.workspace")
public class WorkspaceProperties {

    private List<String> roots = new ArrayList<>();
    private boolean createMissing = true;
    private String hostVersion = "commandlab-local/0.1.0";
    private Map<String, Object> settings = new LinkedHashMap<>();

    public List<String> getRoots() { return roots; }
    public void setRoots(List<String> roots) { this.roots = roots; }
    public boolean isCreateMissing() { return createMissing; }
    public void setCreateMissing(boolean createMissing) { this.createMissing = createMissing; }
    public String getHostVersion() { return hostVersion; }
    public void setHostVersion(String hostVersion) { this.hostVersion = hostVersion; }
    public Map<String, Object> getSettings() { return settings; }
    public void setSettings(Map<String, Object> settings) { this.settings = settings; }
}
