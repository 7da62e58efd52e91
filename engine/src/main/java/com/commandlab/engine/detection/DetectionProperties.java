package com.commandlab.engine.detection;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds {@code commandlab.detection.*}.
 */
@Component
@ConfigurationProperties(prefix = "commandlab.detection")
public class DetectionProperties {

    private List<String> excludePatterns = new ArrayList<>(List.of(
            "**/node_modules/**", "**/.git/**", "**/dist/**", "**/build/**",
            "**/target/**", "**/*.log", "**/tmp/**"));
    private List<String> watchedSettings = new ArrayList<>(List.of(
            "editor.fontSize", "editor.tabSize", "files.autoSave",
            "workbench.colorTheme", "terminal.integrated.shell"));
    private List<String> textExtensions = new ArrayList<>(List.of(
            ".txt", ".md", ".js", ".ts", ".json", ".html", ".css", ".scss",
            ".py", ".java", ".cpp", ".c", ".h", ".xml", ".yaml", ".yml",
            ".sh", ".bat", ".ps1", ".sql", ".php", ".rb", ".go", ".rs"));
    private int maxSideEffects = 1000;
    private int maxDepth = 10;
    private long textSizeLimitBytes = 1024 * 1024;

    public List<String> getExcludePatterns() { return excludePatterns; }
    public void setExcludePatterns(List<String> excludePatterns) { this.excludePatterns = excludePatterns; }
    public List<String> getWatchedSettings() { return watchedSettings; }
    public void setWatchedSettings(List<String> watchedSettings) { this.watchedSettings = watchedSettings; }
    public List<String> getTextExtensions() { return textExtensions; }
    public void setTextExtensions(List<String> textExtensions) { this.textExtensions = textExtensions; }
    public int getMaxSideEffects() { return maxSideEffects; }
    public void setMaxSideEffects(int maxSideEffects) { this.maxSideEffects = maxSideEffects; }
    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
    public long getTextSizeLimitBytes() { return textSizeLimitBytes; }
    public void setTextSizeLimitBytes(long textSizeLimitBytes) { this.textSizeLimitBytes = textSizeLimitBytes; }
}
