package com.linlay.capability.catalog;

import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Search roots for one resource kind, highest priority first: project directory, the
 * project's {@code .claude} directory, then the user's home {@code .claude} directory.
 */
public abstract class ResourceCatalogProperties {

    private String externalDir;
    private String projectClaudeDir;
    private String userDir;
    private boolean includeUserDir = true;
    private boolean discoverOnStartup = true;

    protected ResourceCatalogProperties(String dirName) {
        this.externalDir = dirName;
        this.projectClaudeDir = ".claude/" + dirName;
        this.userDir = Path.of(System.getProperty("user.home", ""), ".claude", dirName).toString();
    }

    public List<SearchRoot> searchRoots() {
        List<SearchRoot> roots = new ArrayList<>();
        if (StringUtils.hasText(externalDir)) {
            roots.add(new SearchRoot(Path.of(externalDir), SourceType.PROJECT));
        }
        if (StringUtils.hasText(projectClaudeDir)) {
            roots.add(new SearchRoot(Path.of(projectClaudeDir), SourceType.PROJECT_CLAUDE));
        }
        if (includeUserDir && StringUtils.hasText(userDir)) {
            roots.add(new SearchRoot(Path.of(userDir), SourceType.USER));
        }
        return roots;
    }

    public String getExternalDir() {
        return externalDir;
    }

    public void setExternalDir(String externalDir) {
        this.externalDir = externalDir;
    }

    public String getProjectClaudeDir() {
        return projectClaudeDir;
    }

    public void setProjectClaudeDir(String projectClaudeDir) {
        this.projectClaudeDir = projectClaudeDir;
    }

    public String getUserDir() {
        return userDir;
    }

    public void setUserDir(String userDir) {
        this.userDir = userDir;
    }

    public boolean isIncludeUserDir() {
        return includeUserDir;
    }

    public void setIncludeUserDir(boolean includeUserDir) {
        this.includeUserDir = includeUserDir;
    }

    public boolean isDiscoverOnStartup() {
        return discoverOnStartup;
    }

    public void setDiscoverOnStartup(boolean discoverOnStartup) {
        this.discoverOnStartup = discoverOnStartup;
    }
}
