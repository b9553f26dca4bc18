package com.linlay.sessionrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "agent.workspace")
public class WorkspaceProperties {

    private String initialDir = System.getProperty("user.dir", ".");
    private String projectsRoot = Path.of(System.getProperty("user.home", "."), "projects").toString();
    private int scanDepth = 4;

    public String getInitialDir() {
        return initialDir;
    }

    public void setInitialDir(String initialDir) {
        this.initialDir = initialDir;
    }

    public String getProjectsRoot() {
        return projectsRoot;
    }

    public void setProjectsRoot(String projectsRoot) {
        this.projectsRoot = projectsRoot;
    }

    public int getScanDepth() {
        return scanDepth;
    }

    public void setScanDepth(int scanDepth) {
        this.scanDepth = scanDepth;
    }
}
