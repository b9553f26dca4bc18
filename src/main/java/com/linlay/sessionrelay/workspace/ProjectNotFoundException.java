package com.linlay.sessionrelay.workspace;

public class ProjectNotFoundException extends RuntimeException {

    public ProjectNotFoundException(String project) {
        super("Project not found: " + project);
    }
}
