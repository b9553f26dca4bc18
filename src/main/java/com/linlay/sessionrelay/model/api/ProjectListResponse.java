package com.linlay.sessionrelay.model.api;

import com.linlay.sessionrelay.workspace.ProjectSummary;

import java.util.List;

public record ProjectListResponse(
        List<ProjectSummary> projects,
        String currentProject
) {
}
