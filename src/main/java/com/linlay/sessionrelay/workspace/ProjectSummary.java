package com.linlay.sessionrelay.workspace;

import com.linlay.sessionrelay.model.api.SessionListResponse;

import java.util.List;

public record ProjectSummary(
        String name,
        String path,
        List<SessionListResponse.SessionItem> sessions
) {

    public ProjectSummary {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }
}
