package com.linlay.sessionrelay.controller;

import com.linlay.sessionrelay.model.api.ApiResponse;
import com.linlay.sessionrelay.model.api.ProjectListResponse;
import com.linlay.sessionrelay.model.api.SwitchProjectRequest;
import com.linlay.sessionrelay.model.api.SwitchProjectResponse;
import com.linlay.sessionrelay.workspace.WorkspaceService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final WorkspaceService workspaceService;

    public ProjectController(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    @GetMapping
    public Mono<ApiResponse<ProjectListResponse>> projects() {
        return Mono.fromCallable(() -> ApiResponse.success(new ProjectListResponse(
                        workspaceService.listProjects(),
                        workspaceService.currentProjectName()
                )))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/switch")
    public ApiResponse<SwitchProjectResponse> switchProject(@Valid @RequestBody SwitchProjectRequest request) {
        Path cwd = workspaceService.switchProject(request.project());
        return ApiResponse.success(new SwitchProjectResponse(cwd.toString()));
    }
}
