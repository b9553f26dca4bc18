package com.linlay.sessionrelay.controller;

import com.linlay.sessionrelay.model.api.ApiResponse;
import com.linlay.sessionrelay.model.api.CancelResponse;
import com.linlay.sessionrelay.model.api.CompactResponse;
import com.linlay.sessionrelay.model.api.DeleteSessionResponse;
import com.linlay.sessionrelay.model.api.LiveTimelineResponse;
import com.linlay.sessionrelay.model.api.SendMessageRequest;
import com.linlay.sessionrelay.model.api.SessionHistoryResponse;
import com.linlay.sessionrelay.model.api.SessionListResponse;
import com.linlay.sessionrelay.model.api.SessionStatusResponse;
import com.linlay.sessionrelay.relay.ActiveSession;
import com.linlay.sessionrelay.relay.ProcessRelayService;
import com.linlay.sessionrelay.relay.RelayRequest;
import com.linlay.sessionrelay.relay.SessionRegistry;
import com.linlay.sessionrelay.relay.SlashCommandService;
import com.linlay.sessionrelay.stream.service.SseFlushWriter;
import com.linlay.sessionrelay.transcript.TranscriptPaths;
import com.linlay.sessionrelay.transcript.TranscriptReader;
import com.linlay.sessionrelay.transcript.TranscriptTimeline;
import com.linlay.sessionrelay.workspace.WorkspaceService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);
    private static final String NEW_SESSION = "new";

    private final TranscriptReader transcriptReader;
    private final ProcessRelayService processRelayService;
    private final SlashCommandService slashCommandService;
    private final SessionRegistry sessionRegistry;
    private final WorkspaceService workspaceService;
    private final SseFlushWriter sseFlushWriter;

    public SessionController(
            TranscriptReader transcriptReader,
            ProcessRelayService processRelayService,
            SlashCommandService slashCommandService,
            SessionRegistry sessionRegistry,
            WorkspaceService workspaceService,
            SseFlushWriter sseFlushWriter
    ) {
        this.transcriptReader = transcriptReader;
        this.processRelayService = processRelayService;
        this.slashCommandService = slashCommandService;
        this.sessionRegistry = sessionRegistry;
        this.workspaceService = workspaceService;
        this.sseFlushWriter = sseFlushWriter;
    }

    @GetMapping
    public Mono<ApiResponse<SessionListResponse>> sessions() {
        Path cwd = workspaceService.currentDirectory();
        return blocking(() -> {
            List<SessionListResponse.SessionItem> sessions = workspaceService.sessionsOf(cwd);
            String latestSessionId = sessions.isEmpty() ? null : sessions.get(0).sessionId();
            return ApiResponse.success(new SessionListResponse(sessions, cwd.toString(), latestSessionId));
        });
    }

    @GetMapping("/{sessionId}/history")
    public Mono<ApiResponse<SessionHistoryResponse>> history(@PathVariable String sessionId) {
        String id = TranscriptPaths.requireValidSessionId(sessionId);
        Path cwd = workspaceService.currentDirectory();
        return blocking(() -> {
            TranscriptTimeline timeline = transcriptReader.readSession(id, cwd);
            return ApiResponse.success(new SessionHistoryResponse(
                    timeline.messages(),
                    cwd.toString(),
                    id,
                    timeline.compacted(),
                    timeline.firstPrompt()
            ));
        });
    }

    @GetMapping("/{sessionId}/status")
    public ApiResponse<SessionStatusResponse> status(@PathVariable String sessionId) {
        Optional<ActiveSession> active = sessionRegistry.find(sessionId);
        return ApiResponse.success(new SessionStatusResponse(
                sessionId,
                active.isPresent(),
                active.map(session -> session.startedAt().toString()).orElse(null)
        ));
    }

    @GetMapping("/{sessionId}/live")
    public ApiResponse<LiveTimelineResponse> live(@PathVariable String sessionId) {
        Optional<ActiveSession> active = sessionRegistry.find(sessionId);
        if (active.isEmpty()) {
            return ApiResponse.success(new LiveTimelineResponse(sessionId, false, List.of(), null));
        }
        TranscriptTimeline timeline = active.get().timeline().snapshot();
        return ApiResponse.success(new LiveTimelineResponse(sessionId, true, timeline.messages(), timeline.firstPrompt()));
    }

    @PostMapping(value = "/{sessionId}/messages", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<Void> messages(
            @PathVariable String sessionId,
            @Valid @RequestBody SendMessageRequest request,
            ServerHttpResponse response
    ) {
        String resumeSessionId = NEW_SESSION.equals(sessionId) ? null : TranscriptPaths.requireValidSessionId(sessionId);
        log.info(
                "Received message session={}, chars={}, images={}",
                sessionId,
                request.message().length(),
                request.images() == null ? 0 : request.images().size()
        );
        RelayRequest relayRequest = new RelayRequest(
                resumeSessionId,
                request.message(),
                request.images(),
                workspaceService.currentDirectory()
        );
        return sseFlushWriter.write(response, processRelayService.relay(relayRequest));
    }

    @PostMapping("/{sessionId}/cancel")
    public ApiResponse<CancelResponse> cancel(@PathVariable String sessionId) {
        boolean cancelled = sessionRegistry.cancel(sessionId);
        return ApiResponse.success(new CancelResponse(sessionId, cancelled));
    }

    @PostMapping("/{sessionId}/compact")
    public Mono<ResponseEntity<ApiResponse<CompactResponse>>> compact(@PathVariable String sessionId) {
        String id = TranscriptPaths.requireValidSessionId(sessionId);
        Path cwd = workspaceService.currentDirectory();
        return blocking(() -> {
            SlashCommandService.CommandOutcome outcome = slashCommandService.compact(id, cwd);
            if (outcome.success()) {
                return ResponseEntity.ok(ApiResponse.success(new CompactResponse(id, true, null)));
            }
            return ApiResponse.reply(
                    HttpStatus.INTERNAL_SERVER_ERROR,
                    outcome.error(),
                    new CompactResponse(id, false, outcome.error())
            );
        });
    }

    @DeleteMapping("/{sessionId}")
    public Mono<ApiResponse<DeleteSessionResponse>> delete(
            @PathVariable String sessionId,
            @RequestParam(required = false) String project
    ) {
        String id = TranscriptPaths.requireValidSessionId(sessionId);
        Path projectDir = workspaceService.resolveProject(project);
        return blocking(() -> {
            boolean deleted = transcriptReader.deleteSession(id, projectDir);
            return ApiResponse.success(new DeleteSessionResponse(id, deleted));
        });
    }

    // transcript reads and slash commands block; keep them off the event loop
    private <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
