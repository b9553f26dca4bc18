package com.linlay.sessionrelay.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.sessionrelay.config.AgentCliProperties;
import com.linlay.sessionrelay.stream.model.DecodedLine;
import com.linlay.sessionrelay.stream.model.LogEntry;
import com.linlay.sessionrelay.stream.service.LogEntryDecoder;
import com.linlay.sessionrelay.stream.service.NdjsonLineIterator;
import com.linlay.sessionrelay.stream.service.SseFlushWriter;
import com.linlay.sessionrelay.transcript.LiveTimeline;
import com.linlay.sessionrelay.transcript.TranscriptCorrelator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 实时转发服务。
 * <p>
 * 每个请求启动（或恢复）一个 agent 子进程，把其 stdout 上的逐行 JSON 记录按接收顺序逐条转成 SSE 帧推给客户端，
 * 并在 {@link SessionRegistry} 中登记进程与取消句柄。结束时总会补发一个终止帧 {@code [DONE]}；
 * 启动失败、读取失败或非零退出码会在终止帧之前追加一条 {@code relay.error} 帧。
 * 客户端断开与显式取消走同一条清理路径：终止子进程并从登记表移除。
 */
@Service
public class ProcessRelayService {

    public static final String ERROR_EVENT_TYPE = "relay.error";

    private static final Logger log = LoggerFactory.getLogger(ProcessRelayService.class);

    private final AgentProcessLauncher launcher;
    private final SessionRegistry registry;
    private final LogEntryDecoder decoder;
    private final TranscriptCorrelator correlator;
    private final AgentCliProperties properties;
    private final ObjectMapper objectMapper;

    public ProcessRelayService(
            AgentProcessLauncher launcher,
            SessionRegistry registry,
            LogEntryDecoder decoder,
            TranscriptCorrelator correlator,
            AgentCliProperties properties,
            ObjectMapper objectMapper
    ) {
        this.launcher = launcher;
        this.registry = registry;
        this.decoder = decoder;
        this.correlator = correlator;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Flux<ServerSentEvent<String>> relay(RelayRequest request) {
        return Flux.defer(() -> {
                    RelayRun run;
                    try {
                        run = start(request);
                    } catch (RuntimeException ex) {
                        log.error("Agent process failed to start session={}: {}", describe(request), ex.getMessage());
                        return Flux.just(errorEvent(ex.getMessage(), null, request.sessionId()), SseFlushWriter.done());
                    }
                    return stream(run);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private RelayRun start(RelayRequest request) {
        String resumeSessionId = request.isNewSession() ? null : request.sessionId().trim();
        AgentProcess process = launcher.launch(AgentLaunchSpec.message(
                resumeSessionId,
                request.message(),
                request.images(),
                request.workingDirectory()
        ));
        ActiveSession session = new ActiveSession(process, new LiveTimeline(correlator), Instant.now());
        String key = resumeSessionId != null
                ? resumeSessionId
                : SessionRegistry.pendingKey(UUID.randomUUID().toString());
        registry.register(key, session);
        return new RelayRun(session, key, resumeSessionId);
    }

    private Flux<ServerSentEvent<String>> stream(RelayRun run) {
        run.state.set(RelayState.STREAMING);
        AgentProcess process = run.session.process();

        Flux<ServerSentEvent<String>> events = Flux.<DecodedLine>fromIterable(
                        () -> new NdjsonLineIterator(process.stdout(), StandardCharsets.UTF_8, decoder)
                )
                .filter(line -> {
                    if (line.isMalformed()) {
                        log.debug("Skip malformed agent line={}, pid={}, reason={}",
                                line.lineNumber(), process.pid(), line.error().getMessage());
                        return false;
                    }
                    return true;
                })
                .map(DecodedLine::entry)
                .takeWhile(entry -> !run.session.isCancelled())
                .doOnNext(run::observe)
                .takeUntil(LogEntry::isResult)
                .map(entry -> SseFlushWriter.data(entry.toJson()));

        return events
                .concatWith(Flux.defer(() -> finish(run)))
                .onErrorResume(ex -> fail(run, ex))
                .doFinally(signal -> cleanup(run, signal));
    }

    private Flux<ServerSentEvent<String>> finish(RelayRun run) {
        if (run.session.isCancelled()) {
            run.state.set(RelayState.CANCELLED);
            return Flux.just(SseFlushWriter.done());
        }
        AgentProcess process = run.session.process();
        Optional<Integer> exitCode;
        try {
            exitCode = process.awaitExit(Duration.ofMillis(Math.max(0L, properties.getExitGraceMs())));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            exitCode = Optional.empty();
        }

        if (run.session.isCancelled()) {
            run.state.set(RelayState.CANCELLED);
            return Flux.just(SseFlushWriter.done());
        }
        if (exitCode.isEmpty()) {
            log.warn("Agent process still running after its output ended, terminating pid={}, session={}",
                    process.pid(), run.sessionId());
            process.destroy();
            run.state.set(RelayState.COMPLETED);
            return Flux.just(SseFlushWriter.done());
        }
        int code = exitCode.get();
        if (code != 0) {
            SubprocessExitException failure = new SubprocessExitException(code, process.stderrText());
            log.warn("Agent process exited with code={}, pid={}, session={}, stderr={}",
                    code, process.pid(), run.sessionId(), failure.stderr());
            run.state.set(RelayState.FAILED);
            return Flux.just(errorEvent(failure.getMessage(), code, run.sessionId), SseFlushWriter.done());
        }
        run.state.set(RelayState.COMPLETED);
        return Flux.just(SseFlushWriter.done());
    }

    private Flux<ServerSentEvent<String>> fail(RelayRun run, Throwable ex) {
        if (run.session.isCancelled()) {
            run.state.set(RelayState.CANCELLED);
            return Flux.just(SseFlushWriter.done());
        }
        run.state.set(RelayState.FAILED);
        log.error("Relay failed session={}, pid={}", run.sessionId(), run.session.process().pid(), ex);
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return Flux.just(errorEvent(message, null, run.sessionId), SseFlushWriter.done());
    }

    private void cleanup(RelayRun run, SignalType signal) {
        // a cancel after the terminal frame is just the subscriber letting go
        if (signal == SignalType.CANCEL && !run.state.get().isTerminal()) {
            log.info("Client disconnected, terminating agent session={}, pid={}",
                    run.sessionId(), run.session.process().pid());
            run.session.cancel();
            run.state.set(RelayState.CANCELLED);
        } else if (run.session.process().isAlive()) {
            run.session.process().destroy();
        }
        registry.unregister(run.key.get(), run.session);
        log.info("Relay finished session={}, state={}, resultSeen={}", run.sessionId(), run.state.get(), run.resultSeen);
    }

    private ServerSentEvent<String> errorEvent(String message, Integer exitCode, String sessionId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("type", ERROR_EVENT_TYPE);
        payload.put("error", message == null ? "unknown error" : message);
        if (exitCode != null) {
            payload.put("exitCode", exitCode);
        }
        if (sessionId != null && !sessionId.isBlank()) {
            payload.put("sessionId", sessionId);
        }
        try {
            return SseFlushWriter.data(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException ex) {
            return SseFlushWriter.data("{\"type\":\"" + ERROR_EVENT_TYPE + "\"}");
        }
    }

    private String describe(RelayRequest request) {
        return request.isNewSession() ? "new" : request.sessionId();
    }

    private final class RelayRun {

        private final ActiveSession session;
        private final AtomicReference<String> key;
        private final AtomicReference<RelayState> state = new AtomicReference<>(RelayState.STARTING);
        private volatile String sessionId;
        private volatile boolean resultSeen;

        private RelayRun(ActiveSession session, String key, String sessionId) {
            this.session = session;
            this.key = new AtomicReference<>(key);
            this.sessionId = sessionId;
        }

        private String sessionId() {
            return sessionId == null ? "new" : sessionId;
        }

        private void observe(LogEntry entry) {
            if (sessionId == null && entry.sessionId() != null) {
                sessionId = entry.sessionId();
                String pending = key.getAndSet(sessionId);
                registry.rebind(pending, sessionId, session);
                log.info("Captured session id={} for pid={}", sessionId, session.process().pid());
            }
            if (entry.isResult()) {
                resultSeen = true;
            }
            session.timeline().append(entry);
            log.debug("relay event type={}, session={}", entry.rawType(), sessionId());
        }
    }
}
