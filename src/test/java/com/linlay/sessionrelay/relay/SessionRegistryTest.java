package com.linlay.sessionrelay.relay;

import com.linlay.sessionrelay.transcript.LiveTimeline;
import com.linlay.sessionrelay.transcript.TranscriptCorrelator;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void cancelShouldMakeSessionIdleImmediately() {
        FakeAgentProcess process = FakeAgentProcess.hanging(List.of());
        ActiveSession session = newSession(process);
        registry.register("s1", session);

        assertThat(registry.isBusy("s1")).isTrue();
        assertThat(registry.cancel("s1")).isTrue();
        assertThat(registry.isBusy("s1")).isFalse();
        assertThat(session.isCancelled()).isTrue();
        assertThat(process.destroyed()).isTrue();
    }

    @Test
    void cancelShouldReportNothingToCancelForUnknownSession() {
        assertThat(registry.cancel("missing")).isFalse();
        assertThat(registry.cancel(" ")).isFalse();
        assertThat(registry.isBusy("missing")).isFalse();
    }

    @Test
    void rebindShouldMovePendingEntryToSessionId() {
        ActiveSession session = newSession(FakeAgentProcess.hanging(List.of()));
        String pending = SessionRegistry.pendingKey("abc");
        registry.register(pending, session);

        registry.rebind(pending, "s1", session);

        assertThat(registry.find("s1")).containsSame(session);
        assertThat(registry.find(pending)).isEmpty();
        assertThat(registry.activeSessionIds()).containsExactly("s1");
    }

    @Test
    void rebindShouldIgnoreCancelledSession() {
        ActiveSession session = newSession(FakeAgentProcess.hanging(List.of()));
        String pending = SessionRegistry.pendingKey("abc");
        registry.register(pending, session);
        registry.cancel(pending);

        registry.rebind(pending, "s1", session);

        assertThat(registry.isBusy("s1")).isFalse();
    }

    @Test
    void rebindShouldDropPendingKeyOfSessionCancelledOutsideRegistry() {
        ActiveSession session = newSession(FakeAgentProcess.hanging(List.of()));
        String pending = SessionRegistry.pendingKey("abc");
        registry.register(pending, session);
        session.cancel();

        registry.rebind(pending, "s1", session);

        assertThat(registry.find(pending)).isEmpty();
        assertThat(registry.isBusy("s1")).isFalse();
        assertThat(registry.activeSessionIds()).isEmpty();
    }

    @Test
    void unregisterShouldKeepNewerRequestForSameSession() {
        ActiveSession older = newSession(FakeAgentProcess.hanging(List.of()));
        ActiveSession newer = newSession(FakeAgentProcess.hanging(List.of()));
        registry.register("s1", older);
        registry.register("s1", newer);

        assertThat(registry.unregister("s1", older)).isFalse();
        assertThat(registry.find("s1")).containsSame(newer);
        assertThat(registry.unregister("s1", newer)).isTrue();
        assertThat(registry.isBusy("s1")).isFalse();
    }

    @Test
    void activeSessionIdsShouldHidePendingKeys() {
        registry.register(SessionRegistry.pendingKey("x"), newSession(FakeAgentProcess.hanging(List.of())));
        registry.register("b", newSession(FakeAgentProcess.hanging(List.of())));
        registry.register("a", newSession(FakeAgentProcess.hanging(List.of())));

        assertThat(registry.activeSessionIds()).containsExactly("a", "b");
    }

    private ActiveSession newSession(AgentProcess process) {
        return new ActiveSession(process, new LiveTimeline(new TranscriptCorrelator()), Instant.now());
    }
}
