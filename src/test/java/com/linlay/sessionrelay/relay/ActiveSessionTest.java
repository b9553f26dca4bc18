package com.linlay.sessionrelay.relay;

import com.linlay.sessionrelay.transcript.LiveTimeline;
import com.linlay.sessionrelay.transcript.TranscriptCorrelator;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ActiveSessionTest {

    @Test
    void cancelShouldDestroyProcessOnlyOnce() {
        AgentProcess process = mock(AgentProcess.class);
        ActiveSession session = new ActiveSession(process, new LiveTimeline(new TranscriptCorrelator()), Instant.now());

        assertThat(session.cancel()).isTrue();
        assertThat(session.cancel()).isFalse();
        assertThat(session.isCancelled()).isTrue();
        verify(process, times(1)).destroy();
    }

    @Test
    void cancelShouldSurviveProcessThatCannotBeKilled() {
        AgentProcess process = mock(AgentProcess.class);
        doThrow(new IllegalStateException("no such process")).when(process).destroy();
        ActiveSession session = new ActiveSession(process, new LiveTimeline(new TranscriptCorrelator()), null);

        assertThat(session.cancel()).isTrue();
        assertThat(session.isCancelled()).isTrue();
        assertThat(session.startedAt()).isNotNull();
    }
}
