package com.linlay.sessionrelay.transcript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.sessionrelay.stream.service.LogEntryDecoder;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LiveTimelineTest {

    private final LogEntryDecoder decoder = new LogEntryDecoder(new ObjectMapper());

    @Test
    void snapshotShouldReportPendingToolsAsRunning() {
        LiveTimeline timeline = new LiveTimeline(new TranscriptCorrelator());
        timeline.append(decoder.decode(
                "{\"type\":\"assistant\",\"uuid\":\"a1\",\"message\":{\"content\":[{\"type\":\"tool_use\",\"id\":\"t1\",\"name\":\"Bash\",\"input\":{}}]}}"
        ));

        TimelineMessage.ToolGroup running = (TimelineMessage.ToolGroup) timeline.snapshot().messages().get(0);
        assertThat(running.tools().get(0).status()).isEqualTo(ToolStatus.RUNNING);

        timeline.append(decoder.decode(
                "{\"type\":\"user\",\"uuid\":\"u1\",\"message\":{\"content\":[{\"type\":\"tool_result\",\"tool_use_id\":\"t1\",\"is_error\":false}]}}"
        ));

        TimelineMessage.ToolGroup finished = (TimelineMessage.ToolGroup) timeline.snapshot().messages().get(0);
        assertThat(finished.tools().get(0).status()).isEqualTo(ToolStatus.COMPLETE);
        assertThat(timeline.size()).isEqualTo(2);
    }
}
