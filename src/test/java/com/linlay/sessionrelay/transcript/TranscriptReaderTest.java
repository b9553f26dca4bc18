package com.linlay.sessionrelay.transcript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.sessionrelay.config.TranscriptProperties;
import com.linlay.sessionrelay.stream.service.LogEntryDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptReaderTest {

    @TempDir
    Path tempDir;

    private Path projectCwd;
    private TranscriptPaths paths;
    private TranscriptReader reader;

    @BeforeEach
    void setUp() {
        projectCwd = tempDir.resolve("work").resolve("demo");
        TranscriptProperties properties = new TranscriptProperties();
        properties.setProjectsDir(tempDir.resolve("projects").toString());
        paths = new TranscriptPaths(properties);
        reader = new TranscriptReader(
                new LogEntryDecoder(new ObjectMapper()),
                new TranscriptCorrelator(properties),
                paths,
                properties
        );
    }

    @Test
    void transcriptPathShouldFlattenWorkingDirectory() {
        Path transcript = paths.transcript(Path.of("/home/me/app"), "abc");

        assertThat(transcript.getFileName().toString()).isEqualTo("abc.jsonl");
        assertThat(transcript.getParent().getFileName().toString()).isEqualTo("-home-me-app");
    }

    @Test
    void readSessionShouldReturnEmptyTimelineForMissingFile() {
        TranscriptTimeline timeline = reader.readSession("missing", projectCwd);

        assertThat(timeline.isEmpty()).isTrue();
        assertThat(timeline.compacted()).isFalse();
        assertThat(timeline.firstPrompt()).isNull();
    }

    @Test
    void readSessionShouldReconstructTranscript() throws Exception {
        writeTranscript("s1",
                "{\"type\":\"user\",\"sessionId\":\"s1\",\"uuid\":\"u1\",\"message\":{\"role\":\"user\",\"content\":\"list files\"}}",
                "not json at all",
                "{\"type\":\"assistant\",\"sessionId\":\"s1\",\"uuid\":\"a1\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"Sure.\"}]}}"
        );

        TranscriptTimeline timeline = reader.readSession("s1", projectCwd);

        assertThat(timeline.messages()).extracting(TimelineMessage::id).containsExactly("u1", "a1");
        assertThat(timeline.firstPrompt()).isEqualTo("list files");
    }

    @Test
    void invalidBytesShouldOnlySpoilTheirOwnLine() throws Exception {
        Path transcript = paths.transcript(projectCwd, "bytes-1");
        Files.createDirectories(transcript.getParent());
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        content.write(("{\"type\":\"user\",\"sessionId\":\"bytes-1\",\"uuid\":\"u1\",\"message\":{\"content\":\"hello\"}}\n")
                .getBytes(StandardCharsets.UTF_8));
        content.write("{\"x\":\"".getBytes(StandardCharsets.UTF_8));
        content.write(0xFF);
        content.write("\"}\n".getBytes(StandardCharsets.UTF_8));
        content.write(("{\"type\":\"assistant\",\"sessionId\":\"bytes-1\",\"uuid\":\"a1\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}}\n")
                .getBytes(StandardCharsets.UTF_8));
        Files.write(transcript, content.toByteArray());

        TranscriptTimeline timeline = reader.readSession("bytes-1", projectCwd);
        List<SessionSummary> sessions = reader.listSessions(projectCwd);

        assertThat(timeline.messages()).extracting(TimelineMessage::id).containsExactly("u1", "a1");
        assertThat(sessions).extracting(SessionSummary::sessionId).containsExactly("bytes-1");
        assertThat(sessions.get(0).firstPrompt()).isEqualTo("hello");
    }

    @Test
    void readSessionShouldRejectPathTraversal() {
        assertThatThrownBy(() -> reader.readSession("../secret", projectCwd))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void listSessionsShouldSummarizeOnlyFilesWithUserEntries() throws Exception {
        writeTranscript("s1",
                "{\"type\":\"summary\",\"summary\":\"old\"}",
                "{\"type\":\"user\",\"sessionId\":\"s1\",\"timestamp\":\"2024-05-01T10:00:00Z\",\"gitBranch\":\"main\","
                        + "\"message\":{\"content\":\"<command-name>/init</command-name>\"}}",
                "{\"type\":\"user\",\"sessionId\":\"s1\",\"message\":{\"content\":\"refactor the parser\"}}"
        );
        writeTranscript("sidechain",
                "{\"type\":\"user\",\"sessionId\":\"sidechain\",\"isSidechain\":true,\"message\":{\"content\":\"sub task\"}}"
        );
        writeTranscript("system-only",
                "{\"type\":\"system\",\"sessionId\":\"system-only\",\"subtype\":\"init\"}"
        );

        List<SessionSummary> sessions = reader.listSessions(projectCwd);

        assertThat(sessions).extracting(SessionSummary::sessionId).containsExactlyInAnyOrder("s1", "sidechain");
        SessionSummary s1 = sessions.stream().filter(s -> s.sessionId().equals("s1")).findFirst().orElseThrow();
        assertThat(s1.firstPrompt()).isEqualTo("refactor the parser");
        assertThat(s1.created()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(s1.gitBranch()).isEqualTo("main");
        assertThat(s1.sidechain()).isFalse();
        SessionSummary sidechain = sessions.stream().filter(s -> s.sessionId().equals("sidechain")).findFirst().orElseThrow();
        assertThat(sidechain.sidechain()).isTrue();
        assertThat(sidechain.created()).isNotBlank();
    }

    @Test
    void listSessionsShouldReturnEmptyForUnknownProject() {
        assertThat(reader.listSessions(tempDir.resolve("nowhere"))).isEmpty();
    }

    @Test
    void deleteSessionShouldRemoveTranscript() throws Exception {
        Path transcript = writeTranscript("s1", "{\"type\":\"user\",\"sessionId\":\"s1\",\"message\":{\"content\":\"hi\"}}");

        assertThat(reader.deleteSession("s1", projectCwd)).isTrue();
        assertThat(Files.exists(transcript)).isFalse();
        assertThat(reader.deleteSession("s1", projectCwd)).isFalse();
    }

    private Path writeTranscript(String sessionId, String... lines) throws Exception {
        Path transcript = paths.transcript(projectCwd, sessionId);
        Files.createDirectories(transcript.getParent());
        Files.writeString(transcript, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return transcript;
    }
}
