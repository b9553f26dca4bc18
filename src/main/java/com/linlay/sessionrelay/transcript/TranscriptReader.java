package com.linlay.sessionrelay.transcript;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.sessionrelay.config.TranscriptProperties;
import com.linlay.sessionrelay.stream.model.LogEntry;
import com.linlay.sessionrelay.stream.model.LogEntryType;
import com.linlay.sessionrelay.stream.model.MalformedEntryException;
import com.linlay.sessionrelay.stream.service.LogEntryDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the agent's per-session transcripts.
 * <p>
 * Transcripts are written by the agent process itself; this service only reads them back (whole-file for a
 * history reload, head-only for session listing) and deletes a whole file on request.
 */
@Service
public class TranscriptReader {

    private static final Logger log = LoggerFactory.getLogger(TranscriptReader.class);

    private final LogEntryDecoder decoder;
    private final TranscriptCorrelator correlator;
    private final TranscriptPaths paths;
    private final TranscriptProperties properties;

    public TranscriptReader(
            LogEntryDecoder decoder,
            TranscriptCorrelator correlator,
            TranscriptPaths paths,
            TranscriptProperties properties
    ) {
        this.decoder = decoder;
        this.correlator = correlator;
        this.paths = paths;
        this.properties = properties;
    }

    public TranscriptTimeline readSession(String sessionId, Path workingDirectory) {
        return readSession(paths.transcript(workingDirectory, sessionId));
    }

    /**
     * A missing transcript is "no history yet" and yields an empty timeline.
     */
    public TranscriptTimeline readSession(Path transcript) {
        if (transcript == null || !Files.isRegularFile(transcript)) {
            return TranscriptTimeline.empty();
        }
        try {
            // bad bytes decode to replacement characters and only spoil their own line
            String text = new String(Files.readAllBytes(transcript), resolveCharset());
            return correlator.reconstruct(decoder.decodeAll(text.lines().toList()));
        } catch (Exception ex) {
            log.warn("Cannot read transcript file={}, fallback to empty", transcript, ex);
            return TranscriptTimeline.empty();
        }
    }

    /**
     * Lists the sessions recorded for a project. Files without any user entry are not sessions and are left out.
     * Order is unspecified.
     */
    public List<SessionSummary> listSessions(Path workingDirectory) {
        Path projectDir = paths.projectDir(workingDirectory);
        if (!Files.isDirectory(projectDir)) {
            return List.of();
        }
        List<SessionSummary> sessions = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(projectDir, "*" + TranscriptPaths.TRANSCRIPT_SUFFIX)) {
            for (Path file : stream) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                SessionSummary summary = extractSummary(file);
                if (summary != null) {
                    sessions.add(summary);
                }
            }
        } catch (IOException ex) {
            log.warn("Cannot list transcripts dir={}", projectDir, ex);
            return List.of();
        }
        return sessions;
    }

    public boolean deleteSession(String sessionId, Path workingDirectory) {
        Path transcript = paths.transcript(workingDirectory, sessionId);
        try {
            boolean deleted = Files.deleteIfExists(transcript);
            if (deleted) {
                log.info("Deleted transcript file={}", transcript);
            } else {
                log.debug("Transcript not found file={}", transcript);
            }
            return deleted;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to delete transcript: " + transcript, ex);
        }
    }

    SessionSummary extractSummary(Path file) {
        String sessionId = null;
        String created = null;
        String gitBranch = null;
        String firstPrompt = null;
        boolean sidechain = false;
        boolean hasUserEntry = false;
        Instant modified;

        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), resolveCharset()))) {
            modified = Files.getLastModifiedTime(file).toInstant();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                LogEntry entry;
                try {
                    entry = decoder.decode(line);
                } catch (MalformedEntryException ex) {
                    continue;
                }
                if (sessionId == null && entry.sessionId() != null) {
                    sessionId = entry.sessionId();
                }
                if (created == null && entry.timestamp() != null) {
                    created = entry.timestamp();
                }
                if (entry.type() != LogEntryType.USER || !entry.hasMessageContent()) {
                    continue;
                }
                hasUserEntry = true;
                if (entry.gitBranch() != null) {
                    gitBranch = entry.gitBranch();
                }
                if (entry.isSidechain()) {
                    sidechain = true;
                }
                if (!entry.isMeta()) {
                    firstPrompt = promptText(entry.messageContent());
                }
                if (firstPrompt != null) {
                    break;
                }
            }
        } catch (IOException ex) {
            log.warn("Cannot read transcript file={}", file, ex);
            return null;
        }

        if (sessionId == null || !hasUserEntry) {
            return null;
        }
        return new SessionSummary(
                sessionId,
                correlator.truncateTitle(firstPrompt),
                created != null ? created : modified.toString(),
                modified.toString(),
                gitBranch,
                sidechain,
                file.toString()
        );
    }

    private String promptText(JsonNode content) {
        if (content.isTextual()) {
            String text = content.asText();
            return text.startsWith("<") ? null : text;
        }
        if (content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText())) {
                    String text = block.path("text").asText("");
                    return StringUtils.hasText(text) ? text : null;
                }
            }
        }
        return null;
    }

    private Charset resolveCharset() {
        try {
            return Charset.forName(properties.getCharset());
        } catch (Exception ex) {
            return StandardCharsets.UTF_8;
        }
    }
}
