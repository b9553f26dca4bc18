package com.linlay.sessionrelay.transcript;

import com.linlay.sessionrelay.config.TranscriptProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Maps a project working directory and session id onto the agent's transcript layout:
 * {@code <projects-dir>/<cwd with '/' replaced by '-'>/<sessionId>.jsonl}.
 */
@Component
public class TranscriptPaths {

    public static final String TRANSCRIPT_SUFFIX = ".jsonl";

    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path projectsDir;

    @Autowired
    public TranscriptPaths(TranscriptProperties properties) {
        this(Path.of(properties.getProjectsDir()));
    }

    public TranscriptPaths(Path projectsDir) {
        this.projectsDir = projectsDir.toAbsolutePath().normalize();
    }

    public Path projectsDir() {
        return projectsDir;
    }

    public Path projectDir(Path workingDirectory) {
        String folder = workingDirectory.toAbsolutePath().normalize().toString().replace('/', '-');
        return projectsDir.resolve(folder);
    }

    public Path transcript(Path workingDirectory, String sessionId) {
        return projectDir(workingDirectory).resolve(requireValidSessionId(sessionId) + TRANSCRIPT_SUFFIX);
    }

    public static String requireValidSessionId(String sessionId) {
        if (!isValidSessionId(sessionId)) {
            throw new IllegalArgumentException("Invalid sessionId: " + sessionId);
        }
        return sessionId.trim();
    }

    public static boolean isValidSessionId(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return false;
        }
        String trimmed = sessionId.trim();
        if (".".equals(trimmed) || "..".equals(trimmed)) {
            return false;
        }
        return SESSION_ID_PATTERN.matcher(trimmed).matches();
    }
}
