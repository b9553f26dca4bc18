package com.linlay.sessionrelay.workspace;

import com.linlay.sessionrelay.config.WorkspaceProperties;
import com.linlay.sessionrelay.model.api.SessionListResponse;
import com.linlay.sessionrelay.transcript.SessionSummary;
import com.linlay.sessionrelay.transcript.TranscriptReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Holds the project directory new agent processes run in, and discovers the git projects the user can switch to.
 */
@Service
public class WorkspaceService {

    public static final String UNTITLED_SESSION = "Untitled session";

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private final WorkspaceProperties properties;
    private final TranscriptReader transcriptReader;
    private final AtomicReference<Path> currentDirectory;

    public WorkspaceService(WorkspaceProperties properties, TranscriptReader transcriptReader) {
        this.properties = properties;
        this.transcriptReader = transcriptReader;
        this.currentDirectory = new AtomicReference<>(Path.of(properties.getInitialDir()).toAbsolutePath().normalize());
    }

    public Path currentDirectory() {
        return currentDirectory.get();
    }

    public Path projectsRoot() {
        return Path.of(properties.getProjectsRoot()).toAbsolutePath().normalize();
    }

    /**
     * Resolves an optional client-supplied project path, falling back to the current directory.
     */
    public Path resolveProject(String projectPath) {
        if (!StringUtils.hasText(projectPath)) {
            return currentDirectory();
        }
        return Path.of(projectPath.trim()).toAbsolutePath().normalize();
    }

    public Path switchProject(String project) {
        if (!StringUtils.hasText(project)) {
            throw new IllegalArgumentException("project name required");
        }
        Path root = projectsRoot();
        Path target = root.resolve(project.trim()).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new IllegalArgumentException("Invalid project: " + project);
        }
        if (!Files.isDirectory(target)) {
            throw new ProjectNotFoundException(project);
        }
        currentDirectory.set(target);
        log.info("Switched project cwd={}", target);
        return target;
    }

    /**
     * Name of the current project relative to the projects root, or its directory name when outside it.
     */
    public String currentProjectName() {
        Path current = currentDirectory();
        Path root = projectsRoot();
        if (current.startsWith(root) && !current.equals(root)) {
            return root.relativize(current).toString();
        }
        Path fileName = current.getFileName();
        return fileName == null ? current.toString() : fileName.toString();
    }

    public List<ProjectSummary> listProjects() {
        Path root = projectsRoot();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        List<Path> projectDirs;
        try (Stream<Path> paths = Files.walk(root, Math.max(1, properties.getScanDepth()))) {
            projectDirs = paths
                    .filter(path -> ".git".equals(String.valueOf(path.getFileName())))
                    .map(Path::getParent)
                    .filter(path -> path != null && !path.equals(root))
                    .distinct()
                    .toList();
        } catch (IOException | RuntimeException ex) {
            log.warn("Cannot scan projects root={}", root, ex);
            return List.of();
        }
        return projectDirs.stream()
                .map(dir -> new ProjectSummary(root.relativize(dir).toString(), dir.toString(), sessionsOf(dir)))
                .sorted(Comparator.comparing(ProjectSummary::name))
                .toList();
    }

    /**
     * Non-sidechain sessions of a project, most recently modified first.
     */
    public List<SessionListResponse.SessionItem> sessionsOf(Path projectDir) {
        return transcriptReader.listSessions(projectDir).stream()
                .filter(summary -> !summary.sidechain())
                .sorted(Comparator.comparing(WorkspaceService::modifiedInstant).reversed())
                .map(summary -> new SessionListResponse.SessionItem(
                        summary.sessionId(),
                        StringUtils.hasText(summary.firstPrompt()) ? summary.firstPrompt() : UNTITLED_SESSION,
                        summary.created(),
                        summary.modified(),
                        summary.gitBranch()
                ))
                .toList();
    }

    private static Instant modifiedInstant(SessionSummary summary) {
        try {
            return Instant.parse(summary.modified());
        } catch (RuntimeException ex) {
            return Instant.EPOCH;
        }
    }
}
