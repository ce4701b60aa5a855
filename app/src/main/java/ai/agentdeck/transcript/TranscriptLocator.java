package ai.agentdeck.transcript;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Maps project paths to the agent CLI's transcript layout:
 * {@code <projectsDir>/<encoded project path>/<logId>.jsonl}.
 */
public final class TranscriptLocator {
    private static final Logger logger = LogManager.getLogger(TranscriptLocator.class);
    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9-]");
    public static final String LOG_SUFFIX = ".jsonl";

    private final Path projectsDir;

    public TranscriptLocator(Path projectsDir) {
        this.projectsDir = projectsDir;
    }

    /** e.g. {@code /home/me/my_app} becomes {@code -home-me-my-app}. */
    public static String encodeProjectPath(String projectPath) {
        return UNSAFE_CHARS.matcher(projectPath).replaceAll("-");
    }

    public Path projectsDir() {
        return projectsDir;
    }

    public Path projectDir(String projectPath) {
        return projectsDir.resolve(encodeProjectPath(projectPath));
    }

    public Path logFile(String projectPath, String logId) {
        return projectDir(projectPath).resolve(logId + LOG_SUFFIX);
    }

    public static String logIdOf(Path logFile) {
        var name = logFile.getFileName().toString();
        return name.endsWith(LOG_SUFFIX) ? name.substring(0, name.length() - LOG_SUFFIX.length()) : name;
    }

    /**
     * @return the most recently modified transcript in {@code dir}, or null if there is none
     */
    @Nullable
    public static Path findLatest(Path dir) {
        if (!Files.isDirectory(dir)) {
            return null;
        }
        try (var files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(LOG_SUFFIX))
                    .filter(Files::isRegularFile)
                    .max(Comparator.comparing(TranscriptLocator::lastModified))
                    .orElse(null);
        } catch (IOException e) {
            logger.warn("Failed to list transcripts in {}", dir, e);
            return null;
        }
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
