package ai.agentdeck.worktree;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the {@code git} executable in a directory and captures its output. Used for the operations
 * JGit does not cover for linked worktrees.
 */
final class GitCommand {
    private static final Logger logger = LogManager.getLogger(GitCommand.class);
    static final Duration GIT_TIMEOUT = Duration.ofMinutes(2);

    private GitCommand() {}

    /** Failed or timed-out git invocation. */
    static final class GitCommandException extends Exception {
        private final int exitCode;
        private final String output;

        GitCommandException(String message, int exitCode, String output) {
            super(message);
            this.exitCode = exitCode;
            this.output = output;
        }

        GitCommandException(String message, Throwable cause) {
            super(message, cause);
            this.exitCode = -1;
            this.output = "";
        }

        int exitCode() {
            return exitCode;
        }

        String output() {
            return output;
        }
    }

    /**
     * @return stdout of the command
     */
    static String run(Path directory, String... args) throws GitCommandException {
        var command = new ArrayList<String>(args.length + 3);
        command.add("git");
        command.add("-C");
        command.add(directory.toString());
        command.addAll(List.of(args));

        logger.debug("Executing: {}", command);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new GitCommandException("Failed to run " + String.join(" ", command), e);
        }

        var stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        var stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
        try {
            process.getOutputStream().close();
            if (!process.waitFor(GIT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GitCommandException("git " + args[0] + " timed out after " + GIT_TIMEOUT, -1, "");
            }
            var out = stdout.get();
            var err = stderr.get();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new GitCommandException(
                        "git " + String.join(" ", args) + " failed with exit code " + exitCode + ": " + err.trim(),
                        exitCode,
                        err);
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new GitCommandException("Interrupted while running git " + args[0], e);
        } catch (IOException | ExecutionException e) {
            throw new GitCommandException("Failed to read output of git " + args[0], e);
        }
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
