package ai.agentdeck.agent;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Asks a small model for a session title through a single-turn, tool-less CLI invocation.
 */
public final class CliTitleGenerator implements TitleGenerator {
    private static final Logger logger = LogManager.getLogger(CliTitleGenerator.class);
    private static final String SYSTEM_PROMPT =
            "You are a title generator. Respond with only a short title, nothing else.";
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final String executable;
    private final String model;

    public CliTitleGenerator(String executable, String model) {
        this.executable = executable;
        this.model = model;
    }

    @Override
    @Nullable
    public String generateTitle(String firstMessage) {
        var command = List.of(
                executable,
                "-p",
                "--model",
                model,
                "--max-turns",
                "1",
                "--output-format",
                "text",
                "--system-prompt",
                SYSTEM_PROMPT);

        Process process;
        try {
            process = new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
        } catch (IOException e) {
            logger.warn("Failed to start title generation: {}", e.getMessage());
            return null;
        }

        try {
            try (var stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
                stdin.write(TitleGenerator.titlePrompt(firstMessage));
            }
            var output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (!process.waitFor(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Title generation timed out");
                process.destroyForcibly();
                return null;
            }
            if (process.exitValue() != 0) {
                logger.warn("Title generation exited with code {}", process.exitValue());
                return null;
            }
            return TitleGenerator.cleanTitle(output);
        } catch (IOException e) {
            logger.warn("Title generation failed: {}", e.getMessage());
            process.destroyForcibly();
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return null;
        }
    }
}
