package ai.agentdeck.agent;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs each turn as a child process of the agent CLI in stream-json mode.
 *
 * <p>The prompt is written to the child's stdin. Stdout is decoded through a {@link StreamParser};
 * every stderr line becomes a {@link AgentEvent.ProcessStderr} event. A non-zero exit that was not
 * requested through the cancellation token is reported as a {@link AgentEvent.ProcessError} event
 * followed by the exit.
 */
public final class CliAgentRunner implements AgentRunner {
    private static final Logger logger = LogManager.getLogger(CliAgentRunner.class);
    private static final int READ_BUFFER_CHARS = 8192;

    private final String executable;
    private final Duration stopGracePeriod;

    public CliAgentRunner(String executable, Duration stopGracePeriod) {
        if (executable.isBlank()) {
            throw new IllegalArgumentException("executable must not be blank");
        }
        this.executable = executable;
        this.stopGracePeriod = stopGracePeriod;
    }

    @Override
    public void launch(TurnRequest request, CancellationToken token, TurnListener listener) throws SpawnException {
        var command = buildCommand(request);
        var sessionId = request.sessionId();

        Process process;
        try {
            var processBuilder = new ProcessBuilder(command);
            processBuilder.directory(request.workingDirectory().toFile());
            process = processBuilder.start();
            logger.info(
                    "Started agent process for session {} (pid={}, resume={}, cwd={})",
                    sessionId,
                    process.pid(),
                    request.resume(),
                    request.workingDirectory());
        } catch (IOException e) {
            throw new SpawnException("Failed to start agent process for session " + sessionId, e);
        }

        token.onCancel(() -> terminate(process, sessionId));

        var stderrThread = new Thread(() -> consumeStderr(process, listener), "AgentStderr-" + sessionId);
        stderrThread.setDaemon(true);
        stderrThread.start();

        var stdoutThread = new Thread(
                () -> consumeStdout(process, sessionId, token, listener, stderrThread), "AgentStdout-" + sessionId);
        stdoutThread.setDaemon(true);
        stdoutThread.start();

        // the child may not drain stdin before producing output, so the prompt is fed separately
        var stdinThread = new Thread(() -> writePrompt(process, request.prompt(), sessionId), "AgentStdin-" + sessionId);
        stdinThread.setDaemon(true);
        stdinThread.start();
    }

    private static void writePrompt(Process process, String prompt, String sessionId) {
        try (var stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
            stdin.write(prompt);
        } catch (IOException e) {
            // the child may already have exited or been stopped; its exit is reported by the stdout pump
            logger.warn("Could not write prompt to agent process for session {}: {}", sessionId, e.getMessage());
        }
    }

    List<String> buildCommand(TurnRequest request) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.add("-p");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");
        command.add("--include-partial-messages");
        command.add("--permission-mode");
        command.add("bypassPermissions");
        if (request.resume()) {
            command.add("--resume");
        } else {
            command.add("--session-id");
        }
        command.add(request.sessionId());
        if (request.model() != null) {
            command.add("--model");
            command.add(request.model());
        }
        if (request.mcpConfig() != null) {
            command.add("--mcp-config");
            command.add(request.mcpConfig().toString());
        }
        if (request.systemPromptAppend() != null) {
            command.add("--append-system-prompt");
            command.add(request.systemPromptAppend());
        }
        return command;
    }

    private void consumeStdout(
            Process process, String sessionId, CancellationToken token, TurnListener listener, Thread stderrThread) {
        var parser = new StreamParser(new StreamParser.Listener() {
            @Override
            public void onRecord(JsonNode record) {
                var event = AgentEventDecoder.decode(record);
                if (event instanceof AgentEvent.Unknown unknown) {
                    logger.trace("Ignoring {} record from session {}", unknown.type(), sessionId);
                    return;
                }
                listener.onEvent(event);
            }

            @Override
            public void onParseError(String rawLine) {
                logger.warn("Failed to parse agent output line for session {}: {}", sessionId, abbreviate(rawLine));
            }
        });

        try (var reader = new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
            var buffer = new char[READ_BUFFER_CHARS];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                parser.feed(new String(buffer, 0, read));
            }
            parser.flush();
        } catch (IOException e) {
            if (!token.isCancelled()) {
                logger.warn("Lost agent output stream for session {}", sessionId, e);
                process.destroyForcibly();
                listener.onFailure(e);
                return;
            }
        }

        int exitCode;
        try {
            stderrThread.join();
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            listener.onFailure(e);
            return;
        }

        if (token.isCancelled()) {
            logger.info("Agent process for session {} stopped (exit code {})", sessionId, exitCode);
            listener.onExit(0);
            return;
        }
        if (exitCode != 0) {
            logger.warn("Agent process for session {} exited with code {}", sessionId, exitCode);
            listener.onEvent(AgentEvent.ProcessError.of(exitCode, "Agent exited with code " + exitCode));
        } else {
            logger.debug("Agent process for session {} completed", sessionId);
        }
        listener.onExit(exitCode);
    }

    private void consumeStderr(Process process, TurnListener listener) {
        try (var reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    listener.onEvent(AgentEvent.ProcessStderr.of(line));
                }
            }
        } catch (IOException e) {
            logger.debug("Agent stderr stream closed: {}", e.getMessage());
        }
    }

    private void terminate(Process process, String sessionId) {
        if (!process.isAlive()) {
            return;
        }
        logger.info("Stopping agent process for session {} (pid={})", sessionId, process.pid());
        process.destroy();

        var reaper = new Thread(
                () -> {
                    try {
                        if (!process.waitFor(stopGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                            logger.warn("Agent process for session {} did not terminate gracefully, forcing kill", sessionId);
                            process.destroyForcibly();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        process.destroyForcibly();
                    }
                },
                "AgentStop-" + sessionId);
        reaper.setDaemon(true);
        reaper.start();
    }

    private static String abbreviate(String line) {
        return line.length() <= 200 ? line : line.substring(0, 200) + "...";
    }
}
