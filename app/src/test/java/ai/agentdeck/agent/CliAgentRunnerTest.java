package ai.agentdeck.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisabledOnOs(OS.WINDOWS)
class CliAgentRunnerTest {

    @TempDir
    Path tempDir;

    private final List<AgentEvent> events = new CopyOnWriteArrayList<>();
    private final List<Integer> closes = new CopyOnWriteArrayList<>();
    private final CountDownLatch closed = new CountDownLatch(1);

    private Path writeScript(String body) throws Exception {
        var script = tempDir.resolve("fake-agent.sh");
        Files.writeString(script, "#!/bin/sh\n" + body);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    private AgentProcess newProcess(Path script) {
        var process = new AgentProcess(
                "cli-session",
                tempDir,
                new CliAgentRunner(script.toString(), Duration.ofSeconds(2)),
                null,
                null,
                null,
                false);
        process.subscribe(new AgentProcess.Listener() {
            @Override
            public void onEvent(AgentEvent event) {
                events.add(event);
            }

            @Override
            public void onClose(int exitCode) {
                closes.add(exitCode);
                closed.countDown();
            }

            @Override
            public void onError(Throwable error) {
                closed.countDown();
            }
        });
        return process;
    }

    @Test
    void testStdoutRecordsAndStderrLinesBecomeEvents() throws Exception {
        var script = writeScript("cat > /dev/null\n"
                + "printf '%s\\n' '{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"cli-session\",\"tools\":[]}'\n"
                + "printf '%s\\n' 'garbage line'\n"
                + "printf '%s\\n' '{\"type\":\"status\",\"ignored\":true}'\n"
                + "echo 'warning: slow network' >&2\n"
                + "printf '%s\\n' '{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"done\",\"num_turns\":1}'\n"
                + "exit 0\n");
        var process = newProcess(script);

        process.start("do the thing");

        assertTrue(closed.await(10, TimeUnit.SECONDS));
        assertEquals(List.of(0), closes);
        assertTrue(process.hasCompletedFirstTurn());

        var stdoutEvents = events.stream().filter(e -> !(e instanceof AgentEvent.ProcessStderr)).toList();
        assertEquals(2, stdoutEvents.size());
        assertInstanceOf(AgentEvent.SystemInit.class, stdoutEvents.get(0));
        var result = assertInstanceOf(AgentEvent.TurnResult.class, stdoutEvents.get(1));
        assertEquals("done", result.result());

        assertTrue(events.stream()
                .anyMatch(e -> e instanceof AgentEvent.ProcessStderr stderr
                        && stderr.line().equals("warning: slow network")));
    }

    @Test
    void testLargePromptWithChattyChildDoesNotBlockLaunch() throws Exception {
        // fills the stderr pipe before reading any of stdin
        var script = writeScript("i=0\n"
                + "while [ $i -lt 2000 ]; do echo \"progress line $i padded to make the pipe fill quickly\" >&2; i=$((i+1)); done\n"
                + "cat > /dev/null\n"
                + "printf '%s\\n' '{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"ok\"}'\n"
                + "exit 0\n");
        var process = newProcess(script);
        var prompt = "x".repeat(1_000_000);

        var launched = new CountDownLatch(1);
        var starter = new Thread(() -> {
            try {
                process.start(prompt);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            } finally {
                launched.countDown();
            }
        });
        starter.setDaemon(true);
        starter.start();

        assertTrue(launched.await(10, TimeUnit.SECONDS));
        assertTrue(closed.await(20, TimeUnit.SECONDS));
        assertEquals(List.of(0), closes);
        assertEquals(2000, events.stream().filter(e -> e instanceof AgentEvent.ProcessStderr).count());
        assertTrue(events.stream().anyMatch(e -> e instanceof AgentEvent.TurnResult));
    }

    @Test
    void testNonZeroExitEmitsProcessErrorBeforeClose() throws Exception {
        var script = writeScript("cat > /dev/null\nexit 3\n");
        var process = newProcess(script);

        process.start("fail please");

        assertTrue(closed.await(10, TimeUnit.SECONDS));
        assertEquals(List.of(3), closes);
        var error = assertInstanceOf(AgentEvent.ProcessError.class, events.get(events.size() - 1));
        assertEquals(3, error.exitCode());
    }

    @Test
    void testStopTerminatesChildAndClosesWithZero() throws Exception {
        var script = writeScript("cat > /dev/null\nexec sleep 30\n");
        var process = newProcess(script);

        process.start("hang");
        assertTrue(process.isRunning());
        process.stop();

        assertTrue(closed.await(10, TimeUnit.SECONDS));
        assertEquals(List.of(0), closes);
        assertTrue(events.stream().noneMatch(e -> e instanceof AgentEvent.ProcessError));
        assertEquals(AgentProcess.State.CLOSED, process.state());
    }

    @Test
    void testMissingExecutableFailsToSpawn() {
        var process = newProcess(tempDir.resolve("does-not-exist"));

        assertThrows(SpawnException.class, () -> process.start("hello"));
        assertFalse(process.isRunning());
    }

    @Test
    void testCommandCarriesSessionFlags() {
        var runner = new CliAgentRunner("claude", Duration.ofSeconds(5));
        var mcp = JsonNodeFactory.instance.objectNode();
        mcp.putObject("mcpServers");

        var fresh = runner.buildCommand(new TurnRequest("p", "abc", false, tempDir, null, null, null));
        assertEquals("claude", fresh.get(0));
        assertTrue(fresh.containsAll(List.of("-p", "--output-format", "stream-json", "--include-partial-messages")));
        assertEquals("abc", fresh.get(fresh.indexOf("--session-id") + 1));
        assertFalse(fresh.contains("--resume"));
        assertFalse(fresh.contains("--model"));

        var resumed = runner.buildCommand(new TurnRequest("p", "abc", true, tempDir, "opus", mcp, "extra"));
        assertEquals("abc", resumed.get(resumed.indexOf("--resume") + 1));
        assertEquals("opus", resumed.get(resumed.indexOf("--model") + 1));
        assertEquals("{\"mcpServers\":{}}", resumed.get(resumed.indexOf("--mcp-config") + 1));
        assertEquals("extra", resumed.get(resumed.indexOf("--append-system-prompt") + 1));
        assertFalse(resumed.contains("--session-id"));
    }
}
