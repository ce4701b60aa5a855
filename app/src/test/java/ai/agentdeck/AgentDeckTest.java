package ai.agentdeck;

import static org.junit.jupiter.api.Assertions.*;

import ai.agentdeck.config.AgentDeckConfig;
import ai.agentdeck.terminal.TerminalStatus;
import ai.agentdeck.transcript.TailListener;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AgentDeckTest {

    @TempDir
    Path tempDir;

    @Test
    void testStartWiresComponentsFromConfig() throws Exception {
        var config = AgentDeckConfig.builder(tempDir.resolve("config"))
                .claudeHome(tempDir.resolve("claude"))
                .terminalSilence(Duration.ofHours(1))
                .build();
        // leftover from a previous run with no registry entry
        var orphan = config.worktreesDir().resolve("0123456789ab").resolve("dead-session");
        Files.createDirectories(orphan);

        try (var deck = AgentDeck.start(config)) {
            assertFalse(Files.exists(orphan.getParent()));
            assertEquals(config.claudeProjectsDir(), deck.transcripts().projectsDir());
            assertFalse(deck.sessions().getStatus("unknown").hasSession());

            var tracker = deck.trackTerminal("t1", (id, previous, current) -> {});
            tracker.onData("hello\n");
            assertEquals(TerminalStatus.RUNNING, tracker.status());
            tracker.close();

            try (var tail = deck.newLogTail(new TailListener() {})) {
                assertTrue(tail.watch("ui", null, "/some/project").isEmpty());
            }
        }
    }
}
