package ai.agentdeck;

import ai.agentdeck.agent.CliAgentRunner;
import ai.agentdeck.agent.CliTitleGenerator;
import ai.agentdeck.config.AgentDeckConfig;
import ai.agentdeck.sessions.SessionOrchestrator;
import ai.agentdeck.sessions.TurnNotifier;
import ai.agentdeck.terminal.AttentionPatterns;
import ai.agentdeck.terminal.TerminalActivityTracker;
import ai.agentdeck.transcript.SessionLogTail;
import ai.agentdeck.transcript.TailListener;
import ai.agentdeck.transcript.TranscriptLocator;
import ai.agentdeck.worktree.WorktreeIsolator;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Composition root: builds the session core from configuration and owns its lifetime.
 */
public final class AgentDeck implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(AgentDeck.class);

    private final AgentDeckConfig config;
    private final TranscriptLocator transcripts;
    private final WorktreeIsolator worktrees;
    private final SessionOrchestrator orchestrator;
    private final ScheduledExecutorService terminalScheduler;

    private AgentDeck(AgentDeckConfig config, TurnNotifier notifier) {
        this.config = config;
        this.transcripts = new TranscriptLocator(config.claudeProjectsDir());
        this.worktrees = new WorktreeIsolator(config.worktreesDir(), config.worktreeRegistryFile());
        this.orchestrator = new SessionOrchestrator(
                config,
                new CliAgentRunner(config.cliExecutable(), config.stopGracePeriod()),
                worktrees,
                transcripts,
                new CliTitleGenerator(config.cliExecutable(), config.titleModel()),
                notifier);
        this.terminalScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "TerminalActivity");
            t.setDaemon(true);
            return t;
        });
    }

    public static AgentDeck start(AgentDeckConfig config) {
        return start(config, (sessionId, projectPath, message) -> logger.info("[{}] {}", sessionId, message));
    }

    public static AgentDeck start(AgentDeckConfig config, TurnNotifier notifier) {
        logger.info("Starting AgentDeck with {}", config);
        var deck = new AgentDeck(config, notifier);
        deck.orchestrator.init();
        deck.worktrees.cleanupAll();
        return deck;
    }

    public AgentDeckConfig config() {
        return config;
    }

    public SessionOrchestrator sessions() {
        return orchestrator;
    }

    public WorktreeIsolator worktrees() {
        return worktrees;
    }

    public TranscriptLocator transcripts() {
        return transcripts;
    }

    /** A tail for one UI surface; the caller closes it. */
    public SessionLogTail newLogTail(TailListener listener) {
        return new SessionLogTail(transcripts, listener);
    }

    public TerminalActivityTracker trackTerminal(String terminalId, TerminalActivityTracker.Listener listener) {
        return new TerminalActivityTracker(
                terminalId,
                terminalScheduler,
                config.terminalSilence(),
                AttentionPatterns.compile(config.attentionPatterns()),
                listener);
    }

    @Override
    public void close() {
        orchestrator.destroy();
        terminalScheduler.shutdownNow();
        logger.info("AgentDeck stopped");
    }
}
