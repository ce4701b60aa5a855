package ai.agentdeck.sessions;

import ai.agentdeck.agent.AgentEvent;
import ai.agentdeck.agent.AgentProcess;
import ai.agentdeck.agent.AgentRunner;
import ai.agentdeck.agent.AlreadyRunningException;
import ai.agentdeck.agent.SpawnException;
import ai.agentdeck.agent.TitleGenerator;
import ai.agentdeck.config.AgentDeckConfig;
import ai.agentdeck.transcript.TranscriptLocator;
import ai.agentdeck.util.Subscription;
import ai.agentdeck.worktree.WorktreeException;
import ai.agentdeck.worktree.WorktreeIsolator;
import ai.agentdeck.worktree.WorktreeRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Owns every live agent session and delivers their events to observers.
 *
 * <p>Callbacks from agent runners are handed to a single event-loop thread, which coalesces text
 * deltas, broadcasts to observers and runs post-turn effects (notification, one-time title). Events
 * of one session reach observers in production order; no order is promised across sessions.
 *
 * <p>Call {@link #init()} before use and {@link #destroy()} on shutdown.
 */
public final class SessionOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SessionOrchestrator.class);

    private final AgentDeckConfig config;
    private final AgentRunner runner;
    private final WorktreeIsolator worktrees;
    private final TranscriptLocator transcripts;
    private final TitleGenerator titleGenerator;
    private final TurnNotifier notifier;
    private final ToolBridge toolBridge;
    private final EventBroadcaster broadcaster = new EventBroadcaster();
    private final ConcurrentMap<String, ManagedSession> sessions = new ConcurrentHashMap<>();

    private volatile @Nullable ScheduledExecutorService loop;
    private volatile @Nullable ExecutorService titleExecutor;
    private @Nullable DeltaCoalescer coalescer;

    private static final class ManagedSession {
        final AgentProcess agent;
        final Subscription subscription;
        final @Nullable String initialPrompt;
        final @Nullable WorktreeRecord worktree;
        // event loop only
        boolean titleRequested;

        ManagedSession(
                AgentProcess agent,
                Subscription subscription,
                @Nullable String initialPrompt,
                @Nullable WorktreeRecord worktree) {
            this.agent = agent;
            this.subscription = subscription;
            this.initialPrompt = initialPrompt;
            this.worktree = worktree;
        }
    }

    public SessionOrchestrator(
            AgentDeckConfig config,
            AgentRunner runner,
            WorktreeIsolator worktrees,
            TranscriptLocator transcripts,
            TitleGenerator titleGenerator,
            TurnNotifier notifier) {
        this.config = config;
        this.runner = runner;
        this.worktrees = worktrees;
        this.transcripts = transcripts;
        this.titleGenerator = titleGenerator;
        this.notifier = notifier;
        this.toolBridge = new ToolBridge(config.bridgeScript());
    }

    public synchronized void init() {
        if (loop != null) {
            return;
        }
        var eventLoop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SessionOrchestrator-EventLoop");
            t.setDaemon(true);
            return t;
        });
        coalescer = new DeltaCoalescer(eventLoop, DeltaCoalescer.DEFAULT_MAX_BUFFER, new BroadcastSink());
        titleExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "SessionTitle");
            t.setDaemon(true);
            return t;
        });
        loop = eventLoop;
        logger.info("Session orchestrator started");
    }

    /** Stop every session and release the event loop. */
    public synchronized void destroy() {
        var eventLoop = loop;
        if (eventLoop == null) {
            return;
        }
        logger.info("Shutting down session orchestrator ({} sessions)", sessions.size());
        for (var managed : sessions.values()) {
            managed.agent.stop();
        }

        eventLoop.shutdown();
        try {
            if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                eventLoop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            eventLoop.shutdownNow();
        }
        for (var managed : sessions.values()) {
            managed.subscription.close();
        }
        sessions.clear();

        var titles = titleExecutor;
        if (titles != null) {
            titles.shutdownNow();
        }
        loop = null;
        titleExecutor = null;
        coalescer = null;
    }

    @Override
    public void close() {
        destroy();
    }

    public Subscription addObserver(SessionObserver observer) {
        return broadcaster.add(observer, true);
    }

    /**
     * Register an observer that is not ready yet; deliveries are queued until {@link #markReady}.
     */
    public Subscription addObserver(SessionObserver observer, boolean ready) {
        return broadcaster.add(observer, ready);
    }

    public void removeObserver(SessionObserver observer) {
        broadcaster.remove(observer);
    }

    public void markReady(SessionObserver observer) {
        broadcaster.markReady(observer);
    }

    /** Supply the IDE tool bridge's listening port and auth token. */
    public void setBridgeInfo(int port, String token) {
        toolBridge.setBridgeInfo(port, token);
    }

    /**
     * Start a new session with its first prompt.
     *
     * @throws AlreadyRunningException if the requested session id is live and mid-turn
     * @throws WorktreeException if a worktree was requested and could not be created
     */
    public StartedSession startAgent(StartOptions options, String prompt)
            throws AlreadyRunningException, SpawnException, WorktreeException {
        requireStarted();
        var sessionId = options.sessionId() != null ? options.sessionId() : UUID.randomUUID().toString();
        var existing = sessions.get(sessionId);
        if (existing != null) {
            if (existing.agent.isRunning()) {
                throw new AlreadyRunningException("Session " + sessionId + " is already running");
            }
            throw new IllegalStateException("Session " + sessionId + " already exists; resume it instead");
        }

        WorktreeRecord worktree = null;
        var workingPath = options.projectPath();
        if (options.worktree().useWorktree()) {
            worktree = worktrees.create(
                    options.projectPath(),
                    UUID.randomUUID().toString(),
                    options.worktree().baseBranch(),
                    options.worktree().includeChanges());
            workingPath = worktree.worktreePath();
        }

        var model = options.model() != null ? options.model() : config.defaultModel();
        var agent = newAgent(sessionId, workingPath, model, false);
        var subscription = wire(sessionId, agent);
        var managed = new ManagedSession(agent, subscription, prompt, worktree);
        sessions.put(sessionId, managed);
        try {
            agent.start(prompt);
        } catch (SpawnException | RuntimeException e) {
            sessions.remove(sessionId, managed);
            subscription.close();
            if (worktree != null) {
                worktrees.remove(worktree.sessionId());
            }
            throw e;
        }

        logger.info("Started session {} in {}", sessionId, workingPath);
        return new StartedSession(
                sessionId,
                worktree == null ? null : worktree.worktreePath(),
                worktree == null ? null : worktree.sessionId());
    }

    /**
     * Continue a conversation that has history, e.g. one restored from disk. Replaces any idle
     * process registered under the id.
     */
    public String resumeAgent(String sessionId, String projectPath, @Nullable String model, String message)
            throws AlreadyRunningException, SpawnException {
        requireStarted();
        var existing = sessions.get(sessionId);
        if (existing != null && existing.agent.isRunning()) {
            throw new AlreadyRunningException("Session " + sessionId + " is still processing");
        }

        var agent = newAgent(sessionId, projectPath, model, true);
        var subscription = wire(sessionId, agent);
        var managed = new ManagedSession(agent, subscription, null, existing == null ? null : existing.worktree);
        try {
            agent.resume(message);
        } catch (SpawnException | RuntimeException e) {
            subscription.close();
            throw e;
        }
        var replaced = sessions.put(sessionId, managed);
        if (replaced != null) {
            replaced.subscription.close();
        }
        logger.info("Resumed session {} in {}", sessionId, projectPath);
        return sessionId;
    }

    /** Send a follow-up message to a live session. */
    public void sendMessage(String sessionId, String content)
            throws SessionNotFoundException, AlreadyRunningException, SpawnException {
        var managed = requireSession(sessionId);
        if (managed.agent.isRunning()) {
            throw new AlreadyRunningException("Agent is still processing; wait for it to finish");
        }
        managed.agent.resume(content);
    }

    public void setModel(String sessionId, @Nullable String model) throws SessionNotFoundException {
        requireSession(sessionId).agent.setModel(model);
    }

    /** Stop one session, or every session when {@code sessionId} is null. */
    public void stopAgent(@Nullable String sessionId) {
        if (sessionId == null) {
            sessions.values().forEach(managed -> managed.agent.stop());
            return;
        }
        var managed = sessions.get(sessionId);
        if (managed != null) {
            managed.agent.stop();
        }
    }

    public SessionStatus getStatus(String sessionId) {
        var managed = sessions.get(sessionId);
        if (managed == null) {
            return SessionStatus.absent(sessionId);
        }
        var agent = managed.agent;
        var state = agent.state();
        boolean completed = agent.hasCompletedFirstTurn();
        SessionStatus.Lifecycle lifecycle;
        if (state == AgentProcess.State.RUNNING) {
            lifecycle = SessionStatus.Lifecycle.RUNNING;
        } else if (state == AgentProcess.State.CLOSED) {
            lifecycle = SessionStatus.Lifecycle.CLOSED;
        } else if (completed) {
            lifecycle = SessionStatus.Lifecycle.IDLE;
        } else {
            lifecycle = SessionStatus.Lifecycle.NOT_STARTED;
        }
        return new SessionStatus(
                sessionId,
                agent.projectPath().toString(),
                lifecycle,
                state == AgentProcess.State.RUNNING,
                completed,
                true);
    }

    public List<String> sessionIds() {
        return List.copyOf(sessions.keySet());
    }

    /**
     * Split a conversation into two independent continuations, each in its own worktree.
     *
     * <p>The source session is stopped, its transcript is located under the project's transcript
     * directory and copied under a fresh id into each new worktree's transcript directory. A missing
     * transcript fails before any worktree is created; if the second worktree cannot be created the
     * first one is removed.
     *
     * @param knownLogId transcript id when it differs from the session id
     * @throws IllegalStateException if the session is live but has not completed a turn yet
     */
    public ForkResult fork(String sessionId, String projectPath, @Nullable String knownLogId)
            throws SessionNotFoundException, WorktreeException, IOException {
        var managed = sessions.get(sessionId);
        if (managed != null) {
            if (!managed.agent.hasCompletedFirstTurn()) {
                throw new IllegalStateException("Session " + sessionId + " has no completed turn to fork");
            }
            managed.agent.stop();
        }

        var logId = knownLogId != null ? knownLogId : sessionId;
        var source = transcripts.logFile(projectPath, logId);
        if (!Files.isRegularFile(source)) {
            throw new SessionNotFoundException("Transcript not found for session " + logId + ": " + source);
        }

        var first = worktrees.create(projectPath, UUID.randomUUID().toString(), null, true);
        WorktreeRecord second;
        try {
            second = worktrees.create(projectPath, UUID.randomUUID().toString(), null, true);
        } catch (WorktreeException e) {
            worktrees.remove(first.sessionId());
            throw e;
        }

        try {
            var forkA = copyTranscript(source, logId, first);
            var forkB = copyTranscript(source, logId, second);
            logger.info("Forked session {} into {} and {}", sessionId, forkA.sessionId(), forkB.sessionId());
            return new ForkResult(forkA, forkB);
        } catch (IOException e) {
            worktrees.remove(first.sessionId());
            worktrees.remove(second.sessionId());
            throw e;
        }
    }

    private ForkResult.ForkedSession copyTranscript(Path source, String logId, WorktreeRecord worktree)
            throws IOException {
        var forkId = UUID.randomUUID().toString();
        var targetDir = transcripts.projectDir(worktree.worktreePath());
        Files.createDirectories(targetDir);
        Files.copy(source, targetDir.resolve(forkId + TranscriptLocator.LOG_SUFFIX));

        // sub-agent transcripts and tool outputs live in a directory named after the log
        var companion = source.resolveSibling(logId);
        if (Files.isDirectory(companion)) {
            try {
                copyTree(companion, targetDir.resolve(forkId));
            } catch (IOException e) {
                logger.warn("Could not copy session directory {} for fork {}", companion, forkId, e);
            }
        }
        return new ForkResult.ForkedSession(forkId, worktree.worktreePath(), worktree.sessionId());
    }

    private static void copyTree(Path from, Path to) throws IOException {
        try (var walk = Files.walk(from)) {
            for (var path : walk.toList()) {
                var target = to.resolve(from.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(target);
                } else {
                    Files.copy(path, target);
                }
            }
        }
    }

    private AgentProcess newAgent(String sessionId, String projectPath, @Nullable String model, boolean resumable) {
        var mcpConfig = toolBridge.mcpConfig(projectPath);
        return new AgentProcess(
                sessionId,
                Path.of(projectPath),
                runner,
                model,
                mcpConfig,
                mcpConfig != null ? ToolBridge.SYSTEM_PROMPT_APPEND : null,
                resumable);
    }

    private Subscription wire(String sessionId, AgentProcess agent) {
        return agent.subscribe(new AgentProcess.Listener() {
            @Override
            public void onEvent(AgentEvent event) {
                post(() -> requireCoalescer().accept(sessionId, event));
            }

            @Override
            public void onClose(int exitCode) {
                post(() -> handleClose(sessionId, agent, exitCode));
            }

            @Override
            public void onError(Throwable error) {
                var message = error.getMessage() != null ? error.getMessage() : error.toString();
                post(() -> {
                    requireCoalescer().flush(sessionId);
                    broadcaster.broadcast(o -> o.onError(sessionId, message));
                });
            }
        });
    }

    private void handleClose(String sessionId, AgentProcess agent, int exitCode) {
        requireCoalescer().flush(sessionId);
        broadcaster.broadcast(o -> o.onClosed(sessionId, exitCode));

        var managed = sessions.get(sessionId);
        if (managed != null && managed.agent == agent && managed.initialPrompt != null && !managed.titleRequested) {
            managed.titleRequested = true;
            requestTitle(sessionId, managed.initialPrompt);
        }

        if (config.notificationsEnabled()) {
            var message = exitCode == 0 ? "Task completed" : "Agent exited with code " + exitCode;
            try {
                notifier.notifyTurnFinished(sessionId, agent.projectPath().toString(), message);
            } catch (RuntimeException e) {
                logger.warn("Turn notification failed for session {}", sessionId, e);
            }
        }
    }

    private void requestTitle(String sessionId, String prompt) {
        var executor = titleExecutor;
        if (executor == null) {
            return;
        }
        CompletableFuture.supplyAsync(() -> titleGenerator.generateTitle(prompt), executor)
                .whenComplete((title, error) -> {
                    if (error != null) {
                        logger.warn("Title generation failed for session {}", sessionId, error);
                        return;
                    }
                    if (title == null || title.isBlank()) {
                        logger.debug("No title produced for session {}", sessionId);
                        return;
                    }
                    post(() -> broadcaster.broadcast(o -> o.onTitle(sessionId, title)));
                });
    }

    private void post(Runnable task) {
        var eventLoop = loop;
        if (eventLoop == null) {
            logger.debug("Dropping session callback; orchestrator is not running");
            return;
        }
        try {
            eventLoop.execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("Dropping session callback during shutdown");
        }
    }

    private DeltaCoalescer requireCoalescer() {
        var current = coalescer;
        if (current == null) {
            throw new IllegalStateException("SessionOrchestrator is not initialised");
        }
        return current;
    }

    private void requireStarted() {
        if (loop == null) {
            throw new IllegalStateException("SessionOrchestrator is not initialised; call init() first");
        }
    }

    private ManagedSession requireSession(String sessionId) throws SessionNotFoundException {
        var managed = sessions.get(sessionId);
        if (managed == null) {
            throw new SessionNotFoundException("No agent session found for " + sessionId);
        }
        return managed;
    }

    private final class BroadcastSink implements DeltaCoalescer.Sink {
        @Override
        public void deliverEvent(String sessionId, AgentEvent event) {
            broadcaster.broadcast(o -> o.onEvent(sessionId, event));
        }

        @Override
        public void deliverBatch(String sessionId, List<AgentEvent> batch) {
            broadcaster.broadcast(o -> o.onEvents(sessionId, batch));
        }
    }
}
