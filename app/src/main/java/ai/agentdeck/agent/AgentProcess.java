package ai.agentdeck.agent;

import ai.agentdeck.util.Subscription;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * One agent session with at most one turn in flight.
 *
 * <p>Each {@link #start} or {@link #resume} hands a {@link TurnRequest} to the {@link AgentRunner}.
 * Listeners then see the turn's events in order followed by exactly one {@code onClose} or
 * {@code onError}. {@link #stop()} cancels the turn in flight; a cancelled turn always ends with
 * {@code onClose(0)}.
 */
public final class AgentProcess {
    private static final Logger logger = LogManager.getLogger(AgentProcess.class);

    public enum State {
        IDLE,
        RUNNING,
        CLOSED
    }

    public interface Listener {
        void onEvent(AgentEvent event);

        void onClose(int exitCode);

        void onError(Throwable error);
    }

    private final String sessionId;
    private final Path projectPath;
    private final AgentRunner runner;
    private final @Nullable ObjectNode mcpConfig;
    private final @Nullable String systemPromptAppend;
    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private State state = State.IDLE;
    private boolean hasCompletedFirstTurn;
    private boolean stopRequested;
    private @Nullable String model;
    private @Nullable CancellationToken currentToken;

    /**
     * @param resumable true when {@code sessionId} names a conversation that already has history,
     *     in which case {@link #start} is rejected and {@link #hasCompletedFirstTurn()} starts out true
     */
    public AgentProcess(
            String sessionId,
            Path projectPath,
            AgentRunner runner,
            @Nullable String model,
            @Nullable ObjectNode mcpConfig,
            @Nullable String systemPromptAppend,
            boolean resumable) {
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        this.sessionId = sessionId;
        this.projectPath = projectPath;
        this.runner = runner;
        this.model = model;
        this.mcpConfig = mcpConfig;
        this.systemPromptAppend = systemPromptAppend;
        this.hasCompletedFirstTurn = resumable;
    }

    public Subscription subscribe(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Begin the conversation with its first prompt.
     *
     * @throws AlreadyRunningException if a turn is in flight
     * @throws IllegalStateException if the conversation already has a completed turn
     */
    public void start(String prompt) throws AlreadyRunningException, SpawnException {
        synchronized (lock) {
            if (state != State.RUNNING && hasCompletedFirstTurn) {
                throw new IllegalStateException("Session " + sessionId + " already started; use resume");
            }
            runTurn(prompt, false);
        }
    }

    /**
     * Continue the conversation with a follow-up message.
     *
     * @throws AlreadyRunningException if a turn is in flight
     */
    public void resume(String message) throws AlreadyRunningException, SpawnException {
        synchronized (lock) {
            runTurn(message, true);
        }
    }

    private void runTurn(String prompt, boolean resume) throws AlreadyRunningException, SpawnException {
        assert Thread.holdsLock(lock);
        if (state == State.RUNNING) {
            throw new AlreadyRunningException("Agent process already running for session " + sessionId);
        }

        var previous = state;
        var token = new CancellationToken();
        var request =
                new TurnRequest(prompt, sessionId, resume, projectPath, model, mcpConfig, systemPromptAppend);
        logger.info("Starting turn for session {} (resume={}, prompt {} chars)", sessionId, resume, prompt.length());

        state = State.RUNNING;
        stopRequested = false;
        currentToken = token;
        try {
            runner.launch(request, token, new TurnCallbacks(token));
        } catch (SpawnException | RuntimeException e) {
            state = previous;
            currentToken = null;
            throw e;
        }
    }

    /**
     * Cancel the turn in flight, if any. The session becomes {@link State#CLOSED} but can still be resumed.
     */
    public void stop() {
        CancellationToken token;
        synchronized (lock) {
            stopRequested = true;
            token = currentToken;
            if (state != State.RUNNING) {
                state = State.CLOSED;
            }
        }
        if (token != null) {
            logger.info("Stopping turn for session {}", sessionId);
            token.cancel();
        }
    }

    /** Model override for the next turn; null selects the agent's default. */
    public void setModel(@Nullable String model) {
        synchronized (lock) {
            this.model = model;
        }
    }

    public String sessionId() {
        return sessionId;
    }

    public Path projectPath() {
        return projectPath;
    }

    @Nullable
    public String model() {
        synchronized (lock) {
            return model;
        }
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isRunning() {
        return state() == State.RUNNING;
    }

    public boolean hasCompletedFirstTurn() {
        synchronized (lock) {
            return hasCompletedFirstTurn;
        }
    }

    private void emitEvent(AgentEvent event) {
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on {} event for session {}", event.type(), sessionId, e);
            }
        }
    }

    private void emitClose(int exitCode) {
        for (var listener : listeners) {
            try {
                listener.onClose(exitCode);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on close for session {}", sessionId, e);
            }
        }
    }

    private void emitError(Throwable error) {
        for (var listener : listeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                logger.warn("Listener failed on error for session {}", sessionId, e);
            }
        }
    }

    /** Callbacks scoped to one turn; anything reported after the turn ended is dropped. */
    private final class TurnCallbacks implements AgentRunner.TurnListener {
        private final CancellationToken token;
        private boolean finished;

        TurnCallbacks(CancellationToken token) {
            this.token = token;
        }

        @Override
        public void onEvent(AgentEvent event) {
            synchronized (lock) {
                if (finished) {
                    logger.debug("Dropping {} event after end of turn for session {}", event.type(), sessionId);
                    return;
                }
            }
            emitEvent(event);
        }

        @Override
        public void onExit(int exitCode) {
            int reported;
            synchronized (lock) {
                if (finished) {
                    return;
                }
                finished = true;
                reported = token.isCancelled() ? 0 : exitCode;
                finishTurn();
            }
            logger.info("Turn for session {} closed with code {}", sessionId, reported);
            emitClose(reported);
        }

        @Override
        public void onFailure(Throwable error) {
            boolean cancelled;
            synchronized (lock) {
                if (finished) {
                    return;
                }
                finished = true;
                cancelled = token.isCancelled();
                if (cancelled) {
                    finishTurn();
                } else {
                    state = State.IDLE;
                    currentToken = null;
                }
            }
            if (cancelled) {
                logger.info("Turn for session {} aborted", sessionId);
                emitClose(0);
            } else {
                logger.error("Turn for session {} failed", sessionId, error);
                emitError(error);
            }
        }

        private void finishTurn() {
            assert Thread.holdsLock(lock);
            hasCompletedFirstTurn = true;
            currentToken = null;
            state = stopRequested ? State.CLOSED : State.IDLE;
        }
    }
}
