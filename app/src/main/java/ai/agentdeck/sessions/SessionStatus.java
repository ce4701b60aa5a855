package ai.agentdeck.sessions;

import org.jetbrains.annotations.Nullable;

/**
 * Snapshot of a session as seen by callers.
 *
 * @param hasSession whether the orchestrator currently holds a live process for the id
 */
public record SessionStatus(
        String sessionId,
        @Nullable String projectPath,
        Lifecycle lifecycle,
        boolean isRunning,
        boolean hasCompletedFirstTurn,
        boolean hasSession) {

    public enum Lifecycle {
        NOT_STARTED,
        RUNNING,
        IDLE,
        CLOSED
    }

    public static SessionStatus absent(String sessionId) {
        return new SessionStatus(sessionId, null, Lifecycle.NOT_STARTED, false, false, false);
    }
}
