package ai.agentdeck.sessions;

import ai.agentdeck.agent.AgentEvent;
import java.util.List;

/**
 * Receives everything the orchestrator broadcasts. Callbacks run on the orchestrator's event loop
 * and must not block.
 */
public interface SessionObserver {

    default void onEvent(String sessionId, AgentEvent event) {}

    /** Consecutive text deltas of one session, in production order. */
    default void onEvents(String sessionId, List<AgentEvent> batch) {}

    default void onClosed(String sessionId, int exitCode) {}

    default void onError(String sessionId, String message) {}

    default void onTitle(String sessionId, String title) {}
}
