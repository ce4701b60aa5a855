package ai.agentdeck.sessions;

/**
 * Tells the user a turn finished, e.g. through a desktop notification.
 */
@FunctionalInterface
public interface TurnNotifier {
    void notifyTurnFinished(String sessionId, String projectPath, String message);
}
