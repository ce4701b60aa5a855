package ai.agentdeck.agent;

/**
 * Thrown when the execution unit for a turn could not be started.
 */
public class SpawnException extends Exception {
    public SpawnException(String message) {
        super(message);
    }

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
