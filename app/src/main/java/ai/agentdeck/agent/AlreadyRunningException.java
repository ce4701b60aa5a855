package ai.agentdeck.agent;

/**
 * Thrown when a turn is requested while another turn of the same session is still in flight.
 */
public class AlreadyRunningException extends Exception {
    public AlreadyRunningException(String message) {
        super(message);
    }
}
