package ai.agentdeck.worktree;

/**
 * A worktree operation failed.
 */
public class WorktreeException extends Exception {
    public WorktreeException(String message) {
        super(message);
    }

    public WorktreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
