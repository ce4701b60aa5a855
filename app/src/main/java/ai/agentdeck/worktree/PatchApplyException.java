package ai.agentdeck.worktree;

/**
 * A patch could not be applied to the destination tree.
 */
public class PatchApplyException extends WorktreeException {
    public PatchApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
