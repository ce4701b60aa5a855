package ai.agentdeck.worktree;

public class WorktreeNotFoundException extends WorktreeException {
    public WorktreeNotFoundException(String sessionId) {
        super("No worktree registered for session " + sessionId);
    }
}
