package ai.agentdeck.sessions;

/**
 * The two independent continuations produced by a fork.
 */
public record ForkResult(ForkedSession forkA, ForkedSession forkB) {

    /**
     * @param sessionId id of the copied transcript, resumable in {@code worktreePath}
     */
    public record ForkedSession(String sessionId, String worktreePath, String worktreeSessionId) {}
}
