package ai.agentdeck.sessions;

import org.jetbrains.annotations.Nullable;

/**
 * @param worktreePath where the agent runs when the session got its own worktree
 * @param worktreeSessionId registry key of that worktree
 */
public record StartedSession(String sessionId, @Nullable String worktreePath, @Nullable String worktreeSessionId) {}
