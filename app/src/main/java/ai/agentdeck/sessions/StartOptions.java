package ai.agentdeck.sessions;

import org.jetbrains.annotations.Nullable;

/**
 * @param sessionId id to use for the new conversation; null to generate one
 * @param model model override; null for the configured default
 */
public record StartOptions(
        String projectPath, @Nullable String model, @Nullable String sessionId, WorktreeOptions worktree) {

    public StartOptions {
        if (projectPath == null || projectPath.isBlank()) {
            throw new IllegalArgumentException("projectPath must not be blank");
        }
        if (worktree == null) {
            worktree = WorktreeOptions.none();
        }
    }

    public static StartOptions of(String projectPath) {
        return new StartOptions(projectPath, null, null, WorktreeOptions.none());
    }
}
