package ai.agentdeck.sessions;

import org.jetbrains.annotations.Nullable;

/**
 * Worktree settings for a new session.
 *
 * @param baseBranch ref to base the worktree on; null for the project's current HEAD
 * @param includeChanges carry the project's uncommitted changes into the worktree
 */
public record WorktreeOptions(boolean useWorktree, @Nullable String baseBranch, boolean includeChanges) {
    public static WorktreeOptions none() {
        return new WorktreeOptions(false, null, false);
    }
}
