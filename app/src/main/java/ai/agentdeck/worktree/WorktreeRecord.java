package ai.agentdeck.worktree;

import org.jetbrains.annotations.Nullable;

/**
 * Registry entry for a session worktree.
 *
 * @param baseBranch branch the worktree was based on, or null when created from a detached HEAD
 * @param baseCommit commit the detached checkout started from
 * @param createdAt creation time, epoch millis
 * @param branchName branch created inside the worktree, or null while still detached
 */
public record WorktreeRecord(
        String sessionId,
        String projectPath,
        String worktreePath,
        @Nullable String baseBranch,
        String baseCommit,
        long createdAt,
        @Nullable String branchName) {

    public WorktreeRecord {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        if (projectPath == null || worktreePath == null || baseCommit == null) {
            throw new IllegalArgumentException("projectPath, worktreePath and baseCommit are required");
        }
    }

    public WorktreeRecord withBranchName(String branchName) {
        return new WorktreeRecord(sessionId, projectPath, worktreePath, baseBranch, baseCommit, createdAt, branchName);
    }
}
