package ai.agentdeck.worktree;

/**
 * How {@link WorktreeIsolator} moves changes between a worktree and its main checkout.
 */
public enum SyncMode {
    /** Hard-reset the destination to the source's commit, then apply the source's uncommitted changes. */
    OVERWRITE,
    /** Keep the destination's history and three-way apply the source's changes since their merge base. */
    APPLY
}
