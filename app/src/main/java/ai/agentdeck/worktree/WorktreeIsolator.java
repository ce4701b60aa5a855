package ai.agentdeck.worktree;

import ai.agentdeck.worktree.GitCommand.GitCommandException;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.jetbrains.annotations.Nullable;

/**
 * Gives sessions their own git worktree so several agents can change one repository at once.
 *
 * <p>Worktrees live under {@code <baseDir>/<sha256(projectPath)[0..12]>/<sessionId>} and start as a
 * detached checkout of the base commit. The main repository is read through JGit; worktree, stash,
 * diff and apply operations shell out to {@code git}.
 */
public final class WorktreeIsolator {
    private static final Logger logger = LogManager.getLogger(WorktreeIsolator.class);
    private static final int PROJECT_HASH_LENGTH = 12;

    private final Path baseDir;
    private final WorktreeRegistry registry;

    public WorktreeIsolator(Path baseDir, Path registryFile) {
        this.baseDir = Objects.requireNonNull(baseDir);
        this.registry = new WorktreeRegistry(registryFile);
    }

    public static String projectHash(String projectPath) {
        return Hashing.sha256()
                .hashString(projectPath, StandardCharsets.UTF_8)
                .toString()
                .substring(0, PROJECT_HASH_LENGTH);
    }

    public Path worktreePathFor(String projectPath, String sessionId) {
        return baseDir.resolve(projectHash(projectPath)).resolve(sessionId);
    }

    /**
     * Create a detached worktree for the session.
     *
     * @param baseBranch ref to base the worktree on; null means the current HEAD
     * @param includeChanges also carry over the main checkout's uncommitted changes (best effort)
     */
    public synchronized WorktreeRecord create(
            String projectPath, String sessionId, @Nullable String baseBranch, boolean includeChanges)
            throws WorktreeException {
        if (registry.get(sessionId) != null) {
            throw new WorktreeException("Worktree already exists for session " + sessionId);
        }
        var project = Path.of(projectPath);
        var worktreePath = worktreePathFor(projectPath, sessionId);

        String baseCommit;
        String resolvedBranch;
        try (var repository = openRepository(project)) {
            baseCommit = resolveCommit(repository, baseBranch != null ? baseBranch : Constants.HEAD);
            if (baseBranch == null || baseBranch.equals(Constants.HEAD)) {
                var full = repository.getFullBranch();
                resolvedBranch = full != null && full.startsWith(Constants.R_HEADS) ? Repository.shortenRefName(full) : null;
            } else {
                resolvedBranch = baseBranch;
            }
        } catch (IOException e) {
            throw new WorktreeException("Cannot read git repository at " + projectPath, e);
        }

        logger.info(
                "Creating worktree for session {} at {} (base={} {})", sessionId, worktreePath, resolvedBranch, baseCommit);
        try {
            Files.createDirectories(worktreePath.getParent());
            GitCommand.run(project, "worktree", "add", "--detach", worktreePath.toString(), baseCommit);
        } catch (IOException | GitCommandException e) {
            throw new WorktreeException("Failed to create worktree for session " + sessionId, e);
        }

        if (includeChanges) {
            carryUncommittedChanges(project, worktreePath, baseCommit);
        }

        var record = new WorktreeRecord(
                sessionId,
                projectPath,
                worktreePath.toString(),
                resolvedBranch,
                baseCommit,
                System.currentTimeMillis(),
                null);
        registry.put(record);
        return record;
    }

    private void carryUncommittedChanges(Path project, Path worktreePath, String baseCommit) {
        try {
            // stash create builds a stash commit without touching the stash list or the working tree
            var stashCommit = GitCommand.run(project, "stash", "create").trim();
            if (stashCommit.isEmpty()) {
                logger.debug("No uncommitted changes to carry into {}", worktreePath);
                return;
            }
            var patch = GitCommand.run(project, "diff", "--binary", baseCommit, stashCommit);
            applyPatch(worktreePath, patch, true);
        } catch (GitCommandException | PatchApplyException e) {
            logger.warn("Could not carry uncommitted changes into {}", worktreePath, e);
        }
    }

    /** Remove the session's worktree and registry entry. Unknown sessions are ignored. */
    public synchronized void remove(String sessionId) {
        var record = registry.get(sessionId);
        if (record == null) {
            logger.debug("No worktree registered for session {}; nothing to remove", sessionId);
            return;
        }
        var worktreePath = Path.of(record.worktreePath());
        try {
            GitCommand.run(Path.of(record.projectPath()), "worktree", "remove", "--force", worktreePath.toString());
        } catch (GitCommandException e) {
            logger.warn("git worktree remove failed for session {}: {}", sessionId, e.getMessage());
        }
        if (Files.exists(worktreePath)) {
            try {
                deleteRecursively(worktreePath);
            } catch (IOException e) {
                logger.error("Failed to delete worktree directory {}", worktreePath, e);
            }
        }
        registry.remove(sessionId);
        logger.info("Removed worktree for session {}", sessionId);
    }

    public synchronized List<WorktreeRecord> list(String projectPath) {
        return registry.all().stream()
                .filter(r -> r.projectPath().equals(projectPath))
                .toList();
    }

    @Nullable
    public synchronized WorktreeRecord get(String sessionId) {
        return registry.get(sessionId);
    }

    @Nullable
    public synchronized WorktreeRecord getByWorktreePath(String worktreePath) {
        return registry.all().stream()
                .filter(r -> r.worktreePath().equals(worktreePath))
                .findFirst()
                .orElse(null);
    }

    /** Turn the detached worktree into a named branch. */
    public synchronized WorktreeRecord createBranch(String sessionId, String branchName) throws WorktreeException {
        var record = require(sessionId);
        try {
            GitCommand.run(Path.of(record.worktreePath()), "checkout", "-b", branchName);
        } catch (GitCommandException e) {
            throw new WorktreeException("Failed to create branch " + branchName + " for session " + sessionId, e);
        }
        var updated = record.withBranchName(branchName);
        registry.put(updated);
        return updated;
    }

    /** Committed changes since the base commit followed by the uncommitted changes. */
    public synchronized String diff(String sessionId) throws WorktreeException {
        var record = require(sessionId);
        var worktree = Path.of(record.worktreePath());
        try {
            var committed = GitCommand.run(worktree, "diff", record.baseCommit(), "HEAD");
            var uncommitted = GitCommand.run(worktree, "diff", "HEAD");
            if (uncommitted.isEmpty()) {
                return committed;
            }
            return committed.isEmpty() ? uncommitted : committed + "\n" + uncommitted;
        } catch (GitCommandException e) {
            throw new WorktreeException("Failed to diff worktree for session " + sessionId, e);
        }
    }

    /** Bring the worktree's state into the main checkout. */
    public synchronized void syncToLocal(String sessionId, SyncMode mode) throws WorktreeException {
        var record = require(sessionId);
        transfer(record, Path.of(record.worktreePath()), Path.of(record.projectPath()), mode);
    }

    /** Bring the main checkout's state into the worktree. */
    public synchronized void syncFromLocal(String sessionId, SyncMode mode) throws WorktreeException {
        var record = require(sessionId);
        transfer(record, Path.of(record.projectPath()), Path.of(record.worktreePath()), mode);
    }

    private void transfer(WorktreeRecord record, Path source, Path destination, SyncMode mode) throws WorktreeException {
        logger.info("Syncing {} -> {} ({})", source, destination, mode);
        try {
            var sourceHead = GitCommand.run(source, "rev-parse", "HEAD").trim();
            var uncommitted = GitCommand.run(source, "diff", "--binary", "HEAD");

            switch (mode) {
                case OVERWRITE -> {
                    GitCommand.run(destination, "reset", "--hard", sourceHead);
                    applyPatch(destination, uncommitted, false);
                }
                case APPLY -> {
                    var destinationHead = GitCommand.run(destination, "rev-parse", "HEAD").trim();
                    var base = mergeBase(Path.of(record.projectPath()), sourceHead, destinationHead);
                    if (base == null) {
                        logger.debug("No merge base for {} and {}; using base commit", sourceHead, destinationHead);
                        base = record.baseCommit();
                    }
                    if (!base.equals(sourceHead)) {
                        var committed = GitCommand.run(source, "diff", "--binary", base, sourceHead);
                        applyPatch(destination, committed, true);
                    }
                    applyPatch(destination, uncommitted, true);
                }
            }
        } catch (GitCommandException e) {
            throw new WorktreeException("Failed to sync " + source + " to " + destination, e);
        }
    }

    /**
     * Prune stale worktree metadata, delete worktree directories the registry does not know about,
     * then delete empty project directories.
     */
    public synchronized void cleanupAll() {
        var records = registry.all();
        var projects = records.stream().map(WorktreeRecord::projectPath).collect(Collectors.toCollection(LinkedHashSet::new));
        for (var project : projects) {
            try {
                GitCommand.run(Path.of(project), "worktree", "prune");
            } catch (GitCommandException e) {
                logger.warn("git worktree prune failed for {}: {}", project, e.getMessage());
            }
        }

        if (!Files.isDirectory(baseDir)) {
            return;
        }
        var known = records.stream().map(r -> Path.of(r.worktreePath()).normalize()).collect(Collectors.toSet());
        try (var hashDirs = Files.list(baseDir)) {
            for (var hashDir : hashDirs.filter(Files::isDirectory).toList()) {
                try (var sessionDirs = Files.list(hashDir)) {
                    for (var dir : sessionDirs.filter(Files::isDirectory).toList()) {
                        if (!known.contains(dir.normalize())) {
                            logger.info("Deleting orphaned worktree directory {}", dir);
                            deleteRecursively(dir);
                        }
                    }
                }
                try (var remaining = Files.list(hashDir)) {
                    if (remaining.findAny().isEmpty()) {
                        Files.delete(hashDir);
                    }
                }
            }
        } catch (IOException e) {
            logger.warn("Worktree cleanup under {} did not complete", baseDir, e);
        }
    }

    private WorktreeRecord require(String sessionId) throws WorktreeNotFoundException {
        var record = registry.get(sessionId);
        if (record == null) {
            throw new WorktreeNotFoundException(sessionId);
        }
        return record;
    }

    /**
     * Apply a patch produced by {@code git diff --binary}. With {@code threeWay}, a failed three-way
     * apply is retried as a plain apply.
     */
    private static void applyPatch(Path directory, String patch, boolean threeWay) throws PatchApplyException {
        if (patch.isBlank()) {
            return;
        }
        Path patchFile;
        try {
            patchFile = Files.createTempFile("agentdeck-", ".patch");
            Files.writeString(patchFile, patch, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PatchApplyException("Failed to stage patch for " + directory, e);
        }
        try {
            if (threeWay) {
                try {
                    GitCommand.run(directory, "apply", "--3way", patchFile.toString());
                    return;
                } catch (GitCommandException e) {
                    logger.debug("Three-way apply failed in {}, retrying plain apply: {}", directory, e.getMessage());
                }
            }
            GitCommand.run(directory, "apply", patchFile.toString());
        } catch (GitCommandException e) {
            throw new PatchApplyException("Failed to apply patch in " + directory, e);
        } finally {
            try {
                Files.deleteIfExists(patchFile);
            } catch (IOException e) {
                logger.debug("Could not delete temporary patch {}", patchFile);
            }
        }
    }

    private static Repository openRepository(Path directory) throws IOException {
        var builder = new FileRepositoryBuilder().readEnvironment().findGitDir(directory.toFile());
        if (builder.getGitDir() == null) {
            throw new RepositoryNotFoundException(directory.toFile());
        }
        return builder.build();
    }

    private static String resolveCommit(Repository repository, String rev) throws IOException {
        var id = repository.resolve(rev + "^{commit}");
        if (id == null) {
            throw new IOException("Cannot resolve " + rev + " to a commit");
        }
        return id.getName();
    }

    @Nullable
    private static String mergeBase(Path project, String first, String second) {
        try (var repository = openRepository(project);
                var walk = new RevWalk(repository)) {
            walk.setRevFilter(RevFilter.MERGE_BASE);
            walk.markStart(walk.parseCommit(ObjectId.fromString(first)));
            walk.markStart(walk.parseCommit(ObjectId.fromString(second)));
            var base = walk.next();
            return base == null ? null : base.getName();
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Merge base lookup failed for {} and {}", first, second, e);
            return null;
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (var walk = Files.walk(path)) {
            for (var p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
