package ai.agentdeck.transcript;

import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Follows session transcripts that another process appends to.
 *
 * <p>Each consumer has at most one watch. A watch with a known log id stays on that file; one
 * without follows whichever transcript in the project's directory was modified most recently,
 * delivering the full content of a newly adopted file through {@link TailListener#onReset}.
 * Appends are read from a per-file byte offset and delivered as whole lines only. A file that
 * shrinks below the offset was rewritten and is re-read from the start as a reset.
 *
 * <p>Change detection combines interval polling with native file system notifications. All
 * reads and listener callbacks run on one shared scheduler thread.
 */
public final class SessionLogTail implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SessionLogTail.class);

    private final TranscriptLocator locator;
    private final TailListener listener;
    private final TailSettings settings;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, Watch> watches = new ConcurrentHashMap<>();

    public SessionLogTail(TranscriptLocator locator, TailListener listener) {
        this(locator, listener, TailSettings.defaults());
    }

    public SessionLogTail(TranscriptLocator locator, TailListener listener, TailSettings settings) {
        this.locator = locator;
        this.listener = listener;
        this.settings = settings;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "SessionLogTail");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start following a transcript for {@code consumerId}, replacing any existing watch of that consumer.
     *
     * @param knownLogId the transcript to follow, or null to follow the newest one in the project
     * @return the entries already present when the watch attached
     */
    public List<TranscriptEntry> watch(String consumerId, @Nullable String knownLogId, String projectPath) {
        unwatch(consumerId);

        var watch = new Watch(consumerId, locator.projectDir(projectPath), knownLogId != null);
        watches.put(consumerId, watch);

        List<TranscriptEntry> initial;
        synchronized (watch) {
            if (knownLogId != null) {
                watch.activeFile = locator.logFile(projectPath, knownLogId);
                if (Files.isRegularFile(watch.activeFile)) {
                    initial = readInitial(watch);
                } else {
                    logger.debug("Transcript {} not present yet; waiting for it", watch.activeFile);
                    initial = List.of();
                    startAttachPolling(watch);
                }
            } else {
                var latest = TranscriptLocator.findLatest(watch.projectDir);
                if (latest != null) {
                    watch.activeFile = latest;
                    initial = readInitial(watch);
                } else {
                    initial = List.of();
                }
            }

            long interval = settings.contentPollInterval().toMillis();
            watch.pollTask = scheduler.scheduleWithFixedDelay(() -> pollQuietly(watch), interval, interval, TimeUnit.MILLISECONDS);
            startNativeWatch(watch);
        }

        logger.info(
                "Watching transcripts for {} in {} (logId={}, {} initial entries)",
                consumerId,
                watch.projectDir,
                knownLogId,
                initial.size());
        return initial;
    }

    /** Stop the consumer's watch and release its timers and watcher thread. Safe to call repeatedly. */
    public void unwatch(String consumerId) {
        var watch = watches.remove(consumerId);
        if (watch == null) {
            return;
        }
        closeWatch(watch);
        logger.debug("Stopped watching transcripts for {}", consumerId);
    }

    /** One-shot read of a whole transcript; empty if it does not exist. */
    public List<TranscriptEntry> readAll(String logId, String projectPath) throws IOException {
        var file = locator.logFile(projectPath, logId);
        try {
            return TranscriptEntry.parseLines(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return List.of();
        }
    }

    @Nullable
    public String findLatestLogId(String projectPath) {
        var latest = TranscriptLocator.findLatest(locator.projectDir(projectPath));
        return latest == null ? null : TranscriptLocator.logIdOf(latest);
    }

    /** The log id currently followed by the consumer, if any. */
    @Nullable
    public String activeLogId(String consumerId) {
        var watch = watches.get(consumerId);
        if (watch == null) {
            return null;
        }
        synchronized (watch) {
            return watch.activeFile == null ? null : TranscriptLocator.logIdOf(watch.activeFile);
        }
    }

    /** Run one poll cycle for the consumer on the calling thread. */
    void pollNow(String consumerId) {
        var watch = watches.get(consumerId);
        if (watch != null) {
            poll(watch);
        }
    }

    /** Run one attach attempt for the consumer on the calling thread. */
    void attachNow(String consumerId) {
        var watch = watches.get(consumerId);
        if (watch != null) {
            attachAttempt(watch);
        }
    }

    @Override
    public void close() {
        for (var consumerId : List.copyOf(watches.keySet())) {
            unwatch(consumerId);
        }
        scheduler.shutdownNow();
    }

    private List<TranscriptEntry> readInitial(Watch watch) {
        assert Thread.holdsLock(watch);
        watch.offset = 0;
        try {
            var chunk = readCompleteLines(watch.activeFile, 0);
            watch.offset = chunk.nextOffset();
            return chunk.entries();
        } catch (IOException e) {
            logger.warn("Failed to read transcript {}", watch.activeFile, e);
            return List.of();
        }
    }

    private void startAttachPolling(Watch watch) {
        assert Thread.holdsLock(watch);
        long interval = settings.attachPollInterval().toMillis();
        watch.attachTask = scheduler.scheduleWithFixedDelay(
                () -> {
                    try {
                        attachAttempt(watch);
                    } catch (RuntimeException e) {
                        logger.warn("Attach attempt failed for {}", watch.consumerId, e);
                    }
                },
                interval,
                interval,
                TimeUnit.MILLISECONDS);
    }

    private void attachAttempt(Watch watch) {
        synchronized (watch) {
            if (watch.closed || watch.attachTask == null) {
                return;
            }
            if (Files.isRegularFile(watch.activeFile)) {
                cancelAttach(watch);
                logger.debug("Transcript {} appeared", watch.activeFile);
                readNewContent(watch);
                startNativeWatch(watch);
                return;
            }
            watch.attachAttempts++;
            if (watch.attachAttempts >= settings.attachMaxAttempts()) {
                cancelAttach(watch);
                var seconds = settings.attachPollInterval().multipliedBy(settings.attachMaxAttempts()).toSeconds();
                var message = "Session file not found after " + seconds + "s: " + watch.activeFile;
                logger.warn(message);
                notifyListener(watch, "onNotFound", () -> listener.onNotFound(watch.consumerId, message));
            }
        }
    }

    private void cancelAttach(Watch watch) {
        if (watch.attachTask != null) {
            watch.attachTask.cancel(false);
            watch.attachTask = null;
        }
    }

    // an exception escaping a fixed-delay task would cancel all of its later runs
    private void pollQuietly(Watch watch) {
        try {
            poll(watch);
        } catch (RuntimeException e) {
            logger.warn("Transcript poll failed for {}", watch.consumerId, e);
        }
    }

    private void notifyListener(Watch watch, String callback, Runnable delivery) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            logger.warn("Tail listener {} failed for {}", callback, watch.consumerId, e);
        }
    }

    private void poll(Watch watch) {
        synchronized (watch) {
            if (watch.closed) {
                return;
            }
            if (!watch.pinned) {
                var latest = TranscriptLocator.findLatest(watch.projectDir);
                if (latest != null && !latest.equals(watch.activeFile)) {
                    switchTo(watch, latest);
                    return;
                }
            }
            if (watch.nativeWatcher == null) {
                startNativeWatch(watch);
            }
            readNewContent(watch);
        }
    }

    private void switchTo(Watch watch, Path file) {
        assert Thread.holdsLock(watch);
        logger.info("Consumer {} switching to transcript {}", watch.consumerId, file.getFileName());
        watch.activeFile = file;
        var entries = readInitial(watch);
        notifyListener(watch, "onReset", () -> listener.onReset(watch.consumerId, entries));
    }

    private void readNewContent(Watch watch) {
        assert Thread.holdsLock(watch);
        var file = watch.activeFile;
        if (file == null || !Files.isRegularFile(file)) {
            return;
        }
        try {
            long size = Files.size(file);
            if (size < watch.offset) {
                logger.info("Transcript {} was rewritten ({} < {}); re-reading", file.getFileName(), size, watch.offset);
                var entries = readInitial(watch);
                notifyListener(watch, "onReset", () -> listener.onReset(watch.consumerId, entries));
                return;
            }
            if (size == watch.offset) {
                return;
            }
            var chunk = readCompleteLines(file, watch.offset);
            watch.offset = chunk.nextOffset();
            if (!chunk.entries().isEmpty()) {
                notifyListener(watch, "onEntries", () -> listener.onEntries(watch.consumerId, chunk.entries()));
            }
        } catch (NoSuchFileException e) {
            logger.debug("Transcript {} disappeared", file);
        } catch (IOException e) {
            logger.warn("Failed to read transcript {}", file, e);
        }
    }

    private void startNativeWatch(Watch watch) {
        assert Thread.holdsLock(watch);
        if (!settings.nativeWatch() || watch.nativeWatcher != null || watch.closed) {
            return;
        }
        if (!Files.isDirectory(watch.projectDir)) {
            return;
        }
        DirectoryWatcher watcher;
        try {
            watcher = DirectoryWatcher.builder()
                    .path(watch.projectDir)
                    .listener(event -> onNativeEvent(watch, event))
                    .fileHashing(false)
                    .build();
        } catch (IOException e) {
            logger.warn("Native watch unavailable for {}; relying on polling", watch.projectDir, e);
            return;
        }
        watch.nativeWatcher = watcher;

        var thread = new Thread(
                () -> {
                    try {
                        watcher.watch();
                    } catch (RuntimeException e) {
                        logger.warn("Native transcript watcher for {} stopped", watch.projectDir, e);
                    }
                },
                "TranscriptWatcher-" + watch.consumerId);
        thread.setDaemon(true);
        thread.start();
    }

    private void onNativeEvent(Watch watch, DirectoryChangeEvent event) {
        var path = event.path();
        if (path == null || !path.getFileName().toString().endsWith(TranscriptLocator.LOG_SUFFIX)) {
            return;
        }
        try {
            scheduler.execute(() -> {
                synchronized (watch) {
                    if (watch.closed) {
                        return;
                    }
                    // the watcher may report the directory through a different (resolved) path
                    if (watch.activeFile != null && path.getFileName().equals(watch.activeFile.getFileName())) {
                        readNewContent(watch);
                        return;
                    }
                }
                if (!watch.pinned) {
                    pollQuietly(watch);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.trace("Ignoring change to {} after shutdown", path);
        }
    }

    private void closeWatch(Watch watch) {
        DirectoryWatcher nativeWatcher;
        synchronized (watch) {
            watch.closed = true;
            cancelAttach(watch);
            if (watch.pollTask != null) {
                watch.pollTask.cancel(false);
                watch.pollTask = null;
            }
            nativeWatcher = watch.nativeWatcher;
            watch.nativeWatcher = null;
        }
        if (nativeWatcher != null) {
            try {
                nativeWatcher.close();
            } catch (IOException e) {
                logger.warn("Failed to close native watcher for {}", watch.projectDir, e);
            }
        }
    }

    /**
     * Reads from {@code from} to the last newline currently in the file. A trailing line without a
     * newline is left for the next read.
     */
    static Chunk readCompleteLines(Path file, long from) throws IOException {
        try (var channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size <= from) {
                return new Chunk(List.of(), from);
            }
            var buffer = ByteBuffer.allocate(Math.toIntExact(size - from));
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, from + buffer.position());
                if (read < 0) {
                    break;
                }
            }
            var bytes = buffer.array();
            int end = buffer.position() - 1;
            while (end >= 0 && bytes[end] != '\n') {
                end--;
            }
            if (end < 0) {
                return new Chunk(List.of(), from);
            }
            var text = new String(bytes, 0, end + 1, StandardCharsets.UTF_8);
            return new Chunk(TranscriptEntry.parseLines(text), from + end + 1);
        }
    }

    record Chunk(List<TranscriptEntry> entries, long nextOffset) {}

    private static final class Watch {
        final String consumerId;
        final Path projectDir;
        final boolean pinned;

        @Nullable
        Path activeFile;

        long offset;
        int attachAttempts;
        boolean closed;

        @Nullable
        ScheduledFuture<?> pollTask;

        @Nullable
        ScheduledFuture<?> attachTask;

        @Nullable
        DirectoryWatcher nativeWatcher;

        Watch(String consumerId, Path projectDir, boolean pinned) {
            this.consumerId = consumerId;
            this.projectDir = projectDir;
            this.pinned = pinned;
        }
    }
}
