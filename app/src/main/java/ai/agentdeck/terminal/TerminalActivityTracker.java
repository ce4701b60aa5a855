package ai.agentdeck.terminal;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Guesses what an agent CLI running in a raw terminal is doing from its output alone.
 *
 * <p>Output moves the tracker to {@link TerminalStatus#RUNNING}. After a period of silence the
 * last lines are matched against the attention patterns: a match means the agent is probably
 * waiting on the user ({@link TerminalStatus#ATTENTION}), otherwise it is {@link TerminalStatus#IDLE}.
 * Process exit is {@link TerminalStatus#DONE} and final.
 */
public final class TerminalActivityTracker implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(TerminalActivityTracker.class);
    private static final int MAX_LINES = 1000;
    private static final int LINES_CHECKED = 5;
    private static final Pattern ANSI_ESCAPES = Pattern.compile(
            "\\x1b\\[[0-9;]*[a-zA-Z]|\\x1b\\].*?(?:\\x07|\\x1b\\\\)|\\x1b[()][0-9A-B]|\\x1b[>=<]|\\x1b\\[[?]?[0-9;]*[hlm]");

    @FunctionalInterface
    public interface Listener {
        void onStatusChanged(String terminalId, TerminalStatus previous, TerminalStatus current);
    }

    private final String terminalId;
    private final ScheduledExecutorService scheduler;
    private final Duration silenceTimeout;
    private final List<Pattern> attentionPatterns;
    private final Listener listener;

    private final Deque<String> lines = new ArrayDeque<>();
    private String partialLine = "";
    private TerminalStatus status = TerminalStatus.IDLE;
    private boolean hasBeenRunning;
    private int idleCycleCount;
    private @Nullable ScheduledFuture<?> silenceTimer;
    private long silenceGeneration;

    public TerminalActivityTracker(
            String terminalId,
            ScheduledExecutorService scheduler,
            Duration silenceTimeout,
            List<Pattern> attentionPatterns,
            Listener listener) {
        this.terminalId = terminalId;
        this.scheduler = scheduler;
        this.silenceTimeout = silenceTimeout;
        this.attentionPatterns = List.copyOf(attentionPatterns);
        this.listener = listener;
    }

    public synchronized void onData(String data) {
        if (status == TerminalStatus.DONE) {
            return;
        }
        var combined = partialLine + data;
        int start = 0;
        int newline;
        while ((newline = combined.indexOf('\n', start)) >= 0) {
            addLine(stripAnsi(combined.substring(start, newline)));
            start = newline + 1;
        }
        partialLine = combined.substring(start);

        transition(TerminalStatus.RUNNING);
        restartSilenceTimer();
    }

    /**
     * Timer callback. A run scheduled before the latest output (or before a cancel) may already
     * be waiting on the monitor; it finds a newer generation and does nothing.
     */
    synchronized void silenceElapsed(long generation) {
        if (generation != silenceGeneration) {
            return;
        }
        silenceTimer = null;
        onSilence();
    }

    /** Called when no output arrived for the silence timeout. */
    synchronized void onSilence() {
        if (status == TerminalStatus.DONE) {
            return;
        }
        var text = String.join("\n", recentLines());
        boolean needsAttention = attentionPatterns.stream().anyMatch(p -> p.matcher(text).find());
        transition(needsAttention ? TerminalStatus.ATTENTION : TerminalStatus.IDLE);
    }

    public synchronized void onExit() {
        cancelSilenceTimer();
        transition(TerminalStatus.DONE);
    }

    public synchronized TerminalStatus status() {
        return status;
    }

    /** Number of RUNNING to IDLE/ATTENTION transitions seen so far. */
    public synchronized int idleCycleCount() {
        return idleCycleCount;
    }

    /** The last {@code count} output lines, ANSI escapes removed. */
    public synchronized List<String> lastLines(int count) {
        var all = new ArrayList<>(lines);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    @Override
    public synchronized void close() {
        cancelSilenceTimer();
    }

    private List<String> recentLines() {
        var recent = new ArrayList<>(lastLines(LINES_CHECKED));
        // prompts are often printed without a trailing newline
        if (!partialLine.isBlank()) {
            recent.add(stripAnsi(partialLine));
        }
        return recent;
    }

    private void addLine(String line) {
        lines.addLast(line);
        if (lines.size() > MAX_LINES) {
            lines.removeFirst();
        }
    }

    private void transition(TerminalStatus next) {
        var previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        if (next == TerminalStatus.RUNNING) {
            hasBeenRunning = true;
        }
        if (hasBeenRunning
                && previous == TerminalStatus.RUNNING
                && (next == TerminalStatus.IDLE || next == TerminalStatus.ATTENTION)) {
            idleCycleCount++;
        }
        logger.debug("Terminal {} status {} -> {}", terminalId, previous, next);
        try {
            listener.onStatusChanged(terminalId, previous, next);
        } catch (RuntimeException e) {
            logger.warn("Status listener failed for terminal {}", terminalId, e);
        }
    }

    synchronized long silenceGeneration() {
        return silenceGeneration;
    }

    private void restartSilenceTimer() {
        cancelSilenceTimer();
        long generation = silenceGeneration;
        silenceTimer = scheduler.schedule(
                () -> silenceElapsed(generation), silenceTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void cancelSilenceTimer() {
        silenceGeneration++;
        if (silenceTimer != null) {
            silenceTimer.cancel(false);
            silenceTimer = null;
        }
    }

    static String stripAnsi(String text) {
        return ANSI_ESCAPES.matcher(text).replaceAll("").replace("\r", "");
    }
}
