package ai.agentdeck.sessions;

import ai.agentdeck.agent.AgentEvent;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Batches consecutive text deltas per session.
 *
 * <p>Text deltas are buffered and delivered as one batch on the next tick of the supplied executor,
 * or immediately once {@code maxBuffer} are pending. Any other event first flushes the buffered
 * deltas of its session, so order within a session is preserved. Must be driven from a single thread;
 * the tick executor is expected to run tasks on that same thread.
 */
final class DeltaCoalescer {
    static final int DEFAULT_MAX_BUFFER = 500;

    interface Sink {
        void deliverEvent(String sessionId, AgentEvent event);

        void deliverBatch(String sessionId, List<AgentEvent> batch);
    }

    private final Executor tick;
    private final int maxBuffer;
    private final Sink sink;
    private final Map<String, List<AgentEvent>> buffers = new HashMap<>();

    DeltaCoalescer(Executor tick, int maxBuffer, Sink sink) {
        if (maxBuffer < 1) {
            throw new IllegalArgumentException("maxBuffer must be at least 1");
        }
        this.tick = tick;
        this.maxBuffer = maxBuffer;
        this.sink = sink;
    }

    void accept(String sessionId, AgentEvent event) {
        if (event instanceof AgentEvent.StreamDelta delta && delta.isTextDelta()) {
            var buffer = buffers.get(sessionId);
            if (buffer == null) {
                buffer = new ArrayList<>();
                buffers.put(sessionId, buffer);
                tick.execute(() -> flush(sessionId));
            }
            buffer.add(event);
            if (buffer.size() >= maxBuffer) {
                flush(sessionId);
            }
            return;
        }
        flush(sessionId);
        sink.deliverEvent(sessionId, event);
    }

    void flush(String sessionId) {
        var buffer = buffers.remove(sessionId);
        if (buffer != null && !buffer.isEmpty()) {
            sink.deliverBatch(sessionId, List.copyOf(buffer));
        }
    }
}
