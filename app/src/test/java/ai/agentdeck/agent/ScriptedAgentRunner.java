package ai.agentdeck.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.jetbrains.annotations.Nullable;

/**
 * In-process runner whose turns are driven by the test. A cancelled turn exits with 143, which
 * {@link AgentProcess} must report as a clean close.
 */
public final class ScriptedAgentRunner implements AgentRunner {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final class Turn {
        private final TurnRequest request;
        private final CancellationToken token;
        private final TurnListener listener;

        Turn(TurnRequest request, CancellationToken token, TurnListener listener) {
            this.request = request;
            this.token = token;
            this.listener = listener;
        }

        public TurnRequest request() {
            return request;
        }

        public boolean cancelled() {
            return token.isCancelled();
        }

        public void emit(AgentEvent event) {
            listener.onEvent(event);
        }

        public void exit(int exitCode) {
            listener.onExit(exitCode);
        }

        public void fail(Throwable error) {
            listener.onFailure(error);
        }
    }

    private final List<Turn> turns = new CopyOnWriteArrayList<>();
    private volatile @Nullable SpawnException nextFailure;
    private volatile boolean exitOnCancel = true;

    @Override
    public void launch(TurnRequest request, CancellationToken token, TurnListener listener) throws SpawnException {
        var failure = nextFailure;
        if (failure != null) {
            nextFailure = null;
            throw failure;
        }
        var turn = new Turn(request, token, listener);
        turns.add(turn);
        if (exitOnCancel) {
            token.onCancel(() -> listener.onExit(143));
        }
    }

    public void failNextLaunch(SpawnException failure) {
        this.nextFailure = failure;
    }

    public void setExitOnCancel(boolean exitOnCancel) {
        this.exitOnCancel = exitOnCancel;
    }

    public int launches() {
        return turns.size();
    }

    public Turn turn(int index) {
        return turns.get(index);
    }

    public Turn lastTurn() {
        return turns.get(turns.size() - 1);
    }

    public static AgentEvent event(String json) {
        try {
            return AgentEventDecoder.decode(OBJECT_MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(json, e);
        }
    }

    public static AgentEvent textDelta(String text) {
        return event("{\"type\":\"stream_event\",\"event\":{\"type\":\"content_block_delta\",\"index\":0,"
                + "\"delta\":{\"type\":\"text_delta\",\"text\":\"" + text + "\"}}}");
    }

    public static AgentEvent assistant(String text) {
        return event("{\"type\":\"assistant\",\"message\":{\"id\":\"msg_1\",\"content\":[{\"type\":\"text\",\"text\":\""
                + text + "\"}]}}");
    }
}
