package ai.agentdeck.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One event of an agent turn. The set of variants is closed; records the decoder does not
 * recognise become {@link Unknown} and are not forwarded to observers.
 *
 * <p>Every variant keeps the upstream JSON in {@link #raw()} so consumers that need fields not
 * lifted into the record can still read them.
 */
public sealed interface AgentEvent {

    JsonNode raw();

    /** The upstream {@code type} discriminator. */
    String type();

    record SystemInit(
            JsonNode raw, String subtype, @Nullable String sessionId, @Nullable String model, List<String> tools)
            implements AgentEvent {
        public SystemInit {
            tools = List.copyOf(tools);
        }

        @Override
        public String type() {
            return "system";
        }
    }

    /**
     * A partial-message record. {@code innerType} is the wrapped stream event's type, e.g.
     * {@code content_block_delta} or {@code message_start}.
     */
    record StreamDelta(JsonNode raw, String innerType, @Nullable String text) implements AgentEvent {
        public static final String CONTENT_BLOCK_DELTA = "content_block_delta";

        public boolean isTextDelta() {
            return CONTENT_BLOCK_DELTA.equals(innerType);
        }

        @Override
        public String type() {
            return "stream_event";
        }
    }

    record AssistantMessage(JsonNode raw, @Nullable String messageId, String text) implements AgentEvent {
        @Override
        public String type() {
            return "assistant";
        }
    }

    record ToolResult(JsonNode raw, @Nullable String toolUseId, boolean isError) implements AgentEvent {
        @Override
        public String type() {
            return "tool_result";
        }
    }

    record TurnResult(
            JsonNode raw,
            boolean success,
            @Nullable String result,
            @Nullable String error,
            @Nullable Double costUsd,
            @Nullable Long durationMs,
            @Nullable Long durationApiMs,
            @Nullable Integer numTurns)
            implements AgentEvent {
        @Override
        public String type() {
            return "result";
        }
    }

    record ProcessError(JsonNode raw, int exitCode, String message) implements AgentEvent {
        public static ProcessError of(int exitCode, String message) {
            var node = JsonNodeFactory.instance.objectNode();
            node.put("type", "process_error");
            node.put("code", exitCode);
            node.put("message", message);
            return new ProcessError(node, exitCode, message);
        }

        @Override
        public String type() {
            return "process_error";
        }
    }

    record ProcessStderr(JsonNode raw, String line) implements AgentEvent {
        public static ProcessStderr of(String line) {
            var node = JsonNodeFactory.instance.objectNode();
            node.put("type", "process_stderr");
            node.put("line", line);
            return new ProcessStderr(node, line);
        }

        @Override
        public String type() {
            return "process_stderr";
        }
    }

    record Unknown(JsonNode raw, String type) implements AgentEvent {}
}
