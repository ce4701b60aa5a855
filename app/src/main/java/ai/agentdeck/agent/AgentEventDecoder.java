package ai.agentdeck.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.jetbrains.annotations.Nullable;

/**
 * Maps raw stream-json records of the agent CLI onto {@link AgentEvent} variants.
 */
public final class AgentEventDecoder {
    private AgentEventDecoder() {}

    public static AgentEvent decode(JsonNode node) {
        var type = textOrNull(node, "type");
        if (type == null) {
            return new AgentEvent.Unknown(node, "");
        }
        return switch (type) {
            case "system" -> decodeSystem(node);
            case "stream_event" -> decodeStreamEvent(node);
            case "assistant" -> decodeAssistant(node);
            case "tool_result" ->
                new AgentEvent.ToolResult(node, textOrNull(node, "tool_use_id"), node.path("is_error").asBoolean(false));
            case "user" -> decodeUser(node);
            case "result" -> decodeResult(node);
            default -> new AgentEvent.Unknown(node, type);
        };
    }

    private static AgentEvent decodeSystem(JsonNode node) {
        var tools = new ArrayList<String>();
        for (var tool : node.path("tools")) {
            if (tool.isTextual()) {
                tools.add(tool.asText());
            }
        }
        var subtype = textOrNull(node, "subtype");
        return new AgentEvent.SystemInit(
                node, subtype != null ? subtype : "init", textOrNull(node, "session_id"), textOrNull(node, "model"), tools);
    }

    private static AgentEvent decodeStreamEvent(JsonNode node) {
        var inner = node.path("event");
        var innerType = textOrNull(inner, "type");
        if (innerType == null) {
            return new AgentEvent.Unknown(node, "stream_event");
        }
        return new AgentEvent.StreamDelta(node, innerType, textOrNull(inner.path("delta"), "text"));
    }

    private static AgentEvent decodeAssistant(JsonNode node) {
        var message = node.path("message");
        var text = StreamSupport.stream(message.path("content").spliterator(), false)
                .filter(block -> "text".equals(textOrNull(block, "type")))
                .map(block -> block.path("text").asText(""))
                .collect(Collectors.joining());
        return new AgentEvent.AssistantMessage(node, textOrNull(message, "id"), text);
    }

    // tool results arrive as user messages whose content carries a tool_result block
    private static AgentEvent decodeUser(JsonNode node) {
        for (var block : node.path("message").path("content")) {
            if ("tool_result".equals(textOrNull(block, "type"))) {
                return new AgentEvent.ToolResult(
                        node, textOrNull(block, "tool_use_id"), block.path("is_error").asBoolean(false));
            }
        }
        return new AgentEvent.Unknown(node, "user");
    }

    private static AgentEvent decodeResult(JsonNode node) {
        boolean success = "success".equals(textOrNull(node, "subtype"));

        String error = null;
        var errors = node.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            error = StreamSupport.stream(errors.spliterator(), false)
                    .map(JsonNode::asText)
                    .collect(Collectors.joining("\n"));
        }

        var result = textOrNull(node, "result");
        var cost = node.hasNonNull("total_cost_usd") ? node.get("total_cost_usd").asDouble() : null;
        var durationMs = node.hasNonNull("duration_ms") ? node.get("duration_ms").asLong() : null;
        var durationApiMs = node.hasNonNull("duration_api_ms") ? node.get("duration_api_ms").asLong() : null;
        var numTurns = node.hasNonNull("num_turns") ? node.get("num_turns").asInt() : null;

        ObjectNode normalized = JsonNodeFactory.instance.objectNode();
        normalized.put("type", "result");
        normalized.put("subtype", success ? "success" : "error");
        if (node.hasNonNull("session_id")) {
            normalized.put("session_id", node.get("session_id").asText());
        }
        normalized.put("is_error", !success);
        if (cost != null) {
            normalized.put("total_cost_usd", cost);
            normalized.put("cost_usd", cost);
        }
        if (numTurns != null) {
            normalized.put("num_turns", numTurns);
        }
        if (durationMs != null) {
            normalized.put("duration_ms", durationMs);
        }
        if (durationApiMs != null) {
            normalized.put("duration_api_ms", durationApiMs);
        }
        if (result != null) {
            normalized.put("result", result);
        }
        if (error != null) {
            normalized.put("error", error);
        }

        return new AgentEvent.TurnResult(normalized, success, result, error, cost, durationMs, durationApiMs, numTurns);
    }

    @Nullable
    private static String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
