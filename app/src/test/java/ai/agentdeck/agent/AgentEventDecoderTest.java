package ai.agentdeck.agent;

import static ai.agentdeck.agent.ScriptedAgentRunner.event;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class AgentEventDecoderTest {

    @Test
    void testSystemInit() {
        var decoded = event("{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-1\",\"model\":\"m\","
                + "\"tools\":[\"Bash\",\"Read\"]}");

        var init = assertInstanceOf(AgentEvent.SystemInit.class, decoded);
        assertEquals("init", init.subtype());
        assertEquals("s-1", init.sessionId());
        assertEquals("m", init.model());
        assertEquals(List.of("Bash", "Read"), init.tools());
    }

    @Test
    void testOnlyContentBlockDeltasAreTextDeltas() {
        var delta = assertInstanceOf(AgentEvent.StreamDelta.class, ScriptedAgentRunner.textDelta("hi"));
        assertTrue(delta.isTextDelta());
        assertEquals("hi", delta.text());

        var start = assertInstanceOf(
                AgentEvent.StreamDelta.class,
                event("{\"type\":\"stream_event\",\"event\":{\"type\":\"message_start\",\"message\":{}}}"));
        assertFalse(start.isTextDelta());
        assertNull(start.text());
    }

    @Test
    void testAssistantTextIsConcatenated() {
        var decoded = event("{\"type\":\"assistant\",\"message\":{\"id\":\"msg_9\",\"content\":["
                + "{\"type\":\"text\",\"text\":\"Hello \"},"
                + "{\"type\":\"tool_use\",\"id\":\"t1\",\"name\":\"Bash\",\"input\":{}},"
                + "{\"type\":\"text\",\"text\":\"world\"}]}}");

        var message = assertInstanceOf(AgentEvent.AssistantMessage.class, decoded);
        assertEquals("msg_9", message.messageId());
        assertEquals("Hello world", message.text());
    }

    @Test
    void testToolResultsFromUserMessages() {
        var decoded = event("{\"type\":\"user\",\"message\":{\"content\":["
                + "{\"type\":\"tool_result\",\"tool_use_id\":\"t1\",\"is_error\":true,\"content\":\"boom\"}]}}");

        var result = assertInstanceOf(AgentEvent.ToolResult.class, decoded);
        assertEquals("t1", result.toolUseId());
        assertTrue(result.isError());

        assertInstanceOf(
                AgentEvent.Unknown.class, event("{\"type\":\"user\",\"message\":{\"content\":\"plain text\"}}"));
    }

    @Test
    void testSuccessfulResultIsNormalised() {
        var decoded = event("{\"type\":\"result\",\"subtype\":\"success\",\"session_id\":\"s\",\"result\":\"done\","
                + "\"total_cost_usd\":0.25,\"duration_ms\":1200,\"duration_api_ms\":900,\"num_turns\":3}");

        var result = assertInstanceOf(AgentEvent.TurnResult.class, decoded);
        assertTrue(result.success());
        assertEquals("done", result.result());
        assertNull(result.error());
        assertEquals(0.25, result.costUsd());
        assertEquals(1200L, result.durationMs());
        assertEquals(900L, result.durationApiMs());
        assertEquals(3, result.numTurns());
        assertFalse(result.raw().get("is_error").asBoolean());
        assertEquals(0.25, result.raw().get("cost_usd").asDouble());
    }

    @Test
    void testErrorResultJoinsErrors() {
        var decoded = event("{\"type\":\"result\",\"subtype\":\"error_during_execution\",\"errors\":[\"a\",\"b\"]}");

        var result = assertInstanceOf(AgentEvent.TurnResult.class, decoded);
        assertFalse(result.success());
        assertEquals("a\nb", result.error());
        assertEquals("error", result.raw().get("subtype").asText());
        assertTrue(result.raw().get("is_error").asBoolean());
    }

    @Test
    void testUnrecognisedTypesBecomeUnknown() {
        var decoded = event("{\"type\":\"hook_response\",\"x\":1}");
        var unknown = assertInstanceOf(AgentEvent.Unknown.class, decoded);
        assertEquals("hook_response", unknown.type());

        assertInstanceOf(AgentEvent.Unknown.class, event("{\"no_type\":true}"));
    }

    @Test
    void testSyntheticProcessEvents() {
        var error = AgentEvent.ProcessError.of(2, "Agent exited with code 2");
        assertEquals("process_error", error.type());
        assertEquals(2, error.raw().get("code").asInt());

        var stderr = AgentEvent.ProcessStderr.of("warning");
        assertEquals("warning", stderr.raw().get("line").asText());
    }
}
