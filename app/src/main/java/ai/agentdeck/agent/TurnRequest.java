package ai.agentdeck.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/**
 * Everything an {@link AgentRunner} needs to execute one turn.
 *
 * @param resume true to continue the conversation identified by {@code sessionId}, false to create it
 * @param mcpConfig tool bridge configuration in the CLI's {@code --mcp-config} shape, or null for none
 */
public record TurnRequest(
        String prompt,
        String sessionId,
        boolean resume,
        Path workingDirectory,
        @Nullable String model,
        @Nullable ObjectNode mcpConfig,
        @Nullable String systemPromptAppend) {

    public TurnRequest {
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }
}
