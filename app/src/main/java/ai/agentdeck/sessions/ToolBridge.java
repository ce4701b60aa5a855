package ai.agentdeck.sessions;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * MCP server configuration that exposes the IDE's terminal and browser panels to the agent.
 * Active only once the bridge port and token are known and the bridge script exists.
 */
final class ToolBridge {
    private static final Logger logger = LogManager.getLogger(ToolBridge.class);
    static final String SERVER_NAME = "agentdeck-bridge";
    static final String SYSTEM_PROMPT_APPEND = "You are running inside AgentDeck, a desktop IDE. "
            + "You have MCP tools for the IDE's terminal and browser panels. "
            + "Terminal commands and browser navigation are visible to the user in real-time. "
            + "Use terminal_execute to run commands and terminal_read to check output. "
            + "Use browser_navigate, browser_content, and browser_screenshot to interact with web pages.";

    private final @Nullable Path script;
    private volatile int port;
    private volatile @Nullable String token;

    ToolBridge(@Nullable Path script) {
        this.script = script;
    }

    void setBridgeInfo(int port, String token) {
        this.port = port;
        this.token = token;
    }

    /**
     * @return the {@code --mcp-config} document for a session in {@code projectPath}, or null when the
     *     bridge is not available
     */
    @Nullable
    ObjectNode mcpConfig(String projectPath) {
        var currentToken = token;
        if (port <= 0 || currentToken == null || currentToken.isEmpty() || script == null) {
            return null;
        }
        if (!Files.isRegularFile(script)) {
            logger.warn("MCP bridge script not found: {}", script);
            return null;
        }

        var factory = JsonNodeFactory.instance;
        var env = factory.objectNode();
        env.put("AGENTDECK_BRIDGE_PORT", String.valueOf(port));
        env.put("AGENTDECK_BRIDGE_TOKEN", currentToken);
        env.put("AGENTDECK_PROJECT_PATH", projectPath);

        var server = factory.objectNode();
        server.put("command", "node");
        server.putArray("args").add(script.toString());
        server.set("env", env);

        var config = factory.objectNode();
        config.putObject("mcpServers").set(SERVER_NAME, server);
        return config;
    }
}
