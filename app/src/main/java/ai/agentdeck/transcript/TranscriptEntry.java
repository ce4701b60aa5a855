package ai.agentdeck.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * One line of a session transcript.
 */
public record TranscriptEntry(String type, JsonNode raw) {
    private static final Logger logger = LogManager.getLogger(TranscriptEntry.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Splitter LINE_SPLITTER = Splitter.on('\n').trimResults().omitEmptyStrings();

    public enum Kind {
        USER,
        ASSISTANT,
        OTHER
    }

    public Kind kind() {
        return switch (type) {
            case "user" -> Kind.USER;
            case "assistant" -> Kind.ASSISTANT;
            default -> Kind.OTHER;
        };
    }

    /**
     * Decode newline-separated transcript text. Malformed lines and objects without a textual
     * {@code type} are skipped.
     */
    public static List<TranscriptEntry> parseLines(String text) {
        var entries = new ArrayList<TranscriptEntry>();
        for (var line : LINE_SPLITTER.split(text)) {
            JsonNode node;
            try {
                node = OBJECT_MAPPER.readTree(line);
            } catch (JsonProcessingException e) {
                logger.debug("Skipping malformed transcript line: {}", e.getOriginalMessage());
                continue;
            }
            if (node == null || !node.isObject()) {
                continue;
            }
            var type = node.get("type");
            if (type == null || !type.isTextual()) {
                continue;
            }
            entries.add(new TranscriptEntry(type.asText(), node));
        }
        return entries;
    }
}
