package ai.agentdeck.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Incremental decoder for newline-delimited JSON.
 *
 * <p>Chunks may split a record anywhere; the trailing incomplete line is buffered until the next
 * {@link #feed(String)} or {@link #flush()}. A line that is not valid JSON is reported through
 * {@link Listener#onParseError(String)} and parsing continues with the next line. Not thread-safe;
 * one parser serves one stream.
 */
public final class StreamParser {
    private static final Logger logger = LogManager.getLogger(StreamParser.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    public interface Listener {
        void onRecord(JsonNode record);

        void onParseError(String rawLine);
    }

    private final Listener listener;
    private final StringBuilder buffer = new StringBuilder();

    public StreamParser(Listener listener) {
        this.listener = listener;
    }

    public void feed(String chunk) {
        if (chunk.isEmpty()) {
            return;
        }
        buffer.append(chunk);
        if (chunk.indexOf('\n') < 0) {
            return;
        }

        var lines = new ArrayList<String>();
        LINE_SPLITTER.split(buffer).forEach(lines::add);
        // last element is the unterminated remainder (possibly empty)
        var remainder = lines.remove(lines.size() - 1);
        buffer.setLength(0);
        buffer.append(remainder);

        for (var line : lines) {
            parseLine(line);
        }
    }

    /** Parse whatever remains in the buffer as a final line, then clear. */
    public void flush() {
        if (buffer.length() == 0) {
            return;
        }
        var remainder = buffer.toString();
        buffer.setLength(0);
        parseLine(remainder);
    }

    /** Discard buffered state so the parser can be reused for a new stream. */
    public void reset() {
        buffer.setLength(0);
    }

    private void parseLine(String line) {
        var trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(trimmed);
        } catch (JsonProcessingException e) {
            logger.debug("Unparseable stream line ({} chars): {}", trimmed.length(), e.getOriginalMessage());
            listener.onParseError(trimmed);
            return;
        }
        if (node == null || node.isMissingNode()) {
            listener.onParseError(trimmed);
            return;
        }
        listener.onRecord(node);
    }
}
