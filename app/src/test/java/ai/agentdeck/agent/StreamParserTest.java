package ai.agentdeck.agent;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class StreamParserTest {

    private final List<JsonNode> records = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final StreamParser parser = new StreamParser(new StreamParser.Listener() {
        @Override
        public void onRecord(JsonNode record) {
            records.add(record);
        }

        @Override
        public void onParseError(String rawLine) {
            errors.add(rawLine);
        }
    });

    private List<Integer> numbers() {
        return records.stream().map(r -> r.get("n").asInt()).toList();
    }

    @Test
    void testAnySplitPointYieldsSameRecords() {
        var input = "{\"type\":\"system\",\"n\":1}\n{\"type\":\"assistant\",\"n\":2,\"text\":\"a\\nb\"}\n\n"
                + "  {\"type\":\"result\",\"n\":3}  \n";

        for (int i = 0; i <= input.length(); i++) {
            records.clear();
            parser.reset();

            parser.feed(input.substring(0, i));
            parser.feed(input.substring(i));

            assertEquals(List.of(1, 2, 3), numbers(), "split at " + i);
        }
        assertTrue(errors.isEmpty());
    }

    @Test
    void testCharacterByCharacterFeeding() {
        var input = "{\"n\":1}\n{\"n\":2}\n";
        for (char c : input.toCharArray()) {
            parser.feed(String.valueOf(c));
        }
        assertEquals(List.of(1, 2), numbers());
    }

    @Test
    void testMalformedLineIsReportedAndParsingContinues() {
        parser.feed("{\"n\":1}\nthis is not json\n{\"n\":2}\n");

        assertEquals(List.of(1, 2), numbers());
        assertEquals(List.of("this is not json"), errors);
    }

    @Test
    void testIncompleteLineWaitsForNewline() {
        parser.feed("{\"n\":1}\n{\"n\":");
        assertEquals(List.of(1), numbers());

        parser.feed("2}\n");
        assertEquals(List.of(1, 2), numbers());
    }

    @Test
    void testFlushParsesTrailingPartialLine() {
        parser.feed("{\"n\":1}\n{\"n\":2}");
        assertEquals(List.of(1), numbers());

        parser.flush();
        assertEquals(List.of(1, 2), numbers());

        parser.flush();
        assertEquals(List.of(1, 2), numbers());
    }

    @Test
    void testResetDiscardsBufferedPartialLine() {
        parser.feed("{\"n\":1");
        parser.reset();
        parser.feed("{\"n\":5}\n");

        assertEquals(List.of(5), numbers());
        assertTrue(errors.isEmpty());
    }

    @Test
    void testBlankLinesAreIgnored() {
        parser.feed("\n\n   \n\r\n");
        parser.flush();

        assertTrue(records.isEmpty());
        assertTrue(errors.isEmpty());
    }
}
