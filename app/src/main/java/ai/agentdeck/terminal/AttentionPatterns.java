package ai.agentdeck.terminal;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Prompts that suggest an agent in a terminal is waiting for the user.
 */
public final class AttentionPatterns {
    public static final List<String> DEFAULT_SOURCES = List.of(
            "\\b(allow|approve|permission|accept)\\b", "\\(y/n\\)", "\\(yes/no\\)", "do you want", "would you like");

    private AttentionPatterns() {}

    public static List<Pattern> compile(List<String> sources) {
        return sources.stream()
                .map(source -> Pattern.compile(source, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
