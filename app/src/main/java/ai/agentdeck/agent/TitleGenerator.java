package ai.agentdeck.agent;

import org.jetbrains.annotations.Nullable;

/**
 * Produces a short human-readable title for a session from its first message.
 */
@FunctionalInterface
public interface TitleGenerator {
    int MAX_PROMPT_CHARS = 300;
    int MAX_TITLE_CHARS = 50;

    /**
     * @return the title, or null if none could be produced
     */
    @Nullable
    String generateTitle(String firstMessage);

    /** Prompt text sent to the model; long messages are cut to {@link #MAX_PROMPT_CHARS}. */
    static String titlePrompt(String firstMessage) {
        var truncated = firstMessage.length() > MAX_PROMPT_CHARS
                ? firstMessage.substring(0, MAX_PROMPT_CHARS) + "..."
                : firstMessage;
        return "Generate a very short title (2-5 words, no quotes) for a coding session that starts with this message:\n\n"
                + truncated;
    }

    /** Strip surrounding quotes and whitespace and cap the length. Returns null for blank output. */
    @Nullable
    static String cleanTitle(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        var title = raw.trim().replaceAll("^[\"']+|[\"']+$", "").trim();
        if (title.isEmpty()) {
            return null;
        }
        return title.length() > MAX_TITLE_CHARS ? title.substring(0, MAX_TITLE_CHARS) : title;
    }
}
