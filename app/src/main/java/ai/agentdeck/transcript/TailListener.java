package ai.agentdeck.transcript;

import java.util.List;

/**
 * Receives transcript updates for one watching consumer. Callbacks arrive on the tail's
 * scheduler thread.
 */
public interface TailListener {

    /** Entries appended since the last delivery. */
    default void onEntries(String consumerId, List<TranscriptEntry> entries) {}

    /** The full content of the watched transcript, replacing everything delivered before. */
    default void onReset(String consumerId, List<TranscriptEntry> entries) {}

    /** A known transcript did not appear in time; the watch stays registered until unwatched. */
    default void onNotFound(String consumerId, String message) {}
}
