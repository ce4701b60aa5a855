package ai.agentdeck.transcript;

import java.time.Duration;

/**
 * Timing of {@link SessionLogTail}.
 *
 * @param attachPollInterval how often to look for a known transcript that does not exist yet
 * @param attachMaxAttempts how many times to look before reporting it missing
 * @param contentPollInterval how often to poll the directory and active file for changes
 * @param nativeWatch whether to also subscribe to file system notifications
 */
public record TailSettings(
        Duration attachPollInterval, int attachMaxAttempts, Duration contentPollInterval, boolean nativeWatch) {

    public TailSettings {
        if (attachPollInterval.isNegative() || attachPollInterval.isZero()) {
            throw new IllegalArgumentException("attachPollInterval must be positive");
        }
        if (attachMaxAttempts < 1) {
            throw new IllegalArgumentException("attachMaxAttempts must be at least 1");
        }
        if (contentPollInterval.isNegative() || contentPollInterval.isZero()) {
            throw new IllegalArgumentException("contentPollInterval must be positive");
        }
    }

    public static TailSettings defaults() {
        return new TailSettings(Duration.ofSeconds(1), 60, Duration.ofMillis(1500), true);
    }
}
