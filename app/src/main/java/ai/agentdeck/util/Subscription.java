package ai.agentdeck.util;

/**
 * Handle returned by listener registration. Closing it unregisters the listener; closing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
