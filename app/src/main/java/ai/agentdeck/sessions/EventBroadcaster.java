package ai.agentdeck.sessions;

import ai.agentdeck.util.Subscription;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fans deliveries out to every registered observer. Observers registered as not ready have their
 * deliveries queued and replayed in order when {@link #markReady} is called.
 */
final class EventBroadcaster {
    private static final Logger logger = LogManager.getLogger(EventBroadcaster.class);

    private static final class Registration {
        boolean ready;
        final List<Consumer<SessionObserver>> pending = new ArrayList<>();

        Registration(boolean ready) {
            this.ready = ready;
        }
    }

    private final Map<SessionObserver, Registration> observers = new LinkedHashMap<>();

    synchronized Subscription add(SessionObserver observer, boolean ready) {
        observers.put(observer, new Registration(ready));
        return () -> remove(observer);
    }

    synchronized void remove(SessionObserver observer) {
        observers.remove(observer);
    }

    synchronized void markReady(SessionObserver observer) {
        var registration = observers.get(observer);
        if (registration == null || registration.ready) {
            return;
        }
        registration.ready = true;
        var pending = List.copyOf(registration.pending);
        registration.pending.clear();
        if (!pending.isEmpty()) {
            logger.debug("Replaying {} queued deliveries to newly ready observer", pending.size());
        }
        for (var delivery : pending) {
            deliver(observer, delivery);
        }
    }

    synchronized void broadcast(Consumer<SessionObserver> delivery) {
        for (var entry : observers.entrySet()) {
            var registration = entry.getValue();
            if (registration.ready) {
                deliver(entry.getKey(), delivery);
            } else {
                registration.pending.add(delivery);
            }
        }
    }

    synchronized int size() {
        return observers.size();
    }

    private static void deliver(SessionObserver observer, Consumer<SessionObserver> delivery) {
        try {
            delivery.accept(observer);
        } catch (RuntimeException e) {
            logger.warn("Session observer failed", e);
        }
    }
}
