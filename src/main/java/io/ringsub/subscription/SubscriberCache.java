package io.ringsub.subscription;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Per-process memo of message type to subscriber inbox URIs.
 * <p>
 * Hits are plain concurrent map reads. A miss takes a single lock shared by every key,
 * re-checks, and only then runs the loader, so each message type is loaded at most once.
 * Loads of different message types are serialized behind that lock; this is acceptable
 * because each type is loaded once per process. Entries are never refreshed or evicted.
 */
@Slf4j
public final class SubscriberCache {
    private final Map<String, List<String>> subscribers = new ConcurrentHashMap<>();
    private final ReentrantLock fillLock = new ReentrantLock();

    /**
     * Returns the cached list for the message type, loading it first if this is the first lookup.
     * A loader failure leaves the type uncached and propagates.
     */
    public List<String> getOrLoad(final String messageType, final Function<String, List<String>> loader) {
        Objects.requireNonNull(messageType, "messageType");

        final List<String> cached = subscribers.get(messageType);
        if (cached != null) return cached;

        Objects.requireNonNull(loader, "loader");
        fillLock.lock();
        try {
            final List<String> raced = subscribers.get(messageType);
            if (raced != null) return raced;

            final List<String> loaded = List.copyOf(loader.apply(messageType));
            subscribers.put(messageType, loaded);
            log.debug("Cached {} subscriber(s) for {}", loaded.size(), messageType);
            return loaded;
        } finally {
            fillLock.unlock();
        }
    }

    public boolean contains(final String messageType) {
        return subscribers.containsKey(messageType);
    }

    public int size() {
        return subscribers.size();
    }
}
