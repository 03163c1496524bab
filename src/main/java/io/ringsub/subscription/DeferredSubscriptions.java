package io.ringsub.subscription;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Holds subscriptions requested before the bus has started.
 * <p>
 * Starts in {@link State#DEFERRING}; {@link #start(Consumer)} moves it to {@link State#ACTIVE}
 * exactly once and hands the buffered message types, in arrival order, to the flush callback.
 * Appends and the transition share one monitor, so a type offered concurrently with start is
 * either in the flushed batch or refused and registered directly by the caller.
 */
@Slf4j
public final class DeferredSubscriptions {

    public enum State {
        DEFERRING,
        ACTIVE
    }

    private final List<String> buffer = new ArrayList<>();
    private State state = State.DEFERRING;

    /**
     * Buffers the types while deferring.
     *
     * @return {@code true} if the types were buffered, {@code false} if already active and the
     * caller must register them itself
     */
    public synchronized boolean offer(final Collection<String> messageTypes) {
        final List<String> copy = List.copyOf(Objects.requireNonNull(messageTypes, "messageTypes"));

        if (state == State.ACTIVE) return false;

        buffer.addAll(copy);
        log.debug("Deferred subscription to {} until the bus starts", copy);
        return true;
    }

    /**
     * Switches to active and flushes the buffer once. The buffer is empty afterwards even if the
     * flush throws; the failure propagates to the caller and nothing is retried.
     *
     * @return {@code false} if already active, in which case nothing is flushed
     */
    public boolean start(final Consumer<List<String>> flush) {
        Objects.requireNonNull(flush, "flush");

        final List<String> drained;
        synchronized (this) {
            if (state == State.ACTIVE) {
                log.warn("Deferred subscriptions already started; ignoring repeated start");
                return false;
            }
            state = State.ACTIVE;
            drained = List.copyOf(buffer);
            buffer.clear();
        }

        if (!drained.isEmpty()) {
            log.info("Flushing {} deferred subscription(s)", drained.size());
            flush.accept(drained);
        }
        return true;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized boolean hasPending() {
        return !buffer.isEmpty();
    }

    public synchronized List<String> pending() {
        return List.copyOf(buffer);
    }
}
