package io.ringsub.bus;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Minimal {@link BusEvents} source owned by whatever starts the bus. {@link #started()} fires
 * the listeners exactly once, on the calling thread, in registration order; a listener failure
 * propagates to the caller and the remaining listeners are not run. A listener added after the
 * bus has started runs immediately on the registering thread.
 */
@Slf4j
public final class BusLifecycle implements BusEvents {
    private final List<Runnable> startedListeners = new ArrayList<>();
    private boolean started;

    @Override
    public void addStartedListener(final Runnable listener) {
        Objects.requireNonNull(listener, "listener");

        synchronized (this) {
            if (!started) {
                startedListeners.add(listener);
                return;
            }
        }
        listener.run();
    }

    public void started() {
        final List<Runnable> listeners;
        synchronized (this) {
            if (started) {
                log.warn("Bus already started; ignoring repeated start notification");
                return;
            }
            started = true;
            listeners = List.copyOf(startedListeners);
            startedListeners.clear();
        }

        log.info("Bus started, notifying {} listener(s)", listeners.size());
        for (final Runnable listener : listeners) {
            listener.run();
        }
    }

    public synchronized boolean isStarted() {
        return started;
    }
}
