package io.ringsub.bus;

/**
 * Lifecycle notifications published by the message bus.
 */
public interface BusEvents {

    /**
     * Registers a listener for the one-time "started" notification.
     */
    void addStartedListener(Runnable listener);
}
