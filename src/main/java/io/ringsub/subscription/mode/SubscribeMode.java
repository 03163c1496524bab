package io.ringsub.subscription.mode;

import java.util.Locale;

/**
 * How a node treats its subscriptions once the bus has started.
 */
public enum SubscribeMode {
    /**
     * Upserts a row for every subscribed message type.
     */
    REGISTER,
    /**
     * Only checks that a row exists for every subscribed message type; subscriptions are
     * expected to be provisioned out of band.
     */
    VALIDATE,
    /**
     * Leaves the store alone.
     */
    IGNORE;

    /**
     * Case-insensitive lookup of a configured value. {@code null} or blank yields {@link #REGISTER}.
     */
    public static SubscribeMode parse(final String value) {
        if (value == null || value.isBlank()) return REGISTER;
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
