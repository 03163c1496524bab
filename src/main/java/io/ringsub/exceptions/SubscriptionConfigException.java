package io.ringsub.exceptions;

/**
 * Raised when subscription configuration is missing, unreadable or invalid.
 * Fatal: the subscription manager cannot be constructed without a store to talk to.
 */
public class SubscriptionConfigException extends RuntimeException {

    public SubscriptionConfigException(final String message) {
        super(message);
    }

    public SubscriptionConfigException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
