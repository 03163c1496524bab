package io.ringsub.exceptions;

/**
 * Raised when the subscription table could not be created for any reason other than
 * it already existing.
 */
public class SubscriptionInitializationException extends RuntimeException {

    public SubscriptionInitializationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
