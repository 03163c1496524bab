package io.ringsub.exceptions;

/**
 * Any failure reported by a {@link io.ringsub.store.StoreGateway}.
 */
public class StoreException extends RuntimeException {

    public StoreException(final String message) {
        super(message);
    }

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
