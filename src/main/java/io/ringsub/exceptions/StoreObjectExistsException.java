package io.ringsub.exceptions;

/**
 * A store failure classified as "the object being created already exists".
 * Each gateway maps its own native error codes onto this type.
 */
public class StoreObjectExistsException extends StoreException {

    public StoreObjectExistsException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
