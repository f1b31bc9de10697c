package io.packageoperator.store;

/**
 * Base type for failures reported by an {@link ObjectStoreClient}.
 */
public class ObjectStoreException extends RuntimeException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
