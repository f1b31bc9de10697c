package io.packageoperator.store;

/**
 * The store refused an object, e.g. because it is malformed or exceeds the size limit.
 */
public class InvalidObjectException extends ObjectStoreException {

    public InvalidObjectException(String message) {
        super(message);
    }

    public InvalidObjectException(String message, Throwable cause) {
        super(message, cause);
    }
}
