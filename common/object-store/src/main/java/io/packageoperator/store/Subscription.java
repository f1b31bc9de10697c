package io.packageoperator.store;

/**
 * Handle of an active watch. Closing it stops event delivery; closing twice is a no-op.
 */
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
