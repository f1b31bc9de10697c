package io.packageoperator.store;

/**
 * Receives watch events. Invoked on the writer's thread; implementations must not call back into the
 * store and should only record or enqueue.
 */
@FunctionalInterface
public interface WatchListener {

    void onEvent(WatchEvent event);
}
