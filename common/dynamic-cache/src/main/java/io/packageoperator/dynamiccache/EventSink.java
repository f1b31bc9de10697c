package io.packageoperator.dynamiccache;

import io.packageoperator.store.WatchEvent;
import java.util.Set;

/**
 * Receives cache events together with the owners interested in them. Runs on the store's event thread,
 * so implementations only enqueue.
 */
@FunctionalInterface
public interface EventSink {

  void handle(WatchEvent event, Set<CacheOwner> owners);
}
