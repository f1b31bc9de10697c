package io.packageoperator.manager.config;

import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.dynamiccache.CacheOwner;
import io.packageoperator.dynamiccache.EventSink;
import io.packageoperator.reconciler.ControllerLoop;
import io.packageoperator.store.WatchEvent;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns cache events into ObjectSet reconciles. The cache exists before the loop it feeds, so the
 * loop is bound once it is created; events seen before that are dropped, the initial list covers them.
 */
public class CacheEventRouter implements EventSink {

  private static final Logger log = LoggerFactory.getLogger(CacheEventRouter.class);

  private volatile ControllerLoop<?> objectSets;

  public void bind(ControllerLoop<?> loop) {
    this.objectSets = loop;
  }

  @Override
  public void handle(WatchEvent event, Set<CacheOwner> owners) {
    ControllerLoop<?> loop = objectSets;
    if (loop == null) {
      log.debug("Dropping {} event for {}, no controller bound", event.type(), event.object());
      return;
    }
    for (CacheOwner owner : owners) {
      if (owner.gvk().equals(PackageOperatorApi.OBJECT_SET.gvk())) {
        loop.enqueue(owner.key());
      }
    }
  }
}
