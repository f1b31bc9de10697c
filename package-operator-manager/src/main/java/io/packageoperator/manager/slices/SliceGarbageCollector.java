package io.packageoperator.manager.slices;

import io.packageoperator.api.ObjectDeployment;
import io.packageoperator.api.ObjectSlice;
import io.packageoperator.reconciler.ReconcileMetrics;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes slices of a deployment that no live revision and no desired template references.
 * <p>
 * Deletion is best effort per slice: a failure is logged and counted and the remaining slices are
 * still processed. An unreferenced slice that survives is retried on the next pass.
 */
public class SliceGarbageCollector {

  private static final Logger log = LoggerFactory.getLogger(SliceGarbageCollector.class);

  private final SliceStore sliceStore;
  private final ReconcileMetrics metrics;

  public SliceGarbageCollector(SliceStore sliceStore, ReconcileMetrics metrics) {
    this.sliceStore = Objects.requireNonNull(sliceStore, "sliceStore");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the number of slices deleted.
   */
  public int collect(ObjectDeployment deployment, Set<String> referenced) {
    int deleted = 0;
    for (ObjectSlice slice : sliceStore.listFor(deployment)) {
      String name = slice.metadata().name();
      if (referenced.contains(name)) {
        continue;
      }
      try {
        sliceStore.delete(slice.metadata().namespace(), name);
        deleted++;
        metrics.sliceDeleted();
        log.info("Deleted unreferenced ObjectSlice {}", slice.metadata().key());
      } catch (RuntimeException e) {
        metrics.sliceDeletionFailed();
        log.warn("Failed to delete unreferenced ObjectSlice {}", slice.metadata().key(), e);
      }
    }
    return deleted;
  }
}
