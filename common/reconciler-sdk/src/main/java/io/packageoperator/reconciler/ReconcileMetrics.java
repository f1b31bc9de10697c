package io.packageoperator.reconciler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Objects;

/**
 * Micrometer instrumentation shared by the controllers.
 */
public final class ReconcileMetrics {

  private final MeterRegistry registry;
  private final Counter slicesDeleted;
  private final Counter sliceDeletionFailures;
  private final Counter sliceCollisions;

  public ReconcileMetrics(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.slicesDeleted = Counter.builder("po_slice_gc_deleted_total")
        .description("ObjectSlices removed by garbage collection")
        .register(registry);
    this.sliceDeletionFailures = Counter.builder("po_slice_gc_failures_total")
        .description("ObjectSlice deletions that failed during garbage collection")
        .register(registry);
    this.sliceCollisions = Counter.builder("po_slice_collisions_total")
        .description("ObjectSlice name collisions resolved by salting")
        .register(registry);
  }

  public static ReconcileMetrics noop() {
    return new ReconcileMetrics(new SimpleMeterRegistry());
  }

  public MeterRegistry registry() {
    return registry;
  }

  public Timer.Sample startReconcile() {
    return Timer.start(registry);
  }

  public void stopReconcile(Timer.Sample sample, String controller, boolean success) {
    sample.stop(Timer.builder("po_reconcile_duration")
        .description("Latency of reconcile passes")
        .tag("controller", controller)
        .tag("outcome", success ? "success" : "error")
        .register(registry));
    if (!success) {
      Counter.builder("po_reconcile_errors_total")
          .tag("controller", controller)
          .register(registry)
          .increment();
    }
  }

  public void sliceDeleted() {
    slicesDeleted.increment();
  }

  public void sliceDeletionFailed() {
    sliceDeletionFailures.increment();
  }

  public void sliceCollision() {
    sliceCollisions.increment();
  }
}
