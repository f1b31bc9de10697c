package io.packageoperator.reconciler;

import java.time.Duration;

/**
 * Outcome of a successful reconcile pass.
 */
public record ReconcileResult(boolean retry, Duration requeueAfter) {

  private static final ReconcileResult DONE = new ReconcileResult(false, null);
  private static final ReconcileResult REQUEUE = new ReconcileResult(true, null);

  public ReconcileResult {
    if (requeueAfter != null && requeueAfter.isNegative()) {
      throw new IllegalArgumentException("requeueAfter must not be negative");
    }
  }

  public static ReconcileResult done() {
    return DONE;
  }

  public static ReconcileResult requeue() {
    return REQUEUE;
  }

  public static ReconcileResult requeueAfter(Duration delay) {
    return new ReconcileResult(true, delay);
  }

  public boolean isDone() {
    return !retry;
  }

  /**
   * Combines two outcomes, keeping the earliest requested requeue.
   */
  public ReconcileResult merge(ReconcileResult other) {
    if (other == null || other.isDone()) {
      return this;
    }
    if (isDone()) {
      return other;
    }
    if (requeueAfter == null || other.requeueAfter == null) {
      return REQUEUE;
    }
    return requeueAfter.compareTo(other.requeueAfter) <= 0 ? this : other;
  }
}
