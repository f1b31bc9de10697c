package io.packageoperator.reconciler;

/**
 * Drives one object towards its desired state.
 * <p>
 * Implementations must be idempotent: the loop calls them again after every relevant change, after
 * failures and whenever a requeue was requested. Failures are reported by throwing.
 */
@FunctionalInterface
public interface Reconciler<T> {

  ReconcileResult reconcile(T object);
}
