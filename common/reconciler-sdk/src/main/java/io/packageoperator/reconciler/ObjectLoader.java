package io.packageoperator.reconciler;

import io.packageoperator.api.ObjectKey;
import java.util.Optional;

/**
 * Loads the current state of a queued key. An empty result means the object is gone.
 */
@FunctionalInterface
public interface ObjectLoader<T> {

  Optional<T> load(ObjectKey key);
}
