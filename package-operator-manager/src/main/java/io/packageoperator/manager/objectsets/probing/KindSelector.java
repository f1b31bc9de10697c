package io.packageoperator.manager.objectsets.probing;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupKind;
import java.util.Objects;

/**
 * Runs the delegate only for objects of one kind; other kinds pass.
 */
public final class KindSelector implements Prober {

  private final GroupKind kind;
  private final Prober delegate;

  public KindSelector(GroupKind kind, Prober delegate) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public ProbeResult probe(ClusterObject object) {
    if (!kind.equals(object.gvk().groupKind())) {
      return ProbeResult.ok();
    }
    return delegate.probe(object);
  }
}
