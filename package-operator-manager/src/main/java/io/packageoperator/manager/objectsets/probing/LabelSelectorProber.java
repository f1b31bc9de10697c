package io.packageoperator.manager.objectsets.probing;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.LabelSelector;
import java.util.Objects;

/**
 * Runs the delegate only for objects whose labels match the selector; others pass.
 */
public final class LabelSelectorProber implements Prober {

  private final LabelSelector selector;
  private final Prober delegate;

  public LabelSelectorProber(LabelSelector selector, Prober delegate) {
    this.selector = Objects.requireNonNull(selector, "selector");
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public ProbeResult probe(ClusterObject object) {
    if (!selector.matches(object.labels())) {
      return ProbeResult.ok();
    }
    return delegate.probe(object);
  }
}
