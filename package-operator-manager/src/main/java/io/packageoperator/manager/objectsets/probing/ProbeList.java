package io.packageoperator.manager.objectsets.probing;

import io.packageoperator.api.ClusterObject;
import java.util.List;

/**
 * Succeeds when every probe succeeds. All probes run so that every failure is reported.
 */
public final class ProbeList implements Prober {

  private final List<Prober> probes;

  public ProbeList(List<Prober> probes) {
    this.probes = List.copyOf(probes);
  }

  public boolean isEmpty() {
    return probes.isEmpty();
  }

  @Override
  public ProbeResult probe(ClusterObject object) {
    ProbeResult result = ProbeResult.ok();
    for (Prober probe : probes) {
      result = result.and(probe.probe(object));
    }
    return result;
  }
}
