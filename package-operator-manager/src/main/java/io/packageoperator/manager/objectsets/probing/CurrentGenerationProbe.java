package io.packageoperator.manager.objectsets.probing;

import com.fasterxml.jackson.databind.JsonNode;
import io.packageoperator.api.ClusterObject;

/**
 * Objects without {@code .status.observedGeneration} do not report it, and pass.
 */
public final class CurrentGenerationProbe implements Prober {

  @Override
  public ProbeResult probe(ClusterObject object) {
    JsonNode observed = object.status().path("observedGeneration");
    if (!observed.isNumber()) {
      return ProbeResult.ok();
    }
    if (observed.asLong() != object.generation()) {
      return ProbeResult.failed(".status.observedGeneration outdated");
    }
    return ProbeResult.ok();
  }
}
