package io.packageoperator.manager.objectsets.probing;

import io.packageoperator.api.ClusterObject;

/**
 * Availability check against one live object.
 */
public interface Prober {

  ProbeResult probe(ClusterObject object);
}
