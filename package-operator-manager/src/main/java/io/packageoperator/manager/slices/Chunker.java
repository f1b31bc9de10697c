package io.packageoperator.manager.slices;

import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplatePhase;
import java.util.List;

/**
 * Decides which inline objects of a phase move out into slices.
 */
public interface Chunker {

  /**
   * Returns the groups of objects to store as slices, in phase order. An empty result keeps the phase
   * inline. Only the phase's inline objects are considered.
   */
  List<List<ObjectSetObject>> chunk(ObjectSetTemplatePhase phase);
}
