package io.packageoperator.manager.slices;

import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplatePhase;
import java.util.List;

/**
 * Moves every inline object into a slice of its own.
 */
public final class EachObjectChunker implements Chunker {

  @Override
  public List<List<ObjectSetObject>> chunk(ObjectSetTemplatePhase phase) {
    return phase.objects().stream().map(List::of).toList();
  }
}
