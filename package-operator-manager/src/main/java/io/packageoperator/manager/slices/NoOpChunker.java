package io.packageoperator.manager.slices;

import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplatePhase;
import java.util.List;

public final class NoOpChunker implements Chunker {

  @Override
  public List<List<ObjectSetObject>> chunk(ObjectSetTemplatePhase phase) {
    return List.of();
  }
}
