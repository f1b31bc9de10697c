package io.packageoperator.manager.slices;

import io.packageoperator.api.ApiJson;
import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplatePhase;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps phases inline while their objects serialize below the threshold. Larger phases are packed,
 * in order, into slices that each stay below the threshold; an object that alone exceeds it gets its
 * own slice.
 */
public final class SizeThresholdChunker implements Chunker {

  private final int thresholdBytes;

  public SizeThresholdChunker(int thresholdBytes) {
    if (thresholdBytes <= 0) {
      throw new IllegalArgumentException("thresholdBytes must be positive");
    }
    this.thresholdBytes = thresholdBytes;
  }

  @Override
  public List<List<ObjectSetObject>> chunk(ObjectSetTemplatePhase phase) {
    if (phase.objects().isEmpty() || ApiJson.serializedSize(phase.objects()) <= thresholdBytes) {
      return List.of();
    }
    List<List<ObjectSetObject>> chunks = new ArrayList<>();
    List<ObjectSetObject> current = new ArrayList<>();
    int currentSize = 0;
    for (ObjectSetObject object : phase.objects()) {
      int size = ApiJson.serializedSize(object);
      if (!current.isEmpty() && currentSize + size > thresholdBytes) {
        chunks.add(List.copyOf(current));
        current.clear();
        currentSize = 0;
      }
      current.add(object);
      currentSize += size;
    }
    if (!current.isEmpty()) {
      chunks.add(List.copyOf(current));
    }
    return chunks;
  }
}
