package io.packageoperator.manager.slices;

/**
 * Configurable slicing behaviour, bound from {@code package-operator.slicing.strategy}.
 */
public enum ChunkingStrategy {
  SIZE,
  EACH_OBJECT,
  NONE;

  public Chunker chunker(int thresholdBytes) {
    return switch (this) {
      case SIZE -> new SizeThresholdChunker(thresholdBytes);
      case EACH_OBJECT -> new EachObjectChunker();
      case NONE -> new NoOpChunker();
    };
  }
}
