package io.packageoperator.manager.slices;

import io.packageoperator.api.ObjectKey;

/**
 * A slice with the computed name exists but holds other content or belongs to another deployment.
 */
public class SliceCollisionException extends RuntimeException {

  private final ObjectKey key;

  public SliceCollisionException(ObjectKey key) {
    super("ObjectSlice collision with " + key);
    this.key = key;
  }

  public ObjectKey key() {
    return key;
  }
}
