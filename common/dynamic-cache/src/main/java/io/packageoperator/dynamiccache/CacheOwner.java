package io.packageoperator.dynamiccache;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;
import java.util.Objects;

/**
 * Object on whose behalf cache registrations are held, usually the reconciled revision.
 */
public record CacheOwner(GroupVersionKind gvk, ObjectKey key, String uid) {
  public CacheOwner {
    Objects.requireNonNull(gvk, "gvk");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(uid, "uid");
  }

  public static CacheOwner of(ClusterObject object) {
    return new CacheOwner(object.gvk(), object.key(), object.uid());
  }
}
