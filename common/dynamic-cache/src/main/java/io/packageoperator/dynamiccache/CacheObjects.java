package io.packageoperator.dynamiccache;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.store.ConflictException;
import io.packageoperator.store.Finalizers;
import io.packageoperator.store.NotFoundException;
import io.packageoperator.store.ObjectStoreClient;
import io.packageoperator.store.ObjectStoreException;

/**
 * Label and finalizer protocol around the {@link DynamicCache}.
 * <p>
 * Objects must carry the cache label to be visible through the cache. Owners holding registrations
 * carry the cached finalizer, which is only removed after their registrations were freed.
 */
public final class CacheObjects {

  private CacheObjects() {
  }

  /**
   * Adds the cache label to {@code object} in place. Returns whether the object changed.
   */
  public static boolean ensureCacheLabel(ClusterObject object) {
    if (PackageOperatorApi.DYNAMIC_CACHE_LABEL_VALUE.equals(object.label(PackageOperatorApi.DYNAMIC_CACHE_LABEL))) {
      return false;
    }
    object.setLabel(PackageOperatorApi.DYNAMIC_CACHE_LABEL, PackageOperatorApi.DYNAMIC_CACHE_LABEL_VALUE);
    return true;
  }

  public static boolean removeCacheLabel(ClusterObject object) {
    return object.removeLabel(PackageOperatorApi.DYNAMIC_CACHE_LABEL);
  }

  public static ClusterObject ensureCachedFinalizer(ObjectStoreClient client, ClusterObject owner) {
    try {
      return Finalizers.ensure(client, owner, PackageOperatorApi.CACHED_FINALIZER);
    } catch (ConflictException e) {
      throw e;
    } catch (ObjectStoreException e) {
      throw new ObjectStoreException("adding cached finalizer: " + e.getMessage(), e);
    }
  }

  /**
   * Frees the owner's cache registrations, then removes the cached finalizer. The order matters: once
   * the finalizer is gone the owner may disappear and nothing would free its registrations.
   */
  public static ClusterObject freeCacheAndRemoveFinalizer(DynamicCache cache,
                                                          ObjectStoreClient client,
                                                          ClusterObject owner) {
    try {
      cache.free(CacheOwner.of(owner));
    } catch (RuntimeException e) {
      throw new ObjectStoreException("freeing cache: " + e.getMessage(), e);
    }
    try {
      return Finalizers.remove(client, owner, PackageOperatorApi.CACHED_FINALIZER);
    } catch (NotFoundException | ConflictException e) {
      throw e;
    } catch (ObjectStoreException e) {
      throw new ObjectStoreException("removing cached finalizer: " + e.getMessage(), e);
    }
  }
}
