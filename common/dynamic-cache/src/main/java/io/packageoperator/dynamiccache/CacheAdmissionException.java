package io.packageoperator.dynamiccache;

import io.packageoperator.api.GroupVersionKind;

/**
 * A kind was read through the cache before any owner registered a watch for it.
 */
public class CacheAdmissionException extends RuntimeException {

  public CacheAdmissionException(GroupVersionKind gvk) {
    super("No cache registration for " + gvk + ", call watch() before reading");
  }
}
