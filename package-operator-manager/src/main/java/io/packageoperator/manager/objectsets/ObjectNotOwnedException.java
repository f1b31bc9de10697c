package io.packageoperator.manager.objectsets;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.OwnerReference;

/**
 * A live object the revision wants to manage is controlled by someone it may not take it from.
 */
public class ObjectNotOwnedException extends RuntimeException {

  private final transient ClusterObject object;
  private final transient OwnerReference controller;

  public ObjectNotOwnedException(ClusterObject object, OwnerReference controller) {
    super(object + " is controlled by " + controller.kind() + " " + controller.name());
    this.object = object;
    this.controller = controller;
  }

  public ClusterObject object() {
    return object;
  }

  public OwnerReference controller() {
    return controller;
  }
}
