package io.packageoperator.store;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;
import java.util.List;

/**
 * Read access to objects of any kind. Implemented by the store itself and by caches in front of it.
 */
public interface ObjectReader {

    /**
     * @throws NotFoundException when the object does not exist
     */
    ClusterObject get(GroupVersionKind gvk, ObjectKey key);

    List<ClusterObject> list(GroupVersionKind gvk, ListOptions options);
}
