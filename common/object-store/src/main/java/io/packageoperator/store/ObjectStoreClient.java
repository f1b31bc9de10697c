package io.packageoperator.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;

/**
 * Kind-agnostic contract of the backing object store.
 * <p>
 * Every write returns the object as stored, including the new resource version. Writes that carry a
 * resource version fail with {@link ConflictException} when it is stale. Objects are returned as
 * copies; mutating them never affects the store.
 */
public interface ObjectStoreClient extends ObjectReader {

    /**
     * @throws AlreadyExistsException when an object with the same kind and key exists
     */
    ClusterObject create(ClusterObject object);

    /**
     * Replaces everything but the status subresource.
     */
    ClusterObject update(ClusterObject object);

    /**
     * Replaces only the status subresource.
     */
    ClusterObject updateStatus(ClusterObject object);

    /**
     * Applies a JSON merge patch. A {@code metadata.resourceVersion} inside the patch acts as a
     * precondition. The status subresource is never changed by a patch.
     */
    ClusterObject patch(GroupVersionKind gvk, ObjectKey key, ObjectNode mergePatch);

    /**
     * Marks the object as deleting. It is removed once its finalizers are gone, together with every
     * object that lists it as an owner.
     */
    void delete(GroupVersionKind gvk, ObjectKey key);

    /**
     * Starts delivering events for objects of {@code gvk} matching {@code options}. The listener
     * first receives an ADDED event for every object that already matches. An object that stops
     * matching is reported as DELETED.
     */
    Subscription watch(GroupVersionKind gvk, ListOptions options, WatchListener listener);
}
