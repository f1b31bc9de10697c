package io.packageoperator.store;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.packageoperator.api.ClusterObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Adds and removes finalizers with a merge patch guarded by the object's resource version, so a
 * concurrent writer is never overwritten.
 */
public final class Finalizers {

    private Finalizers() {
    }

    /**
     * Returns the object as stored after the finalizer is present. No write happens when it already is.
     */
    public static ClusterObject ensure(ObjectStoreClient client, ClusterObject object, String finalizer) {
        List<String> finalizers = object.finalizers();
        if (finalizers.contains(finalizer)) {
            return object;
        }
        List<String> updated = new ArrayList<>(finalizers);
        updated.add(finalizer);
        return write(client, object, updated);
    }

    public static ClusterObject remove(ObjectStoreClient client, ClusterObject object, String finalizer) {
        List<String> finalizers = object.finalizers();
        if (!finalizers.contains(finalizer)) {
            return object;
        }
        List<String> updated = new ArrayList<>(finalizers);
        updated.remove(finalizer);
        return write(client, object, updated);
    }

    private static ClusterObject write(ObjectStoreClient client, ClusterObject object, List<String> finalizers) {
        ObjectNode patch = JsonNodeFactory.instance.objectNode();
        ObjectNode metadata = patch.putObject("metadata");
        metadata.put("resourceVersion", object.resourceVersion());
        ArrayNode array = metadata.putArray("finalizers");
        finalizers.forEach(array::add);
        return client.patch(object.gvk(), object.key(), patch);
    }
}
