package io.packageoperator.store;

import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;

/**
 * The addressed object does not exist. Callers usually treat this as "needs creation".
 */
public class NotFoundException extends ObjectStoreException {

    private final GroupVersionKind gvk;
    private final ObjectKey key;

    public NotFoundException(GroupVersionKind gvk, ObjectKey key) {
        super(gvk.kind() + " " + key + " not found");
        this.gvk = gvk;
        this.key = key;
    }

    public GroupVersionKind gvk() {
        return gvk;
    }

    public ObjectKey key() {
        return key;
    }
}
