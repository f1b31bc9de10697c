package io.packageoperator.store;

import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;

public class AlreadyExistsException extends ObjectStoreException {

    private final GroupVersionKind gvk;
    private final ObjectKey key;

    public AlreadyExistsException(GroupVersionKind gvk, ObjectKey key) {
        super(gvk.kind() + " " + key + " already exists");
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
