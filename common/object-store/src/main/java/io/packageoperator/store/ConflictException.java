package io.packageoperator.store;

import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;

/**
 * A write carried a stale resource version.
 */
public class ConflictException extends ObjectStoreException {

    public ConflictException(GroupVersionKind gvk, ObjectKey key, String expected, String actual) {
        super("Operation on " + gvk.kind() + " " + key + " conflicts: resourceVersion " + expected
            + " is stale, current is " + actual);
    }
}
