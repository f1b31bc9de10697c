package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record OwnerReference(String apiVersion,
                             String kind,
                             String name,
                             String uid,
                             Boolean controller,
                             Boolean blockOwnerDeletion) {

    public static OwnerReference controllerOf(GroupVersionKind gvk, String name, String uid) {
        return new OwnerReference(gvk.apiVersion(), gvk.kind(), name, uid, Boolean.TRUE, Boolean.TRUE);
    }

    public static OwnerReference ownedBy(GroupVersionKind gvk, String name, String uid) {
        return new OwnerReference(gvk.apiVersion(), gvk.kind(), name, uid, null, null);
    }

    /** Whether this reference marks the controlling owner. */
    public boolean controls() {
        return Boolean.TRUE.equals(controller);
    }

    public GroupKind groupKind() {
        return GroupVersionKind.fromApiVersion(apiVersion, kind).groupKind();
    }
}
