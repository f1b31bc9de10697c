package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Points at a live object controlled by a revision.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ControlledObjectReference(String kind, String group, String version, String name, String namespace) {

    public static ControlledObjectReference of(GroupVersionKind gvk, ObjectKey key) {
        return new ControlledObjectReference(gvk.kind(), gvk.group(), gvk.version(), key.name(), key.namespace());
    }

    public static ControlledObjectReference of(ClusterObject object) {
        return of(object.gvk(), object.key());
    }

    public GroupVersionKind gvk() {
        return new GroupVersionKind(group, version, kind);
    }

    public ObjectKey key() {
        return ObjectKey.of(namespace, name);
    }
}
