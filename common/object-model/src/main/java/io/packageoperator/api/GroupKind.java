package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupKind(String group, String kind) {
    public GroupKind {
        group = group == null ? "" : group;
    }

    public boolean matches(GroupVersionKind gvk) {
        return gvk != null && group.equals(gvk.group()) && kind != null && kind.equals(gvk.kind());
    }
}
