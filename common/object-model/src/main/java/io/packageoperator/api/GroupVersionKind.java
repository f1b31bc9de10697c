package io.packageoperator.api;

import java.util.Objects;

/**
 * Identifies an object kind independent of any typed representation.
 */
public record GroupVersionKind(String group, String version, String kind) {
    public GroupVersionKind {
        group = group == null ? "" : group;
        version = requireText(version, "version");
        kind = requireText(kind, "kind");
    }

    public static GroupVersionKind fromApiVersion(String apiVersion, String kind) {
        String resolved = requireText(apiVersion, "apiVersion");
        int slash = resolved.indexOf('/');
        if (slash < 0) {
            return new GroupVersionKind("", resolved, kind);
        }
        return new GroupVersionKind(resolved.substring(0, slash), resolved.substring(slash + 1), kind);
    }

    public String apiVersion() {
        return group.isEmpty() ? version : group + "/" + version;
    }

    public GroupKind groupKind() {
        return new GroupKind(group, kind);
    }

    @Override
    public String toString() {
        return group.isEmpty() ? version + ", Kind=" + kind : group + "/" + version + ", Kind=" + kind;
    }

    private static String requireText(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
