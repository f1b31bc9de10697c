package io.packageoperator.api;

import java.util.Objects;

/**
 * Binds a typed resource class to the kind it is stored as.
 */
public record ResourceType<T extends Resource<T>>(GroupVersionKind gvk, Class<T> type) {
    public ResourceType {
        Objects.requireNonNull(gvk, "gvk");
        Objects.requireNonNull(type, "type");
    }

    public static <T extends Resource<T>> ResourceType<T> of(GroupVersionKind gvk, Class<T> type) {
        return new ResourceType<>(gvk, type);
    }
}
