package io.packageoperator.store;

import io.packageoperator.api.ClusterObject;
import java.util.Objects;

public record WatchEvent(Type type, ClusterObject object) {
    public WatchEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(object, "object");
    }

    public enum Type {
        ADDED,
        MODIFIED,
        DELETED
    }
}
