package io.packageoperator.api;

/**
 * Typed resource persisted through the object store.
 */
public interface Resource<T extends Resource<T>> {

    ObjectMeta metadata();

    T withMetadata(ObjectMeta metadata);
}
