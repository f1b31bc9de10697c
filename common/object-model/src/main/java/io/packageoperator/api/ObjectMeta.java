package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Standard object metadata shared by every persisted resource.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectMeta(String name,
                         String namespace,
                         String uid,
                         String resourceVersion,
                         Long generation,
                         Map<String, String> labels,
                         Map<String, String> annotations,
                         List<String> finalizers,
                         List<OwnerReference> ownerReferences,
                         Instant creationTimestamp,
                         Instant deletionTimestamp) {
    public ObjectMeta {
        labels = labels == null || labels.isEmpty() ? Map.of() : Map.copyOf(labels);
        annotations = annotations == null || annotations.isEmpty() ? Map.of() : Map.copyOf(annotations);
        finalizers = finalizers == null || finalizers.isEmpty() ? List.of() : List.copyOf(finalizers);
        ownerReferences = ownerReferences == null || ownerReferences.isEmpty()
            ? List.of()
            : List.copyOf(ownerReferences);
    }

    public static ObjectMeta named(String namespace, String name) {
        return new ObjectMeta(name, namespace, null, null, null, null, null, null, null, null, null);
    }

    @JsonIgnore
    public ObjectKey key() {
        return new ObjectKey(namespace, name);
    }

    @JsonIgnore
    public boolean isDeleting() {
        return deletionTimestamp != null;
    }

    public long generationOrZero() {
        return generation == null ? 0L : generation;
    }

    public boolean hasFinalizer(String finalizer) {
        return finalizers.contains(finalizer);
    }

    public ObjectMeta withName(String newName) {
        return new ObjectMeta(newName, namespace, uid, resourceVersion, generation, labels, annotations,
            finalizers, ownerReferences, creationTimestamp, deletionTimestamp);
    }

    public ObjectMeta withResourceVersion(String newResourceVersion) {
        return new ObjectMeta(name, namespace, uid, newResourceVersion, generation, labels, annotations,
            finalizers, ownerReferences, creationTimestamp, deletionTimestamp);
    }

    public ObjectMeta withLabels(Map<String, String> newLabels) {
        return new ObjectMeta(name, namespace, uid, resourceVersion, generation, newLabels, annotations,
            finalizers, ownerReferences, creationTimestamp, deletionTimestamp);
    }

    public ObjectMeta withLabel(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(labels);
        merged.put(key, value);
        return withLabels(merged);
    }

    public ObjectMeta withAnnotations(Map<String, String> newAnnotations) {
        return new ObjectMeta(name, namespace, uid, resourceVersion, generation, labels, newAnnotations,
            finalizers, ownerReferences, creationTimestamp, deletionTimestamp);
    }

    public ObjectMeta withAnnotation(String key, String value) {
        Map<String, String> merged = new LinkedHashMap<>(annotations);
        merged.put(key, value);
        return withAnnotations(merged);
    }

    public ObjectMeta withFinalizers(List<String> newFinalizers) {
        return new ObjectMeta(name, namespace, uid, resourceVersion, generation, labels, annotations,
            newFinalizers, ownerReferences, creationTimestamp, deletionTimestamp);
    }

    public ObjectMeta withOwnerReferences(List<OwnerReference> newOwnerReferences) {
        return new ObjectMeta(name, namespace, uid, resourceVersion, generation, labels, annotations,
            finalizers, newOwnerReferences, creationTimestamp, deletionTimestamp);
    }

    public ObjectMeta withOwnerReference(OwnerReference reference) {
        List<OwnerReference> merged = new ArrayList<>();
        for (OwnerReference existing : ownerReferences) {
            if (!existing.uid().equals(reference.uid())) {
                merged.add(existing);
            }
        }
        merged.add(reference);
        return withOwnerReferences(merged);
    }
}
