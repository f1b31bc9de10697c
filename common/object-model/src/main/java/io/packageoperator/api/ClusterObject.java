package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kind-agnostic object envelope: {@code apiVersion}, {@code kind}, {@code metadata} and an opaque payload.
 * <p>
 * Instances are mutable, mirroring how controllers prepare an object before writing it. Use
 * {@link #deepCopy()} before handing an instance to code that must not observe later changes.
 */
public final class ClusterObject {

    private static final TypeReference<List<OwnerReference>> OWNER_REFERENCES = new TypeReference<>() {
    };

    private final ObjectNode content;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ClusterObject(ObjectNode content) {
        this.content = content == null ? JsonNodeFactory.instance.objectNode() : content;
    }

    public static ClusterObject of(GroupVersionKind gvk, String namespace, String name) {
        ClusterObject object = new ClusterObject(JsonNodeFactory.instance.objectNode());
        object.setGvk(gvk);
        object.setName(name);
        if (namespace != null && !namespace.isEmpty()) {
            object.setNamespace(namespace);
        }
        return object;
    }

    @JsonValue
    public ObjectNode content() {
        return content;
    }

    public GroupVersionKind gvk() {
        String apiVersion = content.path("apiVersion").asText("");
        String kind = content.path("kind").asText("");
        if (apiVersion.isEmpty() || kind.isEmpty()) {
            throw new IllegalStateException("object " + key() + " has no apiVersion/kind");
        }
        return GroupVersionKind.fromApiVersion(apiVersion, kind);
    }

    public boolean hasGvk() {
        return !content.path("apiVersion").asText("").isEmpty() && !content.path("kind").asText("").isEmpty();
    }

    public void setGvk(GroupVersionKind gvk) {
        content.put("apiVersion", gvk.apiVersion());
        content.put("kind", gvk.kind());
    }

    public String name() {
        return metadata().path("name").asText("");
    }

    public void setName(String name) {
        metadataForWrite().put("name", name);
    }

    public String namespace() {
        return metadata().path("namespace").asText("");
    }

    public void setNamespace(String namespace) {
        metadataForWrite().put("namespace", namespace);
    }

    public ObjectKey key() {
        return new ObjectKey(namespace(), name());
    }

    public String uid() {
        return metadata().path("uid").asText("");
    }

    public void setUid(String uid) {
        metadataForWrite().put("uid", uid);
    }

    public String resourceVersion() {
        return metadata().path("resourceVersion").asText("");
    }

    public void setResourceVersion(String resourceVersion) {
        if (resourceVersion == null || resourceVersion.isEmpty()) {
            metadataForWrite().remove("resourceVersion");
        } else {
            metadataForWrite().put("resourceVersion", resourceVersion);
        }
    }

    public long generation() {
        return metadata().path("generation").asLong(0L);
    }

    public void setGeneration(long generation) {
        metadataForWrite().put("generation", generation);
    }

    public Map<String, String> labels() {
        return stringMap("labels");
    }

    public void setLabels(Map<String, String> labels) {
        putStringMap("labels", labels);
    }

    public String label(String key) {
        return labels().get(key);
    }

    public void setLabel(String key, String value) {
        Map<String, String> labels = new LinkedHashMap<>(labels());
        labels.put(key, value);
        setLabels(labels);
    }

    public boolean removeLabel(String key) {
        Map<String, String> labels = new LinkedHashMap<>(labels());
        boolean removed = labels.remove(key) != null;
        if (removed) {
            setLabels(labels);
        }
        return removed;
    }

    public Map<String, String> annotations() {
        return stringMap("annotations");
    }

    public void setAnnotations(Map<String, String> annotations) {
        putStringMap("annotations", annotations);
    }

    public List<String> finalizers() {
        JsonNode node = metadata().path("finalizers");
        if (!node.isArray()) {
            return List.of();
        }
        List<String> finalizers = new ArrayList<>(node.size());
        node.forEach(f -> finalizers.add(f.asText()));
        return Collections.unmodifiableList(finalizers);
    }

    public void setFinalizers(List<String> finalizers) {
        if (finalizers == null || finalizers.isEmpty()) {
            metadataForWrite().remove("finalizers");
            return;
        }
        ArrayNode array = metadataForWrite().putArray("finalizers");
        finalizers.forEach(array::add);
    }

    public List<OwnerReference> ownerReferences() {
        JsonNode node = metadata().path("ownerReferences");
        if (!node.isArray() || node.isEmpty()) {
            return List.of();
        }
        return List.copyOf(ApiJson.mapper().convertValue(node, OWNER_REFERENCES));
    }

    public void setOwnerReferences(List<OwnerReference> references) {
        if (references == null || references.isEmpty()) {
            metadataForWrite().remove("ownerReferences");
            return;
        }
        metadataForWrite().set("ownerReferences", ApiJson.mapper().valueToTree(references));
    }

    public Instant creationTimestamp() {
        return instant("creationTimestamp");
    }

    public void setCreationTimestamp(Instant timestamp) {
        metadataForWrite().put("creationTimestamp", timestamp.toString());
    }

    public Instant deletionTimestamp() {
        return instant("deletionTimestamp");
    }

    public void setDeletionTimestamp(Instant timestamp) {
        metadataForWrite().put("deletionTimestamp", timestamp.toString());
    }

    public boolean isDeleting() {
        return deletionTimestamp() != null;
    }

    /**
     * Resolves a dotted field path such as {@code .status.readyReplicas}. Array elements may be addressed
     * by index ({@code .spec.containers.0.image}). Returns a missing node when the path does not exist.
     */
    public JsonNode field(String path) {
        Objects.requireNonNull(path, "path");
        JsonNode current = content;
        for (String segment : path.split("\\.")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (current.isArray() && segment.chars().allMatch(Character::isDigit)) {
                current = current.path(Integer.parseInt(segment));
            } else {
                current = current.path(segment);
            }
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    public JsonNode status() {
        return content.path("status");
    }

    public ClusterObject deepCopy() {
        return new ClusterObject(content.deepCopy());
    }

    private JsonNode metadata() {
        return content.path("metadata");
    }

    private ObjectNode metadataForWrite() {
        JsonNode existing = content.get("metadata");
        if (existing instanceof ObjectNode metadata) {
            return metadata;
        }
        return content.putObject("metadata");
    }

    private Map<String, String> stringMap(String field) {
        JsonNode node = metadata().path(field);
        if (!node.isObject() || node.isEmpty()) {
            return Map.of();
        }
        Map<String, String> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
        return Collections.unmodifiableMap(values);
    }

    private void putStringMap(String field, Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            metadataForWrite().remove(field);
            return;
        }
        ObjectNode node = metadataForWrite().putObject(field);
        values.forEach(node::put);
    }

    private Instant instant(String field) {
        JsonNode node = metadata().path(field);
        if (!node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("metadata." + field + " of " + key() + " is not a timestamp", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ClusterObject other && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return hasGvk() ? gvk().kind() + " " + key() : key().toString();
    }
}
