package io.packageoperator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.packageoperator.api.ApiJson;
import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.Resource;
import io.packageoperator.api.ResourceType;

/**
 * Converts typed resources to and from the kind-agnostic envelope.
 */
public final class ResourceCodec {

    private final ObjectMapper mapper;

    public ResourceCodec() {
        this(ApiJson.mapper());
    }

    public ResourceCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public <T extends Resource<T>> ClusterObject encode(ResourceType<T> type, T resource) {
        ObjectNode content;
        try {
            content = mapper.valueToTree(resource);
        } catch (IllegalArgumentException e) {
            throw new InvalidObjectException("Unable to encode " + type.gvk().kind(), e);
        }
        ObjectNode ordered = mapper.createObjectNode();
        ordered.put("apiVersion", type.gvk().apiVersion());
        ordered.put("kind", type.gvk().kind());
        ordered.setAll(content);
        return new ClusterObject(ordered);
    }

    public <T extends Resource<T>> T decode(ResourceType<T> type, ClusterObject object) {
        ObjectNode content = object.content().deepCopy();
        content.remove("apiVersion");
        content.remove("kind");
        try {
            return mapper.treeToValue(content, type.type());
        } catch (Exception e) {
            throw new InvalidObjectException("Unable to decode " + type.gvk().kind() + " " + object.key(), e);
        }
    }
}
