package io.packageoperator.store;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.Resource;
import io.packageoperator.api.ResourceType;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed view of one kind on top of an {@link ObjectStoreClient}.
 */
public class TypedClient<T extends Resource<T>> {

    private final ObjectStoreClient client;
    private final ResourceType<T> type;
    private final ResourceCodec codec;

    public TypedClient(ObjectStoreClient client, ResourceType<T> type, ResourceCodec codec) {
        this.client = Objects.requireNonNull(client, "client");
        this.type = Objects.requireNonNull(type, "type");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public ResourceType<T> type() {
        return type;
    }

    public T get(ObjectKey key) {
        return decode(client.get(type.gvk(), key));
    }

    public Optional<T> find(ObjectKey key) {
        try {
            return Optional.of(get(key));
        } catch (NotFoundException e) {
            return Optional.empty();
        }
    }

    public List<T> list(ListOptions options) {
        return client.list(type.gvk(), options).stream().map(this::decode).toList();
    }

    public T create(T resource) {
        return decode(client.create(encode(resource)));
    }

    public T update(T resource) {
        return decode(client.update(encode(resource)));
    }

    public T updateStatus(T resource) {
        return decode(client.updateStatus(encode(resource)));
    }

    public void delete(ObjectKey key) {
        client.delete(type.gvk(), key);
    }

    public T ensureFinalizer(T resource, String finalizer) {
        if (resource.metadata().hasFinalizer(finalizer)) {
            return resource;
        }
        return decode(Finalizers.ensure(client, encode(resource), finalizer));
    }

    public T removeFinalizer(T resource, String finalizer) {
        if (!resource.metadata().hasFinalizer(finalizer)) {
            return resource;
        }
        return decode(Finalizers.remove(client, encode(resource), finalizer));
    }

    public Subscription watch(ListOptions options, WatchListener listener) {
        return client.watch(type.gvk(), options, listener);
    }

    public ClusterObject encode(T resource) {
        return codec.encode(type, resource);
    }

    public T decode(ClusterObject object) {
        return codec.decode(type, object);
    }
}
