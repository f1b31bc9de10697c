package io.packageoperator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.packageoperator.api.ApiJson;
import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link ObjectStoreClient}.
 * <p>
 * Resource versions come from a single counter. The generation is bumped whenever anything outside
 * {@code metadata} and {@code status} changes. Deleting an object that still carries finalizers only
 * sets its deletion timestamp; the object is removed once the last finalizer is gone, and removal
 * cascades to every object that lists it in its owner references and has no other live owner.
 * <p>
 * Watch events are delivered synchronously while the store lock is held.
 */
public class InMemoryObjectStore implements ObjectStoreClient {

    public static final int DEFAULT_MAX_OBJECT_BYTES = 1_572_864;

    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStore.class);

    private final Map<GroupVersionKind, TreeMap<ObjectKey, ClusterObject>> objects = new HashMap<>();
    private final List<Watch> watches = new CopyOnWriteArrayList<>();
    private final int maxObjectBytes;
    private final Clock clock;
    private long resourceVersion;

    public InMemoryObjectStore() {
        this(DEFAULT_MAX_OBJECT_BYTES, Clock.systemUTC());
    }

    public InMemoryObjectStore(int maxObjectBytes, Clock clock) {
        if (maxObjectBytes <= 0) {
            throw new IllegalArgumentException("maxObjectBytes must be positive");
        }
        this.maxObjectBytes = maxObjectBytes;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized ClusterObject get(GroupVersionKind gvk, ObjectKey key) {
        ClusterObject stored = kind(gvk).get(key);
        if (stored == null) {
            throw new NotFoundException(gvk, key);
        }
        return stored.deepCopy();
    }

    @Override
    public synchronized List<ClusterObject> list(GroupVersionKind gvk, ListOptions options) {
        List<ClusterObject> result = new ArrayList<>();
        for (ClusterObject stored : kind(gvk).values()) {
            if (options.matches(stored)) {
                result.add(stored.deepCopy());
            }
        }
        return result;
    }

    @Override
    public synchronized ClusterObject create(ClusterObject object) {
        GroupVersionKind gvk = requireAddressable(object);
        ObjectKey key = object.key();
        TreeMap<ObjectKey, ClusterObject> byKey = kind(gvk);
        if (byKey.containsKey(key)) {
            throw new AlreadyExistsException(gvk, key);
        }
        ClusterObject created = object.deepCopy();
        metadataOf(created).remove("deletionTimestamp");
        created.setUid(UUID.randomUUID().toString());
        created.setGeneration(1L);
        created.setCreationTimestamp(clock.instant());
        created.setResourceVersion(nextResourceVersion());
        normalizeFinalizers(created);
        checkSize(created);
        byKey.put(key, created);
        notifyWatches(gvk, null, created);
        return created.deepCopy();
    }

    @Override
    public synchronized ClusterObject update(ClusterObject object) {
        GroupVersionKind gvk = requireAddressable(object);
        ClusterObject stored = existing(gvk, object.key());
        checkResourceVersion(gvk, stored, object.resourceVersion());
        ClusterObject updated = object.deepCopy();
        JsonNode status = stored.content().get("status");
        if (status == null) {
            updated.content().remove("status");
        } else {
            updated.content().set("status", status.deepCopy());
        }
        return replace(gvk, stored, updated);
    }

    @Override
    public synchronized ClusterObject updateStatus(ClusterObject object) {
        GroupVersionKind gvk = requireAddressable(object);
        ClusterObject stored = existing(gvk, object.key());
        checkResourceVersion(gvk, stored, object.resourceVersion());
        ClusterObject updated = stored.deepCopy();
        JsonNode status = object.content().get("status");
        if (status == null) {
            updated.content().remove("status");
        } else {
            updated.content().set("status", status.deepCopy());
        }
        return replace(gvk, stored, updated);
    }

    @Override
    public synchronized ClusterObject patch(GroupVersionKind gvk, ObjectKey key, ObjectNode mergePatch) {
        ClusterObject stored = existing(gvk, key);
        JsonNode precondition = mergePatch.path("metadata").path("resourceVersion");
        if (precondition.isTextual()) {
            checkResourceVersion(gvk, stored, precondition.asText());
        }
        ObjectNode effective = mergePatch.deepCopy();
        effective.remove("status");
        JsonNode merged = JsonMergePatch.apply(stored.content(), effective);
        if (!merged.isObject()) {
            throw new InvalidObjectException("Patch of " + gvk.kind() + " " + key + " is not an object");
        }
        ClusterObject updated = new ClusterObject((ObjectNode) merged);
        JsonNode status = stored.content().get("status");
        if (status != null) {
            updated.content().set("status", status.deepCopy());
        }
        return replace(gvk, stored, updated);
    }

    @Override
    public synchronized void delete(GroupVersionKind gvk, ObjectKey key) {
        ClusterObject stored = existing(gvk, key);
        if (!stored.finalizers().isEmpty()) {
            if (stored.isDeleting()) {
                return;
            }
            ClusterObject marked = stored.deepCopy();
            marked.setDeletionTimestamp(clock.instant());
            marked.setResourceVersion(nextResourceVersion());
            kind(gvk).put(key, marked);
            notifyWatches(gvk, stored, marked);
            return;
        }
        remove(gvk, stored);
    }

    @Override
    public Subscription watch(GroupVersionKind gvk, ListOptions options, WatchListener listener) {
        Watch watch = new Watch(gvk, options, listener);
        synchronized (this) {
            watches.add(watch);
            for (ClusterObject stored : kind(gvk).values()) {
                if (options.matches(stored)) {
                    watch.deliver(new WatchEvent(WatchEvent.Type.ADDED, stored.deepCopy()));
                }
            }
        }
        return () -> watches.remove(watch);
    }

    public synchronized int size(GroupVersionKind gvk) {
        return kind(gvk).size();
    }

    private ClusterObject replace(GroupVersionKind gvk, ClusterObject stored, ClusterObject updated) {
        // uid, creation and deletion timestamps are owned by the store
        updated.setUid(stored.uid());
        ObjectNode metadata = metadataOf(updated);
        copyOrRemove(stored, metadata, "creationTimestamp");
        copyOrRemove(stored, metadata, "deletionTimestamp");
        normalizeFinalizers(updated);
        updated.setGeneration(contentChanged(stored, updated) ? stored.generation() + 1 : stored.generation());
        if (sameIgnoringResourceVersion(stored, updated)) {
            return stored.deepCopy();
        }
        updated.setResourceVersion(nextResourceVersion());
        checkSize(updated);
        if (updated.isDeleting() && updated.finalizers().isEmpty()) {
            remove(gvk, stored);
            return updated.deepCopy();
        }
        kind(gvk).put(updated.key(), updated);
        notifyWatches(gvk, stored, updated);
        return updated.deepCopy();
    }

    private void remove(GroupVersionKind gvk, ClusterObject stored) {
        kind(gvk).remove(stored.key());
        notifyWatches(gvk, stored, null);
        log.debug("Removed {} {}", gvk.kind(), stored.key());
        cascade(stored.uid());
    }

    private void cascade(String ownerUid) {
        Set<String> live = new HashSet<>();
        for (TreeMap<ObjectKey, ClusterObject> byKey : objects.values()) {
            byKey.values().forEach(object -> live.add(object.uid()));
        }
        List<ClusterObject> dependents = new ArrayList<>();
        for (TreeMap<ObjectKey, ClusterObject> byKey : objects.values()) {
            for (ClusterObject candidate : byKey.values()) {
                if (OwnerReferences.isOwnedBy(candidate, ownerUid)
                    && candidate.ownerReferences().stream().noneMatch(ref -> live.contains(ref.uid()))) {
                    dependents.add(candidate);
                }
            }
        }
        for (ClusterObject dependent : dependents) {
            GroupVersionKind gvk = dependent.gvk();
            if (kind(gvk).containsKey(dependent.key())) {
                delete(gvk, dependent.key());
            }
        }
    }

    private void notifyWatches(GroupVersionKind gvk, ClusterObject before, ClusterObject after) {
        for (Watch watch : watches) {
            if (!watch.gvk.equals(gvk)) {
                continue;
            }
            boolean matchedBefore = before != null && watch.options.matches(before);
            boolean matchesNow = after != null && watch.options.matches(after);
            if (matchesNow) {
                WatchEvent.Type type = matchedBefore ? WatchEvent.Type.MODIFIED : WatchEvent.Type.ADDED;
                watch.deliver(new WatchEvent(type, after.deepCopy()));
            } else if (matchedBefore) {
                ClusterObject last = after != null ? after : before;
                watch.deliver(new WatchEvent(WatchEvent.Type.DELETED, last.deepCopy()));
            }
        }
    }

    private TreeMap<ObjectKey, ClusterObject> kind(GroupVersionKind gvk) {
        return objects.computeIfAbsent(gvk, k -> new TreeMap<>());
    }

    private ClusterObject existing(GroupVersionKind gvk, ObjectKey key) {
        ClusterObject stored = kind(gvk).get(key);
        if (stored == null) {
            throw new NotFoundException(gvk, key);
        }
        return stored;
    }

    private GroupVersionKind requireAddressable(ClusterObject object) {
        if (!object.hasGvk()) {
            throw new InvalidObjectException("Object " + object.key() + " has no apiVersion/kind");
        }
        if (object.name().isBlank()) {
            throw new InvalidObjectException(object.gvk().kind() + " has no metadata.name");
        }
        return object.gvk();
    }

    private void checkResourceVersion(GroupVersionKind gvk, ClusterObject stored, String expected) {
        if (expected != null && !expected.isEmpty() && !expected.equals(stored.resourceVersion())) {
            throw new ConflictException(gvk, stored.key(), expected, stored.resourceVersion());
        }
    }

    private void checkSize(ClusterObject object) {
        int size = ApiJson.serializedSize(object.content());
        if (size > maxObjectBytes) {
            throw new InvalidObjectException(object.gvk().kind() + " " + object.key() + " is " + size
                + " bytes, the limit is " + maxObjectBytes);
        }
    }

    private String nextResourceVersion() {
        return Long.toString(++resourceVersion);
    }

    private static void normalizeFinalizers(ClusterObject object) {
        object.setFinalizers(object.finalizers());
    }

    private static boolean contentChanged(ClusterObject stored, ClusterObject updated) {
        ObjectNode before = stored.content().deepCopy();
        ObjectNode after = updated.content().deepCopy();
        for (ObjectNode node : List.of(before, after)) {
            node.remove("metadata");
            node.remove("status");
        }
        return !before.equals(after);
    }

    private static boolean sameIgnoringResourceVersion(ClusterObject stored, ClusterObject updated) {
        ObjectNode before = stored.content().deepCopy();
        ObjectNode after = updated.content().deepCopy();
        metadataOf(before).remove("resourceVersion");
        metadataOf(after).remove("resourceVersion");
        return before.equals(after);
    }

    private static ObjectNode metadataOf(ClusterObject object) {
        return metadataOf(object.content());
    }

    private static ObjectNode metadataOf(ObjectNode content) {
        JsonNode metadata = content.get("metadata");
        if (metadata instanceof ObjectNode node) {
            return node;
        }
        return content.putObject("metadata");
    }

    private static void copyOrRemove(ClusterObject source, ObjectNode metadata, String field) {
        JsonNode value = source.content().path("metadata").get(field);
        if (value == null) {
            metadata.remove(field);
        } else {
            metadata.set(field, value.deepCopy());
        }
    }

    private static final class Watch {

        private final GroupVersionKind gvk;
        private final ListOptions options;
        private final WatchListener listener;

        private Watch(GroupVersionKind gvk, ListOptions options, WatchListener listener) {
            this.gvk = gvk;
            this.options = options;
            this.listener = listener;
        }

        private void deliver(WatchEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Watch listener for {} failed on {} {}", gvk.kind(), event.type(), event.object().key(), e);
            }
        }
    }
}
