package io.packageoperator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.LabelSelector;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.OwnerReference;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryObjectStoreTest {

    private static final GroupVersionKind CONFIG_MAP = new GroupVersionKind("", "v1", "ConfigMap");
    private static final ObjectKey KEY = ObjectKey.of("test", "cm");

    private InMemoryObjectStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryObjectStore(InMemoryObjectStore.DEFAULT_MAX_OBJECT_BYTES,
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createAssignsIdentityAndRejectsDuplicates() {
        ClusterObject created = store.create(configMap("cm", "v"));

        assertThat(created.uid()).isNotBlank();
        assertThat(created.resourceVersion()).isNotBlank();
        assertThat(created.generation()).isEqualTo(1L);
        assertThat(created.creationTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThatThrownBy(() -> store.create(configMap("cm", "v")))
            .isInstanceOf(AlreadyExistsException.class)
            .hasMessageContaining("test/cm");
    }

    @Test
    void getOfMissingObjectThrowsNotFound() {
        assertThatThrownBy(() -> store.get(CONFIG_MAP, KEY))
            .isInstanceOf(NotFoundException.class)
            .satisfies(e -> assertThat(((NotFoundException) e).key()).isEqualTo(KEY));
    }

    @Test
    void staleResourceVersionConflicts() {
        ClusterObject created = store.create(configMap("cm", "v1"));
        ClusterObject first = created.deepCopy();
        ((ObjectNode) first.content().get("data")).put("k", "v2");
        store.update(first);

        ClusterObject stale = created.deepCopy();
        ((ObjectNode) stale.content().get("data")).put("k", "v3");

        assertThatThrownBy(() -> store.update(stale)).isInstanceOf(ConflictException.class);
        assertThat(store.get(CONFIG_MAP, KEY).field(".data.k").asText()).isEqualTo("v2");
    }

    @Test
    void generationOnlyMovesWithContentChanges() {
        ClusterObject created = store.create(configMap("cm", "v1"));

        created.setLabel("a", "b");
        ClusterObject relabelled = store.update(created);
        assertThat(relabelled.generation()).isEqualTo(1L);

        ((ObjectNode) relabelled.content().get("data")).put("k", "v2");
        ClusterObject changed = store.update(relabelled);
        assertThat(changed.generation()).isEqualTo(2L);
    }

    @Test
    void identicalUpdateKeepsResourceVersion() {
        ClusterObject created = store.create(configMap("cm", "v1"));

        ClusterObject again = store.update(created.deepCopy());

        assertThat(again.resourceVersion()).isEqualTo(created.resourceVersion());
    }

    @Test
    void updateAndStatusUpdateTouchSeparateParts() {
        ClusterObject created = store.create(configMap("cm", "v1"));
        ClusterObject withStatus = created.deepCopy();
        withStatus.content().putObject("status").put("ready", true);
        ((ObjectNode) withStatus.content().get("data")).put("k", "ignored");

        ClusterObject statusWritten = store.updateStatus(withStatus);
        assertThat(statusWritten.field(".status.ready").asBoolean()).isTrue();
        assertThat(statusWritten.field(".data.k").asText()).isEqualTo("v1");

        statusWritten.content().remove("status");
        ClusterObject specWritten = store.update(statusWritten);
        assertThat(specWritten.field(".status.ready").asBoolean()).isTrue();
    }

    @Test
    void mergePatchHonoursResourceVersionPrecondition() {
        ClusterObject created = store.create(configMap("cm", "v1"));
        ObjectNode patch = JsonNodeFactory.instance.objectNode();
        patch.putObject("metadata").put("resourceVersion", "999").putObject("labels").put("x", "y");

        assertThatThrownBy(() -> store.patch(CONFIG_MAP, KEY, patch)).isInstanceOf(ConflictException.class);

        ((ObjectNode) patch.get("metadata")).put("resourceVersion", created.resourceVersion());
        ClusterObject patched = store.patch(CONFIG_MAP, KEY, patch);
        assertThat(patched.labels()).containsEntry("x", "y");
        assertThat(patched.field(".data.k").asText()).isEqualTo("v1");
    }

    @Test
    void finalizersDelayRemoval() {
        ClusterObject object = configMap("cm", "v1");
        object.setFinalizers(List.of("example.com/hold"));
        ClusterObject created = store.create(object);

        store.delete(CONFIG_MAP, KEY);
        ClusterObject deleting = store.get(CONFIG_MAP, KEY);
        assertThat(deleting.isDeleting()).isTrue();

        Finalizers.remove(store, deleting, "example.com/hold");

        assertThat(store.size(CONFIG_MAP)).isZero();
        assertThat(created.uid()).isEqualTo(deleting.uid());
    }

    @Test
    void removalCascadesToDependents() {
        ClusterObject owner = store.create(configMap("owner", "v"));
        ClusterObject dependent = configMap("dependent", "v");
        dependent.setOwnerReferences(List.of(OwnerReference.controllerOf(CONFIG_MAP, owner.name(), owner.uid())));
        store.create(dependent);

        store.delete(CONFIG_MAP, owner.key());

        assertThat(store.list(CONFIG_MAP, ListOptions.all())).isEmpty();
    }

    @Test
    void rejectsObjectsAboveTheSizeLimit() {
        InMemoryObjectStore small = new InMemoryObjectStore(64, Clock.systemUTC());
        ClusterObject big = configMap("cm", "x".repeat(128));

        assertThatThrownBy(() -> small.create(big))
            .isInstanceOf(InvalidObjectException.class)
            .hasMessageContaining("limit is 64");
    }

    @Test
    void listFiltersByNamespaceAndLabels() {
        ClusterObject labelled = configMap("a", "v");
        labelled.setLabel("app", "web");
        store.create(labelled);
        store.create(configMap("b", "v"));

        assertThat(store.list(CONFIG_MAP, ListOptions.labelled("test", Map.of("app", "web"))))
            .extracting(ClusterObject::name)
            .containsExactly("a");
        assertThat(store.list(CONFIG_MAP, ListOptions.inNamespace("other"))).isEmpty();
    }

    @Test
    void watchReplaysExistingObjectsAndReportsSelectorExits() {
        ClusterObject labelled = configMap("cm", "v");
        labelled.setLabel("cache", "True");
        ClusterObject created = store.create(labelled);
        List<WatchEvent> events = new ArrayList<>();

        Subscription subscription = store.watch(CONFIG_MAP,
            ListOptions.all().withSelector(LabelSelector.matching("cache", "True")), events::add);

        created.removeLabel("cache");
        store.update(created);
        subscription.close();
        store.delete(CONFIG_MAP, KEY);

        assertThat(events).extracting(WatchEvent::type)
            .containsExactly(WatchEvent.Type.ADDED, WatchEvent.Type.DELETED);
    }

    private static ClusterObject configMap(String name, String value) {
        ClusterObject object = ClusterObject.of(CONFIG_MAP, "test", name);
        object.content().putObject("data").put("k", value);
        return object;
    }
}
