package io.packageoperator.dynamiccache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.OwnerReference;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.store.InMemoryObjectStore;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.NotFoundException;
import io.packageoperator.store.WatchEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DynamicCacheTest {

  private static final GroupVersionKind CONFIG_MAP = new GroupVersionKind("", "v1", "ConfigMap");
  private static final CacheOwner FIRST = new CacheOwner(PackageOperatorApi.OBJECT_SET.gvk(),
      ObjectKey.of("test", "rev-1"), "uid-1");
  private static final CacheOwner SECOND = new CacheOwner(PackageOperatorApi.OBJECT_SET.gvk(),
      ObjectKey.of("test", "rev-2"), "uid-2");

  private final InMemoryObjectStore store = new InMemoryObjectStore();
  private final List<Delivery> deliveries = new ArrayList<>();
  private final DynamicCache cache = new DynamicCache(store,
      (event, owners) -> deliveries.add(new Delivery(event.type(), event.object().name(), owners)));

  @AfterEach
  void tearDown() {
    cache.close();
  }

  @Test
  void readingUnregisteredKindIsRejected() {
    assertThatThrownBy(() -> cache.get(CONFIG_MAP, ObjectKey.of("test", "cm")))
        .isInstanceOf(CacheAdmissionException.class)
        .hasMessageContaining("ConfigMap");
    assertThatThrownBy(() -> cache.list(CONFIG_MAP, ListOptions.all()))
        .isInstanceOf(CacheAdmissionException.class);
  }

  @Test
  void onlyLabelledObjectsAreIndexed() {
    store.create(configMap("plain", false));
    store.create(configMap("labelled", true));

    cache.watch(FIRST, CONFIG_MAP, ObjectKey.of("test", "labelled"));

    assertThat(cache.get(CONFIG_MAP, ObjectKey.of("test", "labelled")).name()).isEqualTo("labelled");
    assertThatThrownBy(() -> cache.get(CONFIG_MAP, ObjectKey.of("test", "plain")))
        .isInstanceOf(NotFoundException.class);
    assertThat(cache.list(CONFIG_MAP, ListOptions.all())).extracting(ClusterObject::name)
        .containsExactly("labelled");
  }

  @Test
  void keepsDeliveringToRemainingOwnerAndStopsWhenAllAreFreed() {
    ClusterObject created = store.create(configMap("cm", true));
    cache.watch(FIRST, created);
    cache.watch(SECOND, created);

    cache.free(FIRST);
    deliveries.clear();
    created.setLabel("touched", "yes");
    ClusterObject updated = store.update(created);

    assertThat(cache.isWatching(CONFIG_MAP)).isTrue();
    assertThat(deliveries).singleElement()
        .satisfies(d -> assertThat(d.owners()).containsExactly(SECOND));

    cache.free(SECOND);
    deliveries.clear();
    updated.setLabel("touched", "again");
    store.update(updated);

    assertThat(cache.isWatching(CONFIG_MAP)).isFalse();
    assertThat(deliveries).isEmpty();
    assertThatThrownBy(() -> cache.get(CONFIG_MAP, created.key())).isInstanceOf(CacheAdmissionException.class);
  }

  @Test
  void routesEventsOfControlledObjectsToTheirController() {
    cache.watch(FIRST, CONFIG_MAP, ObjectKey.of("test", "other"));
    deliveries.clear();

    ClusterObject controlled = configMap("controlled", true);
    controlled.setOwnerReferences(List.of(
        OwnerReference.controllerOf(FIRST.gvk(), FIRST.key().name(), FIRST.uid())));
    store.create(controlled);
    store.create(configMap("unrelated", true));

    assertThat(deliveries).singleElement().satisfies(d -> {
      assertThat(d.name()).isEqualTo("controlled");
      assertThat(d.owners()).containsExactly(FIRST);
    });
  }

  @Test
  void removingTheLabelEvictsTheObject() {
    ClusterObject created = store.create(configMap("cm", true));
    cache.watch(FIRST, created);

    CacheObjects.removeCacheLabel(created);
    store.update(created);

    assertThat(cache.find(CONFIG_MAP, created.key())).isEmpty();
    assertThat(deliveries).extracting(Delivery::type).endsWith(WatchEvent.Type.DELETED);
  }

  private static ClusterObject configMap(String name, boolean labelled) {
    ClusterObject object = ClusterObject.of(CONFIG_MAP, "test", name);
    if (labelled) {
      CacheObjects.ensureCacheLabel(object);
    }
    return object;
  }

  private record Delivery(WatchEvent.Type type, String name, Set<CacheOwner> owners) {
  }
}
