package io.packageoperator.dynamiccache;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.LabelSelector;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.OwnerReference;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.NotFoundException;
import io.packageoperator.store.ObjectReader;
import io.packageoperator.store.ObjectStoreClient;
import io.packageoperator.store.OwnerReferences;
import io.packageoperator.store.Subscription;
import io.packageoperator.store.WatchEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference-counted, label-gated cache over arbitrary kinds.
 * <p>
 * The first {@link #watch} for a kind starts an informer that lists and watches objects of that kind
 * carrying the cache label and keeps them in a local index. The informer stops when the last owner
 * watching the kind is {@link #free freed}. Reads are served from the index only.
 * <p>
 * The registration table is guarded by this object's monitor. The monitor is never held while calling
 * the store, because the store delivers events under its own lock and event routing needs the table.
 */
public class DynamicCache implements ObjectReader, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(DynamicCache.class);

  private static final ListOptions ADMITTED = ListOptions.all().withSelector(
      LabelSelector.matching(PackageOperatorApi.DYNAMIC_CACHE_LABEL, PackageOperatorApi.DYNAMIC_CACHE_LABEL_VALUE));

  private final ObjectStoreClient store;
  private final EventSink sink;
  private final Map<GroupVersionKind, Map<CacheOwner, Set<ObjectKey>>> registrations = new HashMap<>();
  private final Map<GroupVersionKind, Informer> informers = new ConcurrentHashMap<>();

  public DynamicCache(ObjectStoreClient store, EventSink sink) {
    this.store = Objects.requireNonNull(store, "store");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Registers {@code owner}'s interest in {@code object} and, through it, in the object's kind.
   */
  public void watch(CacheOwner owner, ClusterObject object) {
    watch(owner, object.gvk(), object.key());
  }

  public void watch(CacheOwner owner, GroupVersionKind gvk, ObjectKey key) {
    Objects.requireNonNull(owner, "owner");
    Informer started;
    synchronized (this) {
      registrations.computeIfAbsent(gvk, k -> new HashMap<>())
          .computeIfAbsent(owner, k -> new HashSet<>())
          .add(key);
      if (informers.containsKey(gvk)) {
        return;
      }
      started = new Informer(gvk);
      informers.put(gvk, started);
    }
    started.start();
  }

  /**
   * Drops every registration of {@code owner}. Informers of kinds nobody watches any more are stopped.
   */
  public void free(CacheOwner owner) {
    List<Informer> stopped = new ArrayList<>();
    synchronized (this) {
      for (var it = registrations.entrySet().iterator(); it.hasNext(); ) {
        Map.Entry<GroupVersionKind, Map<CacheOwner, Set<ObjectKey>>> entry = it.next();
        entry.getValue().remove(owner);
        if (entry.getValue().isEmpty()) {
          it.remove();
          Informer informer = informers.remove(entry.getKey());
          if (informer != null) {
            stopped.add(informer);
          }
        }
      }
    }
    stopped.forEach(Informer::stop);
  }

  @Override
  public ClusterObject get(GroupVersionKind gvk, ObjectKey key) {
    ClusterObject cached = informer(gvk).index.get(key);
    if (cached == null) {
      throw new NotFoundException(gvk, key);
    }
    return cached.deepCopy();
  }

  public Optional<ClusterObject> find(GroupVersionKind gvk, ObjectKey key) {
    ClusterObject cached = informer(gvk).index.get(key);
    return Optional.ofNullable(cached).map(ClusterObject::deepCopy);
  }

  @Override
  public List<ClusterObject> list(GroupVersionKind gvk, ListOptions options) {
    List<ClusterObject> result = new ArrayList<>();
    for (ClusterObject cached : informer(gvk).index.values()) {
      if (options.matches(cached)) {
        result.add(cached.deepCopy());
      }
    }
    result.sort((a, b) -> a.key().compareTo(b.key()));
    return result;
  }

  public boolean isWatching(GroupVersionKind gvk) {
    return informers.containsKey(gvk);
  }

  public synchronized Set<CacheOwner> owners(GroupVersionKind gvk) {
    Map<CacheOwner, Set<ObjectKey>> owners = registrations.get(gvk);
    return owners == null ? Set.of() : Set.copyOf(owners.keySet());
  }

  @Override
  public void close() {
    List<Informer> stopped;
    synchronized (this) {
      stopped = new ArrayList<>(informers.values());
      informers.clear();
      registrations.clear();
    }
    stopped.forEach(Informer::stop);
  }

  synchronized Set<CacheOwner> interestedOwners(GroupVersionKind gvk, ClusterObject object) {
    Map<CacheOwner, Set<ObjectKey>> owners = registrations.get(gvk);
    if (owners == null || owners.isEmpty()) {
      return Set.of();
    }
    String controllerUid = OwnerReferences.controllerOf(object).map(OwnerReference::uid).orElse(null);
    Set<CacheOwner> interested = new LinkedHashSet<>();
    for (Map.Entry<CacheOwner, Set<ObjectKey>> entry : owners.entrySet()) {
      if (entry.getValue().contains(object.key()) || entry.getKey().uid().equals(controllerUid)) {
        interested.add(entry.getKey());
      }
    }
    return Collections.unmodifiableSet(interested);
  }

  private Informer informer(GroupVersionKind gvk) {
    Informer informer = informers.get(gvk);
    if (informer == null) {
      throw new CacheAdmissionException(gvk);
    }
    informer.awaitSynced();
    return informer;
  }

  private final class Informer {

    private final GroupVersionKind gvk;
    private final Map<ObjectKey, ClusterObject> index = new ConcurrentHashMap<>();
    private final CountDownLatch synced = new CountDownLatch(1);
    private volatile Subscription subscription;
    private volatile boolean stopped;

    private Informer(GroupVersionKind gvk) {
      this.gvk = gvk;
    }

    private void start() {
      try {
        subscription = store.watch(gvk, ADMITTED, this::onEvent);
      } finally {
        synced.countDown();
      }
      if (stopped) {
        subscription.close();
        return;
      }
      log.info("Cache informer for {} started ({} objects)", gvk, index.size());
    }

    private void stop() {
      stopped = true;
      Subscription current = subscription;
      if (current != null) {
        current.close();
      }
      index.clear();
      log.info("Cache informer for {} stopped", gvk);
    }

    private void awaitSynced() {
      try {
        synced.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Interrupted while waiting for cache of " + gvk);
      }
    }

    private void onEvent(WatchEvent event) {
      if (stopped) {
        return;
      }
      ClusterObject object = event.object();
      if (event.type() == WatchEvent.Type.DELETED) {
        index.remove(object.key());
      } else {
        index.put(object.key(), object);
      }
      Set<CacheOwner> owners = interestedOwners(gvk, object);
      if (!owners.isEmpty()) {
        sink.handle(event, owners);
      }
    }
  }
}
