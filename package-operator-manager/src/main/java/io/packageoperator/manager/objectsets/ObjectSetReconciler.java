package io.packageoperator.manager.objectsets;

import com.fasterxml.jackson.databind.JsonNode;
import io.packageoperator.api.ApiJson;
import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.Condition;
import io.packageoperator.api.ConditionStatus;
import io.packageoperator.api.ControlledObjectReference;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.ObjectSet;
import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplatePhase;
import io.packageoperator.api.OwnerReference;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.dynamiccache.CacheObjects;
import io.packageoperator.dynamiccache.CacheOwner;
import io.packageoperator.dynamiccache.DynamicCache;
import io.packageoperator.manager.objectsets.probing.ProbeList;
import io.packageoperator.manager.objectsets.probing.ProbeParser;
import io.packageoperator.manager.objectsets.probing.ProbeResult;
import io.packageoperator.manager.slices.SliceStore;
import io.packageoperator.reconciler.Conditions;
import io.packageoperator.reconciler.MappedConditions;
import io.packageoperator.reconciler.ReconcileResult;
import io.packageoperator.reconciler.Reconciler;
import io.packageoperator.store.AlreadyExistsException;
import io.packageoperator.store.ConflictException;
import io.packageoperator.store.Finalizers;
import io.packageoperator.store.NotFoundException;
import io.packageoperator.store.ObjectStoreClient;
import io.packageoperator.store.ObjectStoreException;
import io.packageoperator.store.OwnerReferences;
import io.packageoperator.store.RetryOnConflict;
import io.packageoperator.store.TypedClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one ObjectSet revision through its phases.
 * <p>
 * Active revisions apply their phases in order and stop at the first phase whose objects fail the
 * availability probes. Archived and deleting revisions tear their objects down in reverse phase
 * order, one phase at a time.
 */
public class ObjectSetReconciler implements Reconciler<ObjectSet> {

  static final String REASON_PROBE_FAILURE = "ProbeFailure";

  private static final Logger log = LoggerFactory.getLogger(ObjectSetReconciler.class);

  private final ObjectStoreClient store;
  private final TypedClient<ObjectSet> objectSets;
  private final DynamicCache cache;
  private final SliceStore sliceStore;
  private final RetryOnConflict retry;
  private final Duration teardownPollInterval;
  private final Clock clock;

  public ObjectSetReconciler(ObjectStoreClient store,
                             TypedClient<ObjectSet> objectSets,
                             DynamicCache cache,
                             SliceStore sliceStore,
                             RetryOnConflict retry,
                             Duration teardownPollInterval,
                             Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.objectSets = Objects.requireNonNull(objectSets, "objectSets");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.sliceStore = Objects.requireNonNull(sliceStore, "sliceStore");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.teardownPollInterval = Objects.requireNonNull(teardownPollInterval, "teardownPollInterval");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public ReconcileResult reconcile(ObjectSet set) {
    ClusterObject raw = objectSets.encode(set);
    if (!set.metadata().isDeleting()) {
      raw = CacheObjects.ensureCachedFinalizer(store, raw);
      raw = ensureTeardownFinalizer(raw);
      set = objectSets.decode(raw);
    }
    if (set.metadata().isDeleting() || set.spec().lifecycleState() == ObjectSet.LifecycleState.ARCHIVED) {
      return teardown(set, raw);
    }
    if (set.spec().lifecycleState() == ObjectSet.LifecycleState.PAUSED) {
      return pause(set);
    }
    return apply(set, raw);
  }

  private ReconcileResult pause(ObjectSet set) {
    long generation = set.metadata().generationOrZero();
    writeStatus(set, status -> {
      List<Condition> conditions = new ArrayList<>(status.conditions());
      Conditions.set(conditions, Condition.of(PackageOperatorApi.CONDITION_PAUSED, ConditionStatus.TRUE,
          "Paused", "Lifecycle state set to paused", generation), clock.instant());
      return status.withConditions(conditions);
    });
    log.debug("ObjectSet {} is paused", set.metadata().key());
    return ReconcileResult.done();
  }

  private ReconcileResult apply(ObjectSet observed, ClusterObject raw) {
    CacheOwner owner = CacheOwner.of(raw);
    Long pendingRevision = revisionOf(observed);
    ObjectSet set = observed.status().phase() != null
        ? observed
        : writeStatus(observed, status -> status.withPhase(ObjectSet.Phase.PENDING).withRevision(pendingRevision));
    ProbeList probes = ProbeParser.parse(set.spec().availabilityProbes());
    Set<ControlledObjectReference> controlled = new LinkedHashSet<>();
    List<Condition> mapped = new ArrayList<>();
    Set<String> mappedTypes = new LinkedHashSet<>();
    long generation = set.metadata().generationOrZero();
    Instant now = clock.instant();
    String lastAvailablePhase = null;
    String failure = null;

    for (ObjectSetTemplatePhase phase : set.spec().phases()) {
      List<ClusterObject> phaseObjects = new ArrayList<>();
      for (ObjectSetObject object : expand(set, phase)) {
        ClusterObject actual = applyObject(set, owner, object.object());
        phaseObjects.add(actual);
        controlled.add(ControlledObjectReference.of(actual));
        mappedTypes.addAll(MappedConditions.map(mapped, conditionsOf(actual), actual.generation(),
            object.conditionMappings(), generation, now));
      }
      List<String> failures = new ArrayList<>();
      for (ClusterObject object : phaseObjects) {
        ProbeResult result = probes.probe(object);
        if (!result.success()) {
          failures.add(object + ": " + String.join(", ", result.messages()));
        }
      }
      if (!failures.isEmpty()) {
        failure = "Phase \"" + phase.name() + "\" failed: " + String.join("; ", failures);
        log.debug("ObjectSet {} waits on phase {}: {}", set.metadata().key(), phase.name(), failures);
        break;
      }
      lastAvailablePhase = phase.name();
    }

    String progress = lastAvailablePhase;
    String probeFailure = failure;
    List<ControlledObjectReference> controllerOf = List.copyOf(controlled);
    Long revision = revisionOf(set);
    writeStatus(set, status -> {
      List<Condition> conditions = new ArrayList<>(status.conditions());
      Conditions.remove(conditions, PackageOperatorApi.CONDITION_PAUSED);
      Conditions.remove(conditions, PackageOperatorApi.CONDITION_ARCHIVED);
      if (probeFailure == null) {
        Conditions.set(conditions, Condition.of(PackageOperatorApi.CONDITION_AVAILABLE, ConditionStatus.TRUE,
            "Available", "Object is available and passes all probes", generation), now);
      } else {
        Conditions.set(conditions, Condition.of(PackageOperatorApi.CONDITION_AVAILABLE, ConditionStatus.FALSE,
            REASON_PROBE_FAILURE, probeFailure, generation), now);
      }
      for (Condition condition : mapped) {
        Conditions.set(conditions, condition, now);
      }
      MappedConditions.deleteMappedExcept(conditions, mappedTypes);
      ObjectSet.Status updated = status.withConditions(conditions)
          .withPhase(probeFailure == null ? ObjectSet.Phase.AVAILABLE : ObjectSet.Phase.PROGRESSING)
          .withControllerOf(controllerOf)
          .withRevision(revision);
      return progress == null ? updated : updated.withLastAvailablePhase(progress);
    });
    return ReconcileResult.done();
  }

  /**
   * Creates or updates one object so that it matches its template and is controlled by {@code set}.
   */
  private ClusterObject applyObject(ObjectSet set, CacheOwner owner, ClusterObject template) {
    ClusterObject desired = template.deepCopy();
    if (desired.namespace().isEmpty()) {
      desired.setNamespace(set.metadata().namespace());
    }
    CacheObjects.ensureCacheLabel(desired);
    OwnerReference controller = OwnerReference.controllerOf(PackageOperatorApi.OBJECT_SET.gvk(),
        set.metadata().name(), set.metadata().uid());
    OwnerReferences.setController(desired, controller);

    GroupVersionKind gvk = desired.gvk();
    ObjectKey key = desired.key();
    cache.watch(owner, gvk, key);
    Optional<ClusterObject> existing = cache.find(gvk, key);
    if (existing.isEmpty()) {
      try {
        ClusterObject created = store.create(desired);
        log.info("Created {} for ObjectSet {}", created, set.metadata().key());
        return created;
      } catch (AlreadyExistsException e) {
        // not labelled for the cache yet, or the cache has not caught up
        existing = Optional.of(store.get(gvk, key));
      }
    }

    AtomicReference<ClusterObject> base = new AtomicReference<>(existing.get());
    return retry.call("applying " + desired + " for ObjectSet " + set.metadata().key(), () -> {
      ClusterObject actual = base.get();
      Optional<OwnerReference> current = OwnerReferences.controllerOf(actual);
      if (current.isPresent() && !current.get().uid().equals(controller.uid())) {
        if (!isPreviousRevision(set, current.get())) {
          throw new ObjectNotOwnedException(actual, current.get());
        }
        log.info("ObjectSet {} adopts {} from {}", set.metadata().key(), actual, current.get().name());
      }

      ClusterObject merged = merge(actual, desired, controller);
      if (merged.equals(actual)) {
        return actual;
      }
      try {
        ClusterObject updated = store.update(merged);
        log.info("Updated {} for ObjectSet {}", updated, set.metadata().key());
        return updated;
      } catch (ConflictException e) {
        base.set(store.get(gvk, key));
        throw e;
      }
    });
  }

  private ReconcileResult teardown(ObjectSet set, ClusterObject raw) {
    String uid = set.metadata().uid();
    for (List<ControlledObjectReference> group : teardownGroups(set)) {
      int pending = 0;
      for (ControlledObjectReference ref : group) {
        Optional<ClusterObject> actual = find(ref.gvk(), ref.key());
        if (actual.isEmpty() || !OwnerReferences.isControlledBy(actual.get(), uid)) {
          continue;
        }
        if (!actual.get().isDeleting()) {
          try {
            store.delete(ref.gvk(), ref.key());
            log.info("Deleted {} of ObjectSet {}", actual.get(), set.metadata().key());
          } catch (NotFoundException e) {
            continue;
          }
        }
        if (find(ref.gvk(), ref.key()).isPresent()) {
          pending++;
        }
      }
      if (pending > 0) {
        log.debug("ObjectSet {} waits for {} objects to go away", set.metadata().key(), pending);
        if (set.metadata().isDeleting()) {
          writeStatus(set, status -> status.withPhase(ObjectSet.Phase.DELETING));
        }
        return ReconcileResult.requeueAfter(teardownPollInterval);
      }
    }

    if (set.metadata().isDeleting()) {
      ClusterObject remaining = removeTeardownFinalizer(raw);
      CacheObjects.freeCacheAndRemoveFinalizer(cache, store, remaining);
      log.info("ObjectSet {} torn down", set.metadata().key());
      return ReconcileResult.done();
    }
    cache.free(CacheOwner.of(raw));
    long generation = set.metadata().generationOrZero();
    writeStatus(set, status -> {
      List<Condition> conditions = new ArrayList<>(status.conditions());
      Conditions.remove(conditions, PackageOperatorApi.CONDITION_PAUSED);
      Conditions.set(conditions, Condition.of(PackageOperatorApi.CONDITION_ARCHIVED, ConditionStatus.TRUE,
          "Archived", "Object is archived and all objects are cleaned up", generation), clock.instant());
      return status.withConditions(conditions)
          .withPhase(ObjectSet.Phase.ARCHIVED)
          .withControllerOf(List.of());
    });
    return ReconcileResult.done();
  }

  /**
   * Objects to remove, grouped by phase, last phase first. When slices are already gone the recorded
   * {@code controllerOf} list is used as one group instead.
   */
  private List<List<ControlledObjectReference>> teardownGroups(ObjectSet set) {
    List<List<ControlledObjectReference>> groups = new ArrayList<>();
    try {
      for (ObjectSetTemplatePhase phase : set.spec().phases()) {
        List<ControlledObjectReference> group = new ArrayList<>();
        for (ObjectSetObject object : sliceStore.expand(set.metadata().namespace(), phase)) {
          ClusterObject template = object.object();
          String namespace = template.namespace().isEmpty() ? set.metadata().namespace() : template.namespace();
          group.add(ControlledObjectReference.of(template.gvk(), ObjectKey.of(namespace, template.name())));
        }
        Collections.reverse(group);
        groups.add(group);
      }
    } catch (NotFoundException e) {
      log.debug("ObjectSet {} lost a slice ({}), tearing down from its status", set.metadata().key(),
          e.getMessage());
      List<ControlledObjectReference> recorded = new ArrayList<>(set.status().controllerOf());
      Collections.reverse(recorded);
      return List.of(recorded);
    }
    Collections.reverse(groups);
    return groups;
  }

  private List<ObjectSetObject> expand(ObjectSet set, ObjectSetTemplatePhase phase) {
    try {
      return sliceStore.expand(set.metadata().namespace(), phase);
    } catch (NotFoundException e) {
      throw new ObjectStoreException("expanding slices of phase " + phase.name() + ": " + e.getMessage(), e);
    }
  }

  private Optional<ClusterObject> find(GroupVersionKind gvk, ObjectKey key) {
    try {
      return Optional.of(store.get(gvk, key));
    } catch (NotFoundException e) {
      return Optional.empty();
    }
  }

  private ClusterObject ensureTeardownFinalizer(ClusterObject raw) {
    try {
      return Finalizers.ensure(store, raw, PackageOperatorApi.TEARDOWN_FINALIZER);
    } catch (ConflictException e) {
      throw e;
    } catch (ObjectStoreException e) {
      throw new ObjectStoreException("adding teardown finalizer: " + e.getMessage(), e);
    }
  }

  private ClusterObject removeTeardownFinalizer(ClusterObject raw) {
    try {
      return Finalizers.remove(store, raw, PackageOperatorApi.TEARDOWN_FINALIZER);
    } catch (NotFoundException | ConflictException e) {
      throw e;
    } catch (ObjectStoreException e) {
      throw new ObjectStoreException("removing teardown finalizer: " + e.getMessage(), e);
    }
  }

  private ObjectSet writeStatus(ObjectSet set, UnaryOperator<ObjectSet.Status> change) {
    ObjectKey key = set.metadata().key();
    AtomicReference<ObjectSet> base = new AtomicReference<>(set);
    return retry.call("updating status of ObjectSet " + key, () -> {
      ObjectSet current = base.get();
      ObjectSet.Status updated = change.apply(current.status());
      if (updated.equals(current.status())) {
        return current;
      }
      try {
        return objectSets.updateStatus(current.withStatus(updated));
      } catch (ConflictException e) {
        base.set(objectSets.get(key));
        throw e;
      }
    });
  }

  private static boolean isPreviousRevision(ObjectSet set, OwnerReference controller) {
    return controller.groupKind().equals(PackageOperatorApi.OBJECT_SET.gvk().groupKind())
        && set.spec().previous().contains(controller.name());
  }

  /**
   * Overlays {@code desired} onto {@code actual}: labels and annotations are merged, every other
   * top-level field outside {@code metadata} and {@code status} is replaced.
   */
  static ClusterObject merge(ClusterObject actual, ClusterObject desired, OwnerReference controller) {
    ClusterObject merged = actual.deepCopy();
    for (Iterator<Map.Entry<String, JsonNode>> it = desired.content().fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> field = it.next();
      if (!"metadata".equals(field.getKey()) && !"status".equals(field.getKey())) {
        merged.content().set(field.getKey(), field.getValue().deepCopy());
      }
    }
    Map<String, String> labels = new LinkedHashMap<>(actual.labels());
    labels.putAll(desired.labels());
    merged.setLabels(labels);
    Map<String, String> annotations = new LinkedHashMap<>(actual.annotations());
    annotations.putAll(desired.annotations());
    merged.setAnnotations(annotations);
    OwnerReferences.setController(merged, controller);
    return merged;
  }

  private static List<Condition> conditionsOf(ClusterObject object) {
    JsonNode conditions = object.status().path("conditions");
    if (!conditions.isArray()) {
      return List.of();
    }
    List<Condition> result = new ArrayList<>();
    for (JsonNode node : conditions) {
      if (!node.path("type").isTextual()) {
        continue;
      }
      try {
        result.add(ApiJson.mapper().convertValue(node, Condition.class));
      } catch (IllegalArgumentException e) {
        log.debug("Skipping unreadable condition on {}: {}", object, e.getMessage());
      }
    }
    return result;
  }

  private static Long revisionOf(ObjectSet set) {
    String annotation = set.metadata().annotations().get(PackageOperatorApi.REVISION_ANNOTATION);
    if (annotation == null) {
      return set.status().revision();
    }
    try {
      return Long.parseLong(annotation);
    } catch (NumberFormatException e) {
      return set.status().revision();
    }
  }
}
