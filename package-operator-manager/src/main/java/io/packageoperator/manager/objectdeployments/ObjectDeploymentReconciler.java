package io.packageoperator.manager.objectdeployments;

import io.packageoperator.api.Condition;
import io.packageoperator.api.ConditionStatus;
import io.packageoperator.api.ContentHash;
import io.packageoperator.api.ControlledObjectReference;
import io.packageoperator.api.ApiJson;
import io.packageoperator.api.ObjectDeployment;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.ObjectMeta;
import io.packageoperator.api.ObjectSet;
import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplate;
import io.packageoperator.api.ObjectSetTemplatePhase;
import io.packageoperator.api.ObjectSetTemplateSpec;
import io.packageoperator.api.OwnerReference;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.manager.slices.Chunker;
import io.packageoperator.manager.slices.SliceCollisionException;
import io.packageoperator.manager.slices.SliceGarbageCollector;
import io.packageoperator.manager.slices.SliceStore;
import io.packageoperator.reconciler.Conditions;
import io.packageoperator.reconciler.MappedConditions;
import io.packageoperator.reconciler.ReconcileMetrics;
import io.packageoperator.reconciler.ReconcileResult;
import io.packageoperator.reconciler.Reconciler;
import io.packageoperator.store.ConflictException;
import io.packageoperator.store.InvalidObjectException;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.NotFoundException;
import io.packageoperator.store.ObjectStoreException;
import io.packageoperator.store.RetryOnConflict;
import io.packageoperator.store.TypedClient;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
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
 * Rolls an ObjectDeployment out as a series of immutable ObjectSet revisions.
 * <p>
 * Revisions are matched by their expanded content, never by slice names, so re-slicing the same
 * template is not a change. A new revision is claimed first (empty and paused), then its slices are
 * written and finally the revision is sealed with the sliced template. A pass interrupted in between
 * leaves an unsealed revision that the next pass completes.
 */
public class ObjectDeploymentReconciler implements Reconciler<ObjectDeployment> {

  static final String REASON_SLICE_COLLISION = "SliceHashCollision";

  private static final Logger log = LoggerFactory.getLogger(ObjectDeploymentReconciler.class);

  private final TypedClient<ObjectDeployment> deployments;
  private final TypedClient<ObjectSet> objectSets;
  private final SliceStore sliceStore;
  private final SliceGarbageCollector garbageCollector;
  private final Chunker chunker;
  private final RetryOnConflict retry;
  private final int maxCollisionRetries;
  private final ReconcileMetrics metrics;
  private final Clock clock;

  public ObjectDeploymentReconciler(TypedClient<ObjectDeployment> deployments,
                                    TypedClient<ObjectSet> objectSets,
                                    SliceStore sliceStore,
                                    SliceGarbageCollector garbageCollector,
                                    Chunker chunker,
                                    RetryOnConflict retry,
                                    int maxCollisionRetries,
                                    ReconcileMetrics metrics,
                                    Clock clock) {
    this.deployments = Objects.requireNonNull(deployments, "deployments");
    this.objectSets = Objects.requireNonNull(objectSets, "objectSets");
    this.sliceStore = Objects.requireNonNull(sliceStore, "sliceStore");
    this.garbageCollector = Objects.requireNonNull(garbageCollector, "garbageCollector");
    this.chunker = Objects.requireNonNull(chunker, "chunker");
    this.retry = Objects.requireNonNull(retry, "retry");
    if (maxCollisionRetries < 0) {
      throw new IllegalArgumentException("maxCollisionRetries must not be negative");
    }
    this.maxCollisionRetries = maxCollisionRetries;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public ReconcileResult reconcile(ObjectDeployment deployment) {
    ObjectMeta meta = deployment.metadata();
    if (meta.isDeleting()) {
      log.debug("ObjectDeployment {} is being deleted, revisions go with it", meta.key());
      return ReconcileResult.done();
    }
    String namespace = meta.namespace();
    List<ObjectSet> revisions = listRevisions(deployment);
    ObjectSetTemplateSpec desired = deployment.spec().template().spec();
    ObjectSetTemplateSpec expandedDesired = expand(namespace, desired, "ObjectDeployment " + meta.key());
    int collisionCount = deployment.status().collisionCountOrZero();
    String templateHash = ContentHash.of(expandedDesired, collisionCount);

    ObjectSet current = findMatching(namespace, revisions, expandedDesired, templateHash);
    if (current == null) {
      ObjectKey revisionKey = ObjectKey.of(namespace, meta.name() + "-" + templateHash);
      Optional<ObjectSet> existing = objectSets.find(revisionKey);
      if (existing.isPresent() && !Revisions.isUnsealed(existing.get(), templateHash)) {
        log.warn("ObjectSet {} exists with a different template, bumping collision count of ObjectDeployment {}",
            revisionKey, meta.key());
        writeStatus(deployment, status -> status.withCollisionCount(collisionCount + 1));
        return ReconcileResult.requeue();
      }
      ObjectSet claimed = existing.isPresent()
          ? existing.get()
          : claimRevision(deployment, revisionKey, templateHash, revisions);
      AtomicReference<ObjectDeployment> latest = new AtomicReference<>(deployment);
      current = seal(latest, claimed, desired, templateHash);
      deployment = latest.get();
      revisions = replace(revisions, current);
    } else if (current.spec().lifecycleState() != ObjectSet.LifecycleState.ACTIVE) {
      current = setLifecycleState(current, ObjectSet.LifecycleState.ACTIVE);
      log.info("Re-activated revision {} of ObjectDeployment {}", current.metadata().key(), meta.key());
      revisions = replace(revisions, current);
    }

    archiveSuperseded(current, revisions);
    pruneHistory(deployment, current, revisions);
    collectSlices(deployment, current);

    ObjectSet rolledOut = current;
    boolean othersActive = revisions.stream()
        .anyMatch(r -> !isSame(r, rolledOut) && !Revisions.isArchived(r) && !r.metadata().isDeleting());
    ObjectDeployment observed = deployment;
    writeStatus(deployment, status -> desiredStatus(status, observed, rolledOut, templateHash, othersActive));
    return ReconcileResult.done();
  }

  private List<ObjectSet> listRevisions(ObjectDeployment deployment) {
    String uid = deployment.metadata().uid();
    return listSelected(deployment).stream()
        .filter(set -> isControlledBy(set, uid))
        .sorted(Revisions.BY_REVISION)
        .toList();
  }

  /** Every ObjectSet the selector matches, controlled or not. Slices they reference stay alive. */
  private List<ObjectSet> listSelected(ObjectDeployment deployment) {
    ObjectMeta meta = deployment.metadata();
    return objectSets.list(new ListOptions(meta.namespace(), deployment.spec().selector()));
  }

  private ObjectSet findMatching(String namespace,
                                 List<ObjectSet> revisions,
                                 ObjectSetTemplateSpec expandedDesired,
                                 String templateHash) {
    ObjectSet match = null;
    for (ObjectSet revision : revisions) {
      if (revision.metadata().isDeleting() || Revisions.isUnsealed(revision, templateHash)) {
        continue;
      }
      ObjectSetTemplateSpec expanded;
      try {
        expanded = sliceStore.expand(namespace, revision.spec().template());
      } catch (NotFoundException e) {
        log.debug("Revision {} references a missing slice, it cannot match", revision.metadata().key());
        continue;
      }
      if (ApiJson.sameContent(expanded, expandedDesired)) {
        match = revision;
      }
    }
    return match;
  }

  private ObjectSet claimRevision(ObjectDeployment deployment,
                                  ObjectKey key,
                                  String templateHash,
                                  List<ObjectSet> revisions) {
    ObjectMeta owner = deployment.metadata();
    ObjectSetTemplate.Metadata template = deployment.spec().template().metadata();
    Map<String, String> labels = new LinkedHashMap<>(template.labels());
    labels.put(PackageOperatorApi.OBJECT_DEPLOYMENT_LABEL, owner.name());
    if (!deployment.spec().selector().matches(labels)) {
      throw new InvalidObjectException("Template labels of ObjectDeployment " + owner.key()
          + " do not match its selector");
    }
    long number = revisions.stream().mapToLong(Revisions::number).max().orElse(0L) + 1;
    Map<String, String> annotations = new LinkedHashMap<>(template.annotations());
    annotations.put(PackageOperatorApi.REVISION_ANNOTATION, Long.toString(number));
    annotations.put(PackageOperatorApi.TEMPLATE_HASH_ANNOTATION, templateHash);
    List<String> previous = revisions.stream()
        .filter(r -> !r.metadata().isDeleting())
        .map(r -> r.metadata().name())
        .toList();
    ObjectMeta metadata = ObjectMeta.named(key.namespace(), key.name())
        .withLabels(labels)
        .withAnnotations(annotations)
        .withOwnerReferences(List.of(OwnerReference.controllerOf(
            PackageOperatorApi.OBJECT_DEPLOYMENT.gvk(), owner.name(), owner.uid())));
    ObjectSet claimed = objectSets.create(new ObjectSet(metadata,
        new ObjectSet.Spec(ObjectSet.LifecycleState.PAUSED, previous, null, null), null));
    log.info("Created revision {} (#{}) of ObjectDeployment {}", key, number, owner.key());
    return claimed;
  }

  /**
   * Writes the slices of {@code desired} and stores the sliced template in the claimed revision. Slice
   * name collisions are resolved by moving to the next salt, a bounded number of times.
   */
  private ObjectSet seal(AtomicReference<ObjectDeployment> deployment,
                         ObjectSet claimed,
                         ObjectSetTemplateSpec desired,
                         String templateHash) {
    ObjectSetTemplateSpec sliced;
    int attempt = 0;
    while (true) {
      int salt = deployment.get().status().sliceCollisionCountOrZero();
      try {
        sliced = slice(deployment.get(), desired, salt);
        break;
      } catch (SliceCollisionException e) {
        metrics.sliceCollision();
        log.warn("{} while slicing ObjectDeployment {} with salt {}", e.getMessage(),
            deployment.get().metadata().key(), salt);
        Condition condition = Condition.of(PackageOperatorApi.CONDITION_SLICE_COLLISION, ConditionStatus.TRUE,
            REASON_SLICE_COLLISION, e.getMessage(), deployment.get().metadata().generationOrZero());
        deployment.set(writeStatus(deployment.get(), status -> {
          List<Condition> conditions = new ArrayList<>(status.conditions());
          Conditions.set(conditions, condition, clock.instant());
          return status.withConditions(conditions).withSliceCollisionCount(status.sliceCollisionCountOrZero() + 1);
        }));
        if (attempt >= maxCollisionRetries) {
          throw e;
        }
        attempt++;
      }
    }
    ObjectKey key = claimed.metadata().key();
    ObjectSetTemplateSpec template = sliced;
    ObjectSet sealed = retry.call("sealing revision " + key, () -> {
      ObjectSet latest = objectSets.get(key);
      if (!Revisions.isUnsealed(latest, templateHash)) {
        return latest;
      }
      return objectSets.update(latest.withSpec(
          ObjectSet.Spec.of(ObjectSet.LifecycleState.ACTIVE, latest.spec().previous(), template)));
    });
    log.info("Sealed revision {} of ObjectDeployment {}", key, deployment.get().metadata().key());
    return sealed;
  }

  private ObjectSetTemplateSpec slice(ObjectDeployment deployment, ObjectSetTemplateSpec desired, int salt) {
    List<ObjectSetTemplatePhase> phases = new ArrayList<>(desired.phases().size());
    for (ObjectSetTemplatePhase phase : desired.phases()) {
      List<List<ObjectSetObject>> chunks = chunker.chunk(phase);
      if (chunks.isEmpty()) {
        phases.add(phase);
        continue;
      }
      List<String> sliceNames = new ArrayList<>();
      for (List<ObjectSetObject> chunk : chunks) {
        sliceNames.add(sliceStore.create(deployment, chunk, salt).metadata().name());
      }
      sliceNames.addAll(phase.slices());
      phases.add(ObjectSetTemplatePhase.sliced(phase.name(), sliceNames));
    }
    return desired.withPhases(phases);
  }

  private void archiveSuperseded(ObjectSet current, List<ObjectSet> revisions) {
    if (!Revisions.isAvailable(current)) {
      return;
    }
    for (ObjectSet revision : revisions) {
      if (isSame(revision, current) || Revisions.isArchived(revision) || revision.metadata().isDeleting()) {
        continue;
      }
      setLifecycleState(revision, ObjectSet.LifecycleState.ARCHIVED);
      log.info("Archived revision {} superseded by {}", revision.metadata().key(), current.metadata().key());
    }
  }

  private void pruneHistory(ObjectDeployment deployment, ObjectSet current, List<ObjectSet> revisions) {
    List<ObjectSet> archived = revisions.stream()
        .filter(r -> !isSame(r, current) && Revisions.isArchived(r) && !r.metadata().isDeleting())
        .sorted(Revisions.BY_REVISION)
        .toList();
    int excess = archived.size() - deployment.spec().revisionHistoryLimitOrDefault();
    for (int i = 0; i < excess; i++) {
      ObjectKey key = archived.get(i).metadata().key();
      try {
        objectSets.delete(key);
        log.info("Deleted revision {} beyond the history limit of ObjectDeployment {}", key,
            deployment.metadata().key());
      } catch (NotFoundException e) {
        log.debug("Revision {} already deleted", key);
      }
    }
  }

  private void collectSlices(ObjectDeployment deployment, ObjectSet current) {
    Set<String> referenced = new LinkedHashSet<>(Revisions.sliceNames(deployment.spec().template().spec()));
    referenced.addAll(Revisions.sliceNames(current.spec().template()));
    referenced.addAll(Revisions.sliceNames(listSelected(deployment)));
    garbageCollector.collect(deployment, referenced);
  }

  private ObjectDeployment.Status desiredStatus(ObjectDeployment.Status status,
                                                ObjectDeployment deployment,
                                                ObjectSet current,
                                                String templateHash,
                                                boolean othersActive) {
    long generation = deployment.metadata().generationOrZero();
    Instant now = clock.instant();
    List<Condition> conditions = new ArrayList<>(status.conditions());
    Optional<Condition> available = Conditions.find(current.status().conditions(),
        PackageOperatorApi.CONDITION_AVAILABLE);
    Conditions.set(conditions, available
        .map(c -> new Condition(c.type(), c.status(), c.reason(), c.message(), generation, null))
        .orElseGet(() -> Condition.of(PackageOperatorApi.CONDITION_AVAILABLE, ConditionStatus.FALSE,
            "RevisionPending", "Revision " + current.metadata().name() + " has not reported availability",
            generation)), now);
    boolean progressing = !Revisions.isAvailable(current) || othersActive;
    Conditions.set(conditions, Condition.of(PackageOperatorApi.CONDITION_PROGRESSING,
        ConditionStatus.of(progressing),
        progressing ? "RolloutInProgress" : "Idle",
        progressing
            ? "Rolling out revision " + current.metadata().name()
            : "Revision " + current.metadata().name() + " is rolled out",
        generation), now);
    Conditions.remove(conditions, PackageOperatorApi.CONDITION_SLICE_COLLISION);
    Set<String> mapped = MappedConditions.map(conditions, Revisions.mappedConditions(current),
        current.metadata().generationOrZero(), List.of(), generation, now);
    MappedConditions.deleteMappedExcept(conditions, mapped);
    return status.withConditions(conditions)
        .withTemplateHash(templateHash)
        .withControllerOf(List.of(ControlledObjectReference.of(
            PackageOperatorApi.OBJECT_SET.gvk(), current.metadata().key())));
  }

  /**
   * Applies {@code change} to the deployment's status and writes it when it changed. The first attempt
   * works on the given object; after a conflict the deployment is re-read.
   */
  private ObjectDeployment writeStatus(ObjectDeployment deployment, UnaryOperator<ObjectDeployment.Status> change) {
    ObjectKey key = deployment.metadata().key();
    AtomicReference<ObjectDeployment> base = new AtomicReference<>(deployment);
    return retry.call("updating status of ObjectDeployment " + key, () -> {
      ObjectDeployment current = base.get();
      ObjectDeployment.Status updated = change.apply(current.status());
      if (updated.equals(current.status())) {
        return current;
      }
      try {
        return deployments.updateStatus(current.withStatus(updated));
      } catch (ConflictException e) {
        base.set(deployments.get(key));
        throw e;
      }
    });
  }

  private ObjectSet setLifecycleState(ObjectSet revision, ObjectSet.LifecycleState state) {
    ObjectKey key = revision.metadata().key();
    AtomicReference<ObjectSet> base = new AtomicReference<>(revision);
    return retry.call("setting " + key + " to " + state, () -> {
      ObjectSet current = base.get();
      if (current.spec().lifecycleState() == state) {
        return current;
      }
      try {
        return objectSets.update(current.withSpec(current.spec().withLifecycleState(state)));
      } catch (ConflictException e) {
        base.set(objectSets.get(key));
        throw e;
      }
    });
  }

  private ObjectSetTemplateSpec expand(String namespace, ObjectSetTemplateSpec spec, String owner) {
    try {
      return sliceStore.expand(namespace, spec);
    } catch (NotFoundException e) {
      throw new ObjectStoreException("expanding slices of " + owner + ": " + e.getMessage(), e);
    }
  }

  private static List<ObjectSet> replace(List<ObjectSet> revisions, ObjectSet updated) {
    List<ObjectSet> result = new ArrayList<>(revisions.size() + 1);
    boolean replaced = false;
    for (ObjectSet revision : revisions) {
      if (isSame(revision, updated)) {
        result.add(updated);
        replaced = true;
      } else {
        result.add(revision);
      }
    }
    if (!replaced) {
      result.add(updated);
    }
    result.sort(Revisions.BY_REVISION);
    return result;
  }

  private static boolean isSame(ObjectSet a, ObjectSet b) {
    return a.metadata().key().equals(b.metadata().key());
  }

  private static boolean isControlledBy(ObjectSet set, String uid) {
    return set.metadata().ownerReferences().stream()
        .anyMatch(ref -> ref.controls() && ref.uid().equals(uid));
  }
}
