package io.packageoperator.manager.objectdeployments;

import static io.packageoperator.manager.TestObjects.NAMESPACE;
import static io.packageoperator.manager.TestObjects.configMap;
import static io.packageoperator.manager.TestObjects.deployment;
import static io.packageoperator.manager.TestObjects.template;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.Condition;
import io.packageoperator.api.ConditionStatus;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectDeployment;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.ObjectMeta;
import io.packageoperator.api.ObjectSet;
import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplate;
import io.packageoperator.api.ObjectSetTemplatePhase;
import io.packageoperator.api.ObjectSetTemplateSpec;
import io.packageoperator.api.ObjectSlice;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.manager.slices.Chunker;
import io.packageoperator.manager.slices.EachObjectChunker;
import io.packageoperator.manager.slices.SliceCollisionException;
import io.packageoperator.manager.slices.SliceGarbageCollector;
import io.packageoperator.manager.slices.SliceStore;
import io.packageoperator.reconciler.Conditions;
import io.packageoperator.reconciler.ReconcileMetrics;
import io.packageoperator.reconciler.ReconcileResult;
import io.packageoperator.store.ConflictException;
import io.packageoperator.store.InMemoryObjectStore;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.ObjectStoreException;
import io.packageoperator.store.ResourceCodec;
import io.packageoperator.store.RetryOnConflict;
import io.packageoperator.store.TypedClient;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatcher;
import org.mockito.Mockito;
import org.slf4j.LoggerFactory;

class ObjectDeploymentReconcilerTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
  private static final ObjectKey DEPLOYMENT = ObjectKey.of(NAMESPACE, "test-depl");

  private final InMemoryObjectStore store = spy(new InMemoryObjectStore());
  private final ResourceCodec codec = new ResourceCodec();
  private final TypedClient<ObjectDeployment> deployments =
      new TypedClient<>(store, PackageOperatorApi.OBJECT_DEPLOYMENT, codec);
  private final TypedClient<ObjectSet> objectSets = new TypedClient<>(store, PackageOperatorApi.OBJECT_SET, codec);
  private final TypedClient<ObjectSlice> slices = new TypedClient<>(store, PackageOperatorApi.OBJECT_SLICE, codec);
  private final SliceStore sliceStore = new SliceStore(slices);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ReconcileMetrics metrics = new ReconcileMetrics(registry);

  private final Logger reconcilerLogger = (Logger) LoggerFactory.getLogger(ObjectDeploymentReconciler.class);
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

  @AfterEach
  void detachAppender() {
    reconcilerLogger.detachAppender(appender);
  }

  @Test
  void firstPassClaimsAnEmptyRevisionThenSealsItWithSlices() {
    ObjectSetObject object = new ObjectSetObject(configMap("cm", "a"));
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", List.of(object)))));
    clearInvocations(store);

    ReconcileResult result = reconciler(new EachObjectChunker(), 5).reconcile(created);

    assertThat(result.isDone()).isTrue();
    String sliceName = SliceStore.nameFor("test-depl", List.of(object), 0);
    ArgumentCaptor<ClusterObject> creates = ArgumentCaptor.forClass(ClusterObject.class);
    verify(store, times(2)).create(creates.capture());
    ObjectSet claimed = objectSets.decode(creates.getAllValues().get(0));
    assertThat(claimed.metadata().name()).startsWith("test-depl-");
    assertThat(claimed.spec().lifecycleState()).isEqualTo(ObjectSet.LifecycleState.PAUSED);
    assertThat(claimed.spec().phases()).isEmpty();
    assertThat(claimed.metadata().annotations())
        .containsEntry(PackageOperatorApi.REVISION_ANNOTATION, "1")
        .containsKey(PackageOperatorApi.TEMPLATE_HASH_ANNOTATION);
    assertThat(creates.getAllValues().get(1).name()).isEqualTo(sliceName);

    ArgumentCaptor<ClusterObject> updates = ArgumentCaptor.forClass(ClusterObject.class);
    verify(store).update(updates.capture());
    ObjectSet sealed = objectSets.decode(updates.getValue());
    assertThat(sealed.spec().lifecycleState()).isEqualTo(ObjectSet.LifecycleState.ACTIVE);
    assertThat(sealed.spec().phases()).singleElement().satisfies(phase -> {
      assertThat(phase.name()).isEqualTo("deploy");
      assertThat(phase.objects()).isEmpty();
      assertThat(phase.slices()).containsExactly(sliceName);
    });

    ObjectDeployment.Status status = deployments.get(DEPLOYMENT).status();
    assertThat(status.templateHash()).isNotBlank();
    assertThat(status.controllerOf()).singleElement()
        .satisfies(ref -> assertThat(ref.name()).isEqualTo(claimed.metadata().name()));
    assertThat(Conditions.find(status.conditions(), PackageOperatorApi.CONDITION_PROGRESSING))
        .hasValueSatisfying(c -> assertThat(c.isTrue()).isTrue());
  }

  @Test
  void repeatedPassWithoutChangesWritesNothing() {
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", List.of(new ObjectSetObject(configMap("cm", "a")))))));
    ObjectDeploymentReconciler reconciler = reconciler(new EachObjectChunker(), 5);
    reconciler.reconcile(created);
    clearInvocations(store);

    reconciler.reconcile(deployments.get(DEPLOYMENT));

    verify(store, never()).create(any());
    verify(store, never()).update(any());
    verify(store, never()).updateStatus(any());
    verify(store, never()).patch(any(), any(), any());
    verify(store, never()).delete(any(), any());
  }

  @Test
  void conflictWhileSealingIsRetried() {
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", List.of(new ObjectSetObject(configMap("cm", "a")))))));
    Mockito.doThrow(new ConflictException(PackageOperatorApi.OBJECT_SET.gvk(), ObjectKey.of(NAMESPACE, "x"), "1", "2"))
        .doCallRealMethod()
        .when(store).update(argThat(ofKind(PackageOperatorApi.OBJECT_SET.gvk())));

    reconciler(new EachObjectChunker(), 5).reconcile(created);

    verify(store, times(2)).update(argThat(ofKind(PackageOperatorApi.OBJECT_SET.gvk())));
    assertThat(objectSets.list(ListOptions.inNamespace(NAMESPACE))).singleElement()
        .satisfies(set -> assertThat(set.spec().lifecycleState()).isEqualTo(ObjectSet.LifecycleState.ACTIVE));
  }

  @Test
  void sliceNameCollisionMovesToTheNextSalt() {
    reconcilerLogger.addAppender(appender);
    appender.start();
    List<ObjectSetObject> objects = List.of(new ObjectSetObject(configMap("cm", "a")));
    String takenName = SliceStore.nameFor("test-depl", objects, 0);
    slices.create(new ObjectSlice(ObjectMeta.named(NAMESPACE, takenName), objects));
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", objects))));
    clearInvocations(store);

    reconciler(new EachObjectChunker(), 5).reconcile(created);

    verify(store, times(2)).create(argThat(ofKind(PackageOperatorApi.OBJECT_SLICE.gvk())));
    String salted = SliceStore.nameFor("test-depl", objects, 1);
    assertThat(objectSets.list(ListOptions.inNamespace(NAMESPACE))).singleElement()
        .satisfies(set -> assertThat(set.spec().phases().get(0).slices()).containsExactly(salted));
    ObjectDeployment.Status status = deployments.get(DEPLOYMENT).status();
    assertThat(status.sliceCollisionCount()).isEqualTo(1);
    assertThat(Conditions.find(status.conditions(), PackageOperatorApi.CONDITION_SLICE_COLLISION)).isEmpty();
    assertThat(registry.get("po_slice_collisions_total").counter().count()).isEqualTo(1.0);
    assertThat(appender.list).anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().contains("ObjectSlice collision with " + NAMESPACE + "/" + takenName));
  }

  @Test
  void exhaustedCollisionBudgetFailsThePassAndReportsTheCondition() {
    List<ObjectSetObject> objects = List.of(new ObjectSetObject(configMap("cm", "a")));
    slices.create(new ObjectSlice(ObjectMeta.named(NAMESPACE, SliceStore.nameFor("test-depl", objects, 0)), objects));
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", objects))));

    assertThatThrownBy(() -> reconciler(new EachObjectChunker(), 0).reconcile(created))
        .isInstanceOf(SliceCollisionException.class);

    ObjectDeployment.Status status = deployments.get(DEPLOYMENT).status();
    assertThat(status.sliceCollisionCount()).isEqualTo(1);
    assertThat(Conditions.find(status.conditions(), PackageOperatorApi.CONDITION_SLICE_COLLISION))
        .hasValueSatisfying(c -> {
          assertThat(c.isTrue()).isTrue();
          assertThat(c.reason()).isEqualTo(ObjectDeploymentReconciler.REASON_SLICE_COLLISION);
        });
  }

  @Test
  void newRevisionArchivesItsPredecessorOnceAvailable() {
    ObjectDeploymentReconciler reconciler = reconciler(new EachObjectChunker(), 5);
    deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", List.of(new ObjectSetObject(configMap("cm", "a")))))));
    reconciler.reconcile(deployments.get(DEPLOYMENT));
    ObjectSet first = onlyRevision();
    markAvailable(first);

    changeTemplate("b");
    reconciler.reconcile(deployments.get(DEPLOYMENT));
    ObjectSet second = revisionOtherThan(first);
    assertThat(second.spec().previous()).containsExactly(first.metadata().name());
    assertThat(second.metadata().annotations()).containsEntry(PackageOperatorApi.REVISION_ANNOTATION, "2");
    assertThat(objectSets.get(first.metadata().key()).spec().lifecycleState())
        .isEqualTo(ObjectSet.LifecycleState.ACTIVE);

    markAvailable(second);
    reconciler.reconcile(deployments.get(DEPLOYMENT));

    assertThat(objectSets.get(first.metadata().key()).spec().lifecycleState())
        .isEqualTo(ObjectSet.LifecycleState.ARCHIVED);
    ObjectDeployment.Status status = deployments.get(DEPLOYMENT).status();
    assertThat(Conditions.isTrue(status.conditions(), PackageOperatorApi.CONDITION_AVAILABLE)).isTrue();
    assertThat(status.controllerOf()).singleElement()
        .satisfies(ref -> assertThat(ref.name()).isEqualTo(second.metadata().name()));
  }

  @Test
  void archivedRevisionsBeyondTheHistoryLimitAreDeletedWithTheirSlices() {
    ObjectDeploymentReconciler reconciler = reconciler(new EachObjectChunker(), 5);
    ObjectDeployment initial = deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", List.of(new ObjectSetObject(configMap("cm", "a"))))));
    deployments.create(initial.withSpec(new ObjectDeployment.Spec(0, null, initial.spec().template())));
    reconciler.reconcile(deployments.get(DEPLOYMENT));
    ObjectSet first = onlyRevision();
    String firstSlice = first.spec().phases().get(0).slices().get(0);
    markAvailable(first);

    changeTemplate("b");
    reconciler.reconcile(deployments.get(DEPLOYMENT));
    ObjectSet second = revisionOtherThan(first);
    markAvailable(second);
    reconciler.reconcile(deployments.get(DEPLOYMENT));
    reconciler.reconcile(deployments.get(DEPLOYMENT));

    assertThat(objectSets.find(first.metadata().key())).isEmpty();
    assertThat(sliceStore.get(NAMESPACE, firstSlice)).isEmpty();
    assertThat(sliceStore.get(NAMESPACE, second.spec().phases().get(0).slices().get(0))).isPresent();
  }

  @Test
  void unreferencedSlicesAreCollected() {
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", List.of(new ObjectSetObject(configMap("cm", "a")))))));
    String stray = sliceStore.create(created, List.of(new ObjectSetObject(configMap("stray", "x"))), 0)
        .metadata().name();
    clearInvocations(store);

    reconciler(new EachObjectChunker(), 5).reconcile(created);

    verify(store, times(1)).delete(any(), any());
    assertThat(sliceStore.get(NAMESPACE, stray)).isEmpty();
    assertThat(sliceStore.listFor(created)).hasSize(1);
  }

  @Test
  void slicesOfSelectedButUncontrolledRevisionsAreKept() {
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.inline("deploy", List.of(new ObjectSetObject(configMap("cm", "a")))))));
    String kept = sliceStore.create(created, List.of(new ObjectSetObject(configMap("old", "x"))), 0)
        .metadata().name();
    ObjectMeta manual = ObjectMeta.named(NAMESPACE, "manual-rollback")
        .withLabels(Map.of(PackageOperatorApi.OBJECT_DEPLOYMENT_LABEL, "test-depl"));
    objectSets.create(new ObjectSet(manual, new ObjectSet.Spec(ObjectSet.LifecycleState.ACTIVE, null,
        List.of(ObjectSetTemplatePhase.sliced("deploy", List.of(kept))), null), ObjectSet.Status.empty()));

    reconciler(new EachObjectChunker(), 5).reconcile(created);

    assertThat(sliceStore.get(NAMESPACE, kept)).isPresent();
    assertThat(objectSets.get(ObjectKey.of(NAMESPACE, "manual-rollback")).metadata().ownerReferences()).isEmpty();
  }

  @Test
  void missingSliceInTheTemplateFailsWithContext() {
    ObjectDeployment created = deployments.create(deployment("test-depl",
        template(ObjectSetTemplatePhase.sliced("deploy", List.of("missing")))));

    assertThatThrownBy(() -> reconciler(new EachObjectChunker(), 5).reconcile(created))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageStartingWith("expanding slices of ObjectDeployment");
  }

  @Test
  void deletingDeploymentIsLeftAlone() {
    ObjectMeta meta = new ObjectMeta("test-depl", NAMESPACE, "uid", "1", 1L, null, null,
        List.of("keep"), null, CLOCK.instant(), CLOCK.instant());
    ObjectDeployment deleting = deployment("test-depl", template()).withMetadata(meta);

    ReconcileResult result = reconciler(new EachObjectChunker(), 5).reconcile(deleting);

    assertThat(result.isDone()).isTrue();
    verify(store, never()).create(any());
    verify(store, never()).list(any(), any());
  }

  private ObjectDeploymentReconciler reconciler(Chunker chunker, int maxCollisionRetries) {
    return new ObjectDeploymentReconciler(deployments, objectSets, sliceStore,
        new SliceGarbageCollector(sliceStore, metrics), chunker, RetryOnConflict.withDefaults(),
        maxCollisionRetries, metrics, CLOCK);
  }

  private void changeTemplate(String value) {
    ObjectDeployment current = deployments.get(DEPLOYMENT);
    ObjectSetTemplateSpec spec = template(ObjectSetTemplatePhase.inline("deploy",
        List.of(new ObjectSetObject(configMap("cm", value)))));
    deployments.update(current.withSpec(current.spec().withTemplate(new ObjectSetTemplate(null, spec))));
  }

  private void markAvailable(ObjectSet set) {
    ObjectSet current = objectSets.get(set.metadata().key());
    Condition available = new Condition(PackageOperatorApi.CONDITION_AVAILABLE, ConditionStatus.TRUE,
        "Available", "ok", current.metadata().generationOrZero(), CLOCK.instant());
    objectSets.updateStatus(current.withStatus(current.status().withConditions(List.of(available))));
  }

  private ObjectSet onlyRevision() {
    List<ObjectSet> revisions = objectSets.list(ListOptions.inNamespace(NAMESPACE));
    assertThat(revisions).hasSize(1);
    return revisions.get(0);
  }

  private ObjectSet revisionOtherThan(ObjectSet known) {
    return objectSets.list(ListOptions.inNamespace(NAMESPACE)).stream()
        .filter(set -> !set.metadata().name().equals(known.metadata().name()))
        .findFirst()
        .orElseThrow();
  }

  private static ArgumentMatcher<ClusterObject> ofKind(GroupVersionKind gvk) {
    return object -> object != null && object.hasGvk() && object.gvk().equals(gvk);
  }
}
