package io.packageoperator.manager.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.packageoperator.api.ObjectDeployment;
import io.packageoperator.api.ObjectSet;
import io.packageoperator.api.ObjectSlice;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.dynamiccache.DynamicCache;
import io.packageoperator.manager.objectdeployments.ObjectDeploymentReconciler;
import io.packageoperator.manager.objectsets.ObjectSetReconciler;
import io.packageoperator.manager.slices.Chunker;
import io.packageoperator.manager.slices.SliceGarbageCollector;
import io.packageoperator.manager.slices.SliceStore;
import io.packageoperator.reconciler.ReconcileMetrics;
import io.packageoperator.store.InMemoryObjectStore;
import io.packageoperator.store.ObjectStoreClient;
import io.packageoperator.store.ResourceCodec;
import io.packageoperator.store.RetryOnConflict;
import io.packageoperator.store.TypedClient;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ManagerConfiguration {
  private final PackageOperatorProperties properties;

  public ManagerConfiguration(PackageOperatorProperties properties) {
    this.properties = properties;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public InMemoryObjectStore objectStore(Clock clock) {
    return new InMemoryObjectStore(properties.getStore().maxObjectBytes(), clock);
  }

  @Bean
  public ResourceCodec resourceCodec() {
    return new ResourceCodec();
  }

  @Bean
  public TypedClient<ObjectDeployment> objectDeploymentClient(ObjectStoreClient store, ResourceCodec codec) {
    return new TypedClient<>(store, PackageOperatorApi.OBJECT_DEPLOYMENT, codec);
  }

  @Bean
  public TypedClient<ObjectSet> objectSetClient(ObjectStoreClient store, ResourceCodec codec) {
    return new TypedClient<>(store, PackageOperatorApi.OBJECT_SET, codec);
  }

  @Bean
  public TypedClient<ObjectSlice> objectSliceClient(ObjectStoreClient store, ResourceCodec codec) {
    return new TypedClient<>(store, PackageOperatorApi.OBJECT_SLICE, codec);
  }

  @Bean
  public ReconcileMetrics reconcileMetrics(MeterRegistry registry) {
    return new ReconcileMetrics(registry);
  }

  @Bean
  public RetryOnConflict retryOnConflict() {
    return new RetryOnConflict(properties.getControllers().conflictRetries());
  }

  @Bean
  public Chunker chunker() {
    PackageOperatorProperties.Slicing slicing = properties.getSlicing();
    return slicing.strategy().chunker(slicing.thresholdBytes());
  }

  @Bean
  public SliceStore sliceStore(TypedClient<ObjectSlice> slices) {
    return new SliceStore(slices);
  }

  @Bean
  public SliceGarbageCollector sliceGarbageCollector(SliceStore sliceStore, ReconcileMetrics metrics) {
    return new SliceGarbageCollector(sliceStore, metrics);
  }

  @Bean
  public CacheEventRouter cacheEventRouter() {
    return new CacheEventRouter();
  }

  @Bean
  public DynamicCache dynamicCache(ObjectStoreClient store, CacheEventRouter router) {
    return new DynamicCache(store, router);
  }

  @Bean
  public ObjectDeploymentReconciler objectDeploymentReconciler(TypedClient<ObjectDeployment> deployments,
                                                               TypedClient<ObjectSet> objectSets,
                                                               SliceStore sliceStore,
                                                               SliceGarbageCollector garbageCollector,
                                                               Chunker chunker,
                                                               RetryOnConflict retry,
                                                               ReconcileMetrics metrics,
                                                               Clock clock) {
    return new ObjectDeploymentReconciler(deployments, objectSets, sliceStore, garbageCollector, chunker, retry,
        properties.getSlicing().maxCollisionRetries(), metrics, clock);
  }

  @Bean
  public ObjectSetReconciler objectSetReconciler(ObjectStoreClient store,
                                                 TypedClient<ObjectSet> objectSets,
                                                 DynamicCache cache,
                                                 SliceStore sliceStore,
                                                 RetryOnConflict retry,
                                                 Clock clock) {
    return new ObjectSetReconciler(store, objectSets, cache, sliceStore, retry,
        properties.getControllers().teardownPollInterval(), clock);
  }

  @Bean
  public ControllerLifecycle controllerLifecycle(ObjectStoreClient store,
                                                 TypedClient<ObjectDeployment> deployments,
                                                 TypedClient<ObjectSet> objectSets,
                                                 ObjectDeploymentReconciler deploymentReconciler,
                                                 ObjectSetReconciler objectSetReconciler,
                                                 DynamicCache cache,
                                                 CacheEventRouter router,
                                                 ReconcileMetrics metrics) {
    return new ControllerLifecycle(properties, store, deployments, objectSets, deploymentReconciler,
        objectSetReconciler, cache, router, metrics);
  }
}
