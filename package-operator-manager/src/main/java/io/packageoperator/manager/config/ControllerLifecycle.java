package io.packageoperator.manager.config;

import io.packageoperator.api.ObjectDeployment;
import io.packageoperator.api.ObjectSet;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.dynamiccache.DynamicCache;
import io.packageoperator.manager.objectdeployments.ObjectDeploymentReconciler;
import io.packageoperator.manager.objectsets.ObjectSetReconciler;
import io.packageoperator.reconciler.ControllerLoop;
import io.packageoperator.reconciler.ControllerSettings;
import io.packageoperator.reconciler.ReconcileMetrics;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.ObjectStoreClient;
import io.packageoperator.store.TypedClient;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the ObjectDeployment and ObjectSet controllers once the context is ready and stops them,
 * together with the cache informers, on shutdown.
 */
public class ControllerLifecycle implements SmartLifecycle {

  static final String OBJECT_DEPLOYMENT_CONTROLLER = "objectdeployment";
  static final String OBJECT_SET_CONTROLLER = "objectset";

  private static final Logger log = LoggerFactory.getLogger(ControllerLifecycle.class);

  private final PackageOperatorProperties properties;
  private final ObjectStoreClient store;
  private final TypedClient<ObjectDeployment> deployments;
  private final TypedClient<ObjectSet> objectSets;
  private final ObjectDeploymentReconciler deploymentReconciler;
  private final ObjectSetReconciler objectSetReconciler;
  private final DynamicCache cache;
  private final CacheEventRouter router;
  private final ReconcileMetrics metrics;

  private ControllerLoop<ObjectDeployment> deploymentLoop;
  private ControllerLoop<ObjectSet> objectSetLoop;
  private volatile boolean running;

  public ControllerLifecycle(PackageOperatorProperties properties,
                             ObjectStoreClient store,
                             TypedClient<ObjectDeployment> deployments,
                             TypedClient<ObjectSet> objectSets,
                             ObjectDeploymentReconciler deploymentReconciler,
                             ObjectSetReconciler objectSetReconciler,
                             DynamicCache cache,
                             CacheEventRouter router,
                             ReconcileMetrics metrics) {
    this.properties = Objects.requireNonNull(properties, "properties");
    this.store = Objects.requireNonNull(store, "store");
    this.deployments = Objects.requireNonNull(deployments, "deployments");
    this.objectSets = Objects.requireNonNull(objectSets, "objectSets");
    this.deploymentReconciler = Objects.requireNonNull(deploymentReconciler, "deploymentReconciler");
    this.objectSetReconciler = Objects.requireNonNull(objectSetReconciler, "objectSetReconciler");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.router = Objects.requireNonNull(router, "router");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    PackageOperatorProperties.Controllers controllers = properties.getControllers();
    ControllerSettings settings = new ControllerSettings(controllers.workers(), controllers.reconcileTimeout(),
        ControllerSettings.DEFAULT_BASE_BACKOFF, controllers.maxBackoff());
    ListOptions watched = ListOptions.inNamespace(properties.getNamespace());

    objectSetLoop = new ControllerLoop<>(OBJECT_SET_CONTROLLER, objectSets::find, objectSetReconciler,
        settings, metrics);
    router.bind(objectSetLoop);
    objectSetLoop.watchPrimary(store, PackageOperatorApi.OBJECT_SET.gvk(), watched);

    deploymentLoop = new ControllerLoop<>(OBJECT_DEPLOYMENT_CONTROLLER, deployments::find, deploymentReconciler,
        settings, metrics);
    deploymentLoop.watchPrimary(store, PackageOperatorApi.OBJECT_DEPLOYMENT.gvk(), watched);
    deploymentLoop.watchOwned(store, PackageOperatorApi.OBJECT_SET.gvk(), watched,
        PackageOperatorApi.OBJECT_DEPLOYMENT.gvk().groupKind());

    objectSetLoop.start();
    deploymentLoop.start();
    running = true;
    log.info("Package operator controllers started (namespace={}, workers={})",
        properties.getNamespace().isEmpty() ? "<all>" : properties.getNamespace(), controllers.workers());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    deploymentLoop.close();
    objectSetLoop.close();
    cache.close();
    running = false;
    log.info("Package operator controllers stopped");
  }

  @Override
  public void stop(Runnable callback) {
    try {
      stop();
    } finally {
      callback.run();
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return true;
  }

  @Override
  public int getPhase() {
    return 0;
  }

  ControllerLoop<ObjectDeployment> deploymentLoop() {
    return deploymentLoop;
  }

  ControllerLoop<ObjectSet> objectSetLoop() {
    return objectSetLoop;
  }
}
