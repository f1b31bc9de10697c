package io.packageoperator.reconciler;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupKind;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.ObjectStoreClient;
import io.packageoperator.store.OwnerReferences;
import io.packageoperator.store.Subscription;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed work queue feeding a {@link Reconciler}.
 * <p>
 * Keys are de-duplicated while queued and a key is never processed by two workers at once; a key
 * enqueued while it is being processed runs again afterwards. Each pass is bounded by the reconcile
 * timeout, enforced by interrupting the worker. Failed passes are retried with exponential backoff.
 */
public final class ControllerLoop<T> implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ControllerLoop.class);

  private final String name;
  private final ObjectLoader<T> loader;
  private final Reconciler<T> reconciler;
  private final ControllerSettings settings;
  private final ReconcileMetrics metrics;
  private final ExecutorService workers;
  private final ScheduledExecutorService scheduler;

  private final Set<ObjectKey> queued = new HashSet<>();
  private final Set<ObjectKey> processing = new HashSet<>();
  private final Set<ObjectKey> dirty = new HashSet<>();
  private final Map<ObjectKey, Integer> failures = new HashMap<>();
  private final Map<ObjectKey, ScheduledFuture<?>> delayed = new HashMap<>();
  private final List<Subscription> subscriptions = new ArrayList<>();

  private boolean running;

  public ControllerLoop(String name,
                        ObjectLoader<T> loader,
                        Reconciler<T> reconciler,
                        ControllerSettings settings,
                        ReconcileMetrics metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.workers = Executors.newFixedThreadPool(settings.workers(), threadFactory(name + "-worker"));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory(name + "-scheduler"));
  }

  public String name() {
    return name;
  }

  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    List<ObjectKey> pending = new ArrayList<>(queued);
    queued.clear();
    pending.forEach(this::enqueue);
    log.info("Controller [{}] started with {} workers", name, settings.workers());
  }

  @Override
  public void close() {
    List<Subscription> closing;
    synchronized (this) {
      running = false;
      closing = new ArrayList<>(subscriptions);
      subscriptions.clear();
      delayed.values().forEach(f -> f.cancel(false));
      delayed.clear();
    }
    closing.forEach(Subscription::close);
    scheduler.shutdownNow();
    workers.shutdownNow();
    log.info("Controller [{}] stopped", name);
  }

  /**
   * Schedules a pass for {@code key}. Keys queued before {@link #start()} are kept until then.
   */
  public synchronized void enqueue(ObjectKey key) {
    Objects.requireNonNull(key, "key");
    ScheduledFuture<?> pendingDelay = delayed.remove(key);
    if (pendingDelay != null) {
      pendingDelay.cancel(false);
    }
    if (processing.contains(key)) {
      dirty.add(key);
      return;
    }
    if (!queued.add(key) || !running) {
      return;
    }
    workers.execute(() -> process(key));
  }

  public synchronized void enqueueAfter(ObjectKey key, Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      enqueue(key);
      return;
    }
    if (!running) {
      return;
    }
    ScheduledFuture<?> existing = delayed.get(key);
    if (existing != null) {
      if (existing.getDelay(TimeUnit.MILLISECONDS) <= delay.toMillis()) {
        return;
      }
      existing.cancel(false);
    }
    delayed.put(key, scheduler.schedule(() -> {
      synchronized (this) {
        delayed.remove(key);
      }
      enqueue(key);
    }, delay.toMillis(), TimeUnit.MILLISECONDS));
  }

  /**
   * Enqueues the key of every object of {@code gvk} that changes.
   */
  public void watchPrimary(ObjectStoreClient store, GroupVersionKind gvk, ListOptions options) {
    register(store.watch(gvk, options, event -> enqueue(event.object().key())));
  }

  /**
   * Enqueues the controller of every object of {@code ownedGvk} that changes, provided the controller
   * is of {@code ownerKind}. Owners live in the namespace of the objects they control.
   */
  public void watchOwned(ObjectStoreClient store, GroupVersionKind ownedGvk, ListOptions options,
                         GroupKind ownerKind) {
    register(store.watch(ownedGvk, options, event -> enqueueController(event.object(), ownerKind)));
  }

  public void enqueueController(ClusterObject object, GroupKind ownerKind) {
    OwnerReferences.controllerOf(object)
        .filter(ref -> ref.groupKind().equals(ownerKind))
        .ifPresent(ref -> enqueue(ObjectKey.of(object.namespace(), ref.name())));
  }

  public synchronized boolean isIdle() {
    return queued.isEmpty() && processing.isEmpty() && dirty.isEmpty();
  }

  synchronized int failureCount(ObjectKey key) {
    return failures.getOrDefault(key, 0);
  }

  private synchronized void register(Subscription subscription) {
    subscriptions.add(subscription);
  }

  private void process(ObjectKey key) {
    synchronized (this) {
      queued.remove(key);
      if (!running) {
        return;
      }
      processing.add(key);
    }
    Deadline deadline = new Deadline(Thread.currentThread());
    Thread.interrupted();
    ScheduledFuture<?> timer = scheduler.schedule(deadline::expire,
        settings.reconcileTimeout().toMillis(), TimeUnit.MILLISECONDS);
    Timer.Sample sample = metrics.startReconcile();
    ReconcileResult result = null;
    RuntimeException failure = null;
    try {
      Optional<T> object = loader.load(key);
      result = object.isPresent() ? reconciler.reconcile(object.get()) : ReconcileResult.done();
      if (result == null) {
        result = ReconcileResult.done();
      }
    } catch (RuntimeException e) {
      failure = e;
    } finally {
      timer.cancel(false);
      deadline.disarm();
      Thread.interrupted();
      metrics.stopReconcile(sample, name, failure == null);
    }
    finish(key, result, failure);
  }

  private void finish(ObjectKey key, ReconcileResult result, RuntimeException failure) {
    Duration retryIn = null;
    synchronized (this) {
      processing.remove(key);
      if (failure != null) {
        int count = failures.merge(key, 1, Integer::sum);
        retryIn = settings.backoff(count);
        log.error("Controller [{}] failed to reconcile {} (attempt {}), retrying in {}",
            name, key, count, retryIn, failure);
      } else {
        failures.remove(key);
        if (result.retry()) {
          retryIn = result.requeueAfter() == null ? settings.baseBackoff() : result.requeueAfter();
        }
      }
      if (dirty.remove(key)) {
        enqueue(key);
        return;
      }
    }
    if (retryIn != null) {
      enqueueAfter(key, retryIn);
    }
  }

  /**
   * Interrupts the worker of one pass. Once disarmed it never interrupts, so a late timer cannot
   * reach the worker's next pass.
   */
  private static final class Deadline {

    private final Thread worker;
    private boolean armed = true;

    Deadline(Thread worker) {
      this.worker = worker;
    }

    synchronized void expire() {
      if (armed) {
        worker.interrupt();
      }
    }

    synchronized void disarm() {
      armed = false;
    }
  }

  private static ThreadFactory threadFactory(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return new ThreadFactory() {
      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
