package io.packageoperator.reconciler;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of a {@link ControllerLoop}.
 */
public record ControllerSettings(int workers,
                                 Duration reconcileTimeout,
                                 Duration baseBackoff,
                                 Duration maxBackoff) {

  public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofMillis(100);

  public ControllerSettings {
    if (workers < 1) {
      throw new IllegalArgumentException("workers must be positive");
    }
    Objects.requireNonNull(reconcileTimeout, "reconcileTimeout");
    baseBackoff = baseBackoff == null ? DEFAULT_BASE_BACKOFF : baseBackoff;
    Objects.requireNonNull(maxBackoff, "maxBackoff");
  }

  public Duration backoff(int failures) {
    if (failures <= 0) {
      return Duration.ZERO;
    }
    long base = baseBackoff.toMillis();
    long cap = maxBackoff.toMillis();
    int shift = Math.min(failures - 1, 30);
    long delay = base << shift;
    if (delay <= 0 || delay > cap) {
      delay = cap;
    }
    return Duration.ofMillis(delay);
  }
}
