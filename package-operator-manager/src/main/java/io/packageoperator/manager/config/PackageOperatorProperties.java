package io.packageoperator.manager.config;

import io.packageoperator.manager.slices.ChunkingStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "package-operator")
public class PackageOperatorProperties {

    private final String namespace;
    private final Slicing slicing;
    private final Store store;
    private final Controllers controllers;

    public PackageOperatorProperties(String namespace,
                                     @Valid Slicing slicing,
                                     @Valid Store store,
                                     @Valid Controllers controllers) {
        this.namespace = namespace == null ? "" : namespace.trim();
        this.slicing = slicing != null ? slicing : new Slicing(null, null, null);
        this.store = store != null ? store : new Store(null);
        this.controllers = controllers != null ? controllers : new Controllers(null, null, null, null, null);
    }

    /**
     * Namespace the controllers watch. Empty means all namespaces.
     */
    public String getNamespace() {
        return namespace;
    }

    public Slicing getSlicing() {
        return slicing;
    }

    public Store getStore() {
        return store;
    }

    public Controllers getControllers() {
        return controllers;
    }

    @Validated
    public static final class Slicing {
        private final ChunkingStrategy strategy;
        private final int thresholdBytes;
        private final int maxCollisionRetries;

        public Slicing(ChunkingStrategy strategy,
                       @Positive Integer thresholdBytes,
                       @PositiveOrZero Integer maxCollisionRetries) {
            this.strategy = strategy != null ? strategy : ChunkingStrategy.SIZE;
            this.thresholdBytes = requirePositive(thresholdBytes, 262_144, "thresholdBytes");
            this.maxCollisionRetries = maxCollisionRetries != null ? maxCollisionRetries : 5;
            if (this.maxCollisionRetries < 0) {
                throw new IllegalArgumentException("maxCollisionRetries must not be negative");
            }
        }

        public ChunkingStrategy strategy() {
            return strategy;
        }

        public int thresholdBytes() {
            return thresholdBytes;
        }

        public int maxCollisionRetries() {
            return maxCollisionRetries;
        }
    }

    @Validated
    public static final class Store {
        private final int maxObjectBytes;

        public Store(@Positive Integer maxObjectBytes) {
            this.maxObjectBytes = requirePositive(maxObjectBytes, 1_572_864, "maxObjectBytes");
        }

        public int maxObjectBytes() {
            return maxObjectBytes;
        }
    }

    @Validated
    public static final class Controllers {
        private final int workers;
        private final int conflictRetries;
        private final Duration reconcileTimeout;
        private final Duration maxBackoff;
        private final Duration teardownPollInterval;

        public Controllers(@Positive Integer workers,
                           @Positive Integer conflictRetries,
                           Duration reconcileTimeout,
                           Duration maxBackoff,
                           Duration teardownPollInterval) {
            this.workers = requirePositive(workers, 4, "workers");
            this.conflictRetries = requirePositive(conflictRetries, 5, "conflictRetries");
            this.reconcileTimeout = requirePositive(reconcileTimeout, Duration.ofSeconds(30), "reconcileTimeout");
            this.maxBackoff = requirePositive(maxBackoff, Duration.ofSeconds(60), "maxBackoff");
            this.teardownPollInterval =
                requirePositive(teardownPollInterval, Duration.ofSeconds(2), "teardownPollInterval");
        }

        public int workers() {
            return workers;
        }

        public int conflictRetries() {
            return conflictRetries;
        }

        public Duration reconcileTimeout() {
            return reconcileTimeout;
        }

        public Duration maxBackoff() {
            return maxBackoff;
        }

        public Duration teardownPollInterval() {
            return teardownPollInterval;
        }
    }

    private static int requirePositive(Integer value, int fallback, String field) {
        int resolved = value != null ? value : fallback;
        if (resolved <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return resolved;
    }

    private static Duration requirePositive(Duration value, Duration fallback, String field) {
        Duration resolved = Objects.requireNonNullElse(value, fallback);
        if (resolved.isZero() || resolved.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return resolved;
    }
}
