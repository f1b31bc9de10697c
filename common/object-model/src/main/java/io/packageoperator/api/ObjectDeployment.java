package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Objects;

/**
 * Mutable desired state: a template that is rolled out as a series of {@link ObjectSet} revisions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectDeployment(@NotNull ObjectMeta metadata,
                               @Valid @NotNull Spec spec,
                               Status status) implements Resource<ObjectDeployment> {

    public static final int DEFAULT_REVISION_HISTORY_LIMIT = 10;

    public ObjectDeployment {
        Objects.requireNonNull(metadata, "metadata");
        spec = spec == null ? new Spec(null, null, null) : spec;
        status = status == null ? Status.empty() : status;
    }

    @Override
    public ObjectDeployment withMetadata(ObjectMeta newMetadata) {
        return new ObjectDeployment(newMetadata, spec, status);
    }

    public ObjectDeployment withSpec(Spec newSpec) {
        return new ObjectDeployment(metadata, newSpec, status);
    }

    public ObjectDeployment withStatus(Status newStatus) {
        return new ObjectDeployment(metadata, spec, newStatus);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(@Min(0) Integer revisionHistoryLimit,
                       @NotNull LabelSelector selector,
                       @Valid ObjectSetTemplate template) {
        public Spec {
            selector = selector == null ? LabelSelector.everything() : selector;
            template = template == null ? new ObjectSetTemplate(null, null) : template;
        }

        public int revisionHistoryLimitOrDefault() {
            return revisionHistoryLimit == null ? DEFAULT_REVISION_HISTORY_LIMIT : revisionHistoryLimit;
        }

        public Spec withTemplate(ObjectSetTemplate newTemplate) {
            return new Spec(revisionHistoryLimit, selector, newTemplate);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(List<Condition> conditions,
                         Integer collisionCount,
                         Integer sliceCollisionCount,
                         String templateHash,
                         List<ControlledObjectReference> controllerOf) {
        public Status {
            conditions = conditions == null || conditions.isEmpty() ? List.of() : List.copyOf(conditions);
            controllerOf = controllerOf == null || controllerOf.isEmpty() ? List.of() : List.copyOf(controllerOf);
        }

        public static Status empty() {
            return new Status(null, null, null, null, null);
        }

        public int collisionCountOrZero() {
            return collisionCount == null ? 0 : collisionCount;
        }

        public int sliceCollisionCountOrZero() {
            return sliceCollisionCount == null ? 0 : sliceCollisionCount;
        }

        public Status withConditions(List<Condition> newConditions) {
            return new Status(newConditions, collisionCount, sliceCollisionCount, templateHash, controllerOf);
        }

        public Status withCollisionCount(int count) {
            return new Status(conditions, count, sliceCollisionCount, templateHash, controllerOf);
        }

        public Status withSliceCollisionCount(int count) {
            return new Status(conditions, collisionCount, count, templateHash, controllerOf);
        }

        public Status withTemplateHash(String hash) {
            return new Status(conditions, collisionCount, sliceCollisionCount, hash, controllerOf);
        }

        public Status withControllerOf(List<ControlledObjectReference> references) {
            return new Status(conditions, collisionCount, sliceCollisionCount, templateHash, references);
        }
    }
}
