package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Objects;

/**
 * One revision of an {@link ObjectDeployment}. The template is never changed once it is sealed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectSet(@NotNull ObjectMeta metadata,
                        @Valid @NotNull Spec spec,
                        Status status) implements Resource<ObjectSet> {

    public ObjectSet {
        Objects.requireNonNull(metadata, "metadata");
        spec = spec == null ? new Spec(null, null, null, null) : spec;
        status = status == null ? Status.empty() : status;
    }

    @Override
    public ObjectSet withMetadata(ObjectMeta newMetadata) {
        return new ObjectSet(newMetadata, spec, status);
    }

    public ObjectSet withSpec(Spec newSpec) {
        return new ObjectSet(metadata, newSpec, status);
    }

    public ObjectSet withStatus(Status newStatus) {
        return new ObjectSet(metadata, spec, newStatus);
    }

    public enum LifecycleState {
        @JsonProperty("Active")
        ACTIVE,
        @JsonProperty("Paused")
        PAUSED,
        @JsonProperty("Archived")
        ARCHIVED
    }

    public enum Phase {
        @JsonProperty("Pending")
        PENDING,
        @JsonProperty("Progressing")
        PROGRESSING,
        @JsonProperty("Available")
        AVAILABLE,
        @JsonProperty("Archived")
        ARCHIVED,
        @JsonProperty("Deleting")
        DELETING
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(LifecycleState lifecycleState,
                       List<String> previous,
                       @Valid List<ObjectSetTemplatePhase> phases,
                       @Valid List<ObjectSetProbe> availabilityProbes) {
        public Spec {
            lifecycleState = lifecycleState == null ? LifecycleState.ACTIVE : lifecycleState;
            previous = previous == null || previous.isEmpty() ? List.of() : List.copyOf(previous);
            phases = phases == null || phases.isEmpty() ? List.of() : List.copyOf(phases);
            availabilityProbes = availabilityProbes == null || availabilityProbes.isEmpty()
                ? List.of()
                : List.copyOf(availabilityProbes);
        }

        public static Spec of(LifecycleState state, List<String> previous, ObjectSetTemplateSpec template) {
            return new Spec(state, previous, template.phases(), template.availabilityProbes());
        }

        @JsonIgnore
        public ObjectSetTemplateSpec template() {
            return new ObjectSetTemplateSpec(phases, availabilityProbes);
        }

        public Spec withLifecycleState(LifecycleState state) {
            return new Spec(state, previous, phases, availabilityProbes);
        }

        public Spec withTemplate(ObjectSetTemplateSpec template) {
            return new Spec(lifecycleState, previous, template.phases(), template.availabilityProbes());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(Phase phase,
                         String lastAvailablePhase,
                         Long revision,
                         List<Condition> conditions,
                         List<ControlledObjectReference> controllerOf) {
        public Status {
            conditions = conditions == null || conditions.isEmpty() ? List.of() : List.copyOf(conditions);
            controllerOf = controllerOf == null || controllerOf.isEmpty() ? List.of() : List.copyOf(controllerOf);
        }

        public static Status empty() {
            return new Status(null, null, null, null, null);
        }

        public Status withPhase(Phase newPhase) {
            return new Status(newPhase, lastAvailablePhase, revision, conditions, controllerOf);
        }

        public Status withLastAvailablePhase(String phaseName) {
            return new Status(phase, phaseName, revision, conditions, controllerOf);
        }

        public Status withRevision(Long newRevision) {
            return new Status(phase, lastAvailablePhase, newRevision, conditions, controllerOf);
        }

        public Status withConditions(List<Condition> newConditions) {
            return new Status(phase, lastAvailablePhase, revision, newConditions, controllerOf);
        }

        public Status withControllerOf(List<ControlledObjectReference> references) {
            return new Status(phase, lastAvailablePhase, revision, conditions, references);
        }
    }
}
