package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;

/**
 * Status condition. Types containing a {@code /} are mapped from other objects.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Condition(String type,
                        ConditionStatus status,
                        String reason,
                        String message,
                        Long observedGeneration,
                        Instant lastTransitionTime) {
    public Condition {
        Objects.requireNonNull(type, "type");
        status = status == null ? ConditionStatus.UNKNOWN : status;
    }

    public static Condition of(String type, ConditionStatus status, String reason, String message,
                               long observedGeneration) {
        return new Condition(type, status, reason, message, observedGeneration, null);
    }

    @JsonIgnore
    public boolean isTrue() {
        return status == ConditionStatus.TRUE;
    }

    @JsonIgnore
    public boolean isMapped() {
        return type.contains("/");
    }

    public Condition withLastTransitionTime(Instant time) {
        return new Condition(type, status, reason, message, observedGeneration, time);
    }

    public Condition withType(String newType) {
        return new Condition(newType, status, reason, message, observedGeneration, lastTransitionTime);
    }

    public Condition withObservedGeneration(Long generation) {
        return new Condition(type, status, reason, message, generation, lastTransitionTime);
    }
}
