package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

/**
 * Declarative availability check. Exactly one of the members is expected to be set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProbeSpec(Condition condition,
                        FieldsEqual fieldsEqual,
                        FieldValue fieldValue,
                        FieldExists fieldExists,
                        CurrentGeneration currentGeneration) {

    public static ProbeSpec condition(String type, String status) {
        return new ProbeSpec(new Condition(type, status), null, null, null, null);
    }

    public static ProbeSpec fieldsEqual(String fieldA, String fieldB) {
        return new ProbeSpec(null, new FieldsEqual(fieldA, fieldB), null, null, null);
    }

    public static ProbeSpec fieldValue(String field, String value) {
        return new ProbeSpec(null, null, new FieldValue(field, value), null, null);
    }

    public static ProbeSpec fieldExists(String field) {
        return new ProbeSpec(null, null, null, new FieldExists(field), null);
    }

    public static ProbeSpec currentGenerationProbe() {
        return new ProbeSpec(null, null, null, null, new CurrentGeneration());
    }

    /** Condition {@code type} must report {@code status} for the object's current generation. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Condition(@NotBlank String type, @NotBlank String status) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FieldsEqual(@NotBlank String fieldA, @NotBlank String fieldB) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FieldValue(@NotBlank String field, String value) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FieldExists(@NotBlank String field) {
    }

    /** {@code .status.observedGeneration} must equal {@code .metadata.generation}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CurrentGeneration() {
    }
}
