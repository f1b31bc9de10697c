package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Copies a condition of a controlled object into the owning revision under a prefixed type.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConditionMapping(@NotBlank String sourceType,
                               @NotBlank @Pattern(regexp = ".+/.+") String destinationType) {
}
