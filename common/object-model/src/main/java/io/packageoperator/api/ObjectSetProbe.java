package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Binds a list of probes to the objects matched by {@code selector}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectSetProbe(@Valid @NotNull Selector selector, @Valid List<ProbeSpec> probes) {
    public ObjectSetProbe {
        probes = probes == null || probes.isEmpty() ? List.of() : List.copyOf(probes);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Selector(GroupKind kind, LabelSelector selector) {
    }
}
