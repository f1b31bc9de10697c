package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectSetTemplateSpec(@Valid List<ObjectSetTemplatePhase> phases,
                                    @Valid List<ObjectSetProbe> availabilityProbes) {
    public ObjectSetTemplateSpec {
        phases = phases == null || phases.isEmpty() ? List.of() : List.copyOf(phases);
        availabilityProbes = availabilityProbes == null || availabilityProbes.isEmpty()
            ? List.of()
            : List.copyOf(availabilityProbes);
        Set<String> names = new HashSet<>();
        for (ObjectSetTemplatePhase phase : phases) {
            if (phase.name() != null && !names.add(phase.name())) {
                throw new IllegalArgumentException("duplicate phase name " + phase.name());
            }
        }
    }

    public static ObjectSetTemplateSpec empty() {
        return new ObjectSetTemplateSpec(null, null);
    }

    public ObjectSetTemplateSpec withPhases(List<ObjectSetTemplatePhase> newPhases) {
        return new ObjectSetTemplateSpec(newPhases, availabilityProbes);
    }
}
