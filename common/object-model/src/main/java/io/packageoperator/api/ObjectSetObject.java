package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectSetObject(@NotNull ClusterObject object,
                              @Valid List<ConditionMapping> conditionMappings) {
    public ObjectSetObject {
        Objects.requireNonNull(object, "object");
        conditionMappings = conditionMappings == null || conditionMappings.isEmpty()
            ? List.of()
            : List.copyOf(conditionMappings);
    }

    public ObjectSetObject(ClusterObject object) {
        this(object, null);
    }
}
