package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Objects;

/**
 * Out-of-line, content addressed storage for part of a phase.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectSlice(@NotNull ObjectMeta metadata,
                          @Valid List<ObjectSetObject> objects) implements Resource<ObjectSlice> {

    public ObjectSlice {
        Objects.requireNonNull(metadata, "metadata");
        objects = objects == null || objects.isEmpty() ? List.of() : List.copyOf(objects);
    }

    public static ObjectSlice of(List<ObjectSetObject> objects) {
        return new ObjectSlice(ObjectMeta.named(null, null), objects);
    }

    @Override
    public ObjectSlice withMetadata(ObjectMeta newMetadata) {
        return new ObjectSlice(newMetadata, objects);
    }
}
