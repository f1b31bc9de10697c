package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Named, ordered group of objects. Content is held inline in {@code objects}, out of line in the
 * referenced {@code slices}, or both; expansion yields inline objects first, then slices in order.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectSetTemplatePhase(@NotBlank String name,
                                     @Valid List<ObjectSetObject> objects,
                                     List<String> slices) {
    public ObjectSetTemplatePhase {
        objects = objects == null || objects.isEmpty() ? List.of() : List.copyOf(objects);
        slices = slices == null || slices.isEmpty() ? List.of() : List.copyOf(slices);
    }

    public static ObjectSetTemplatePhase inline(String name, List<ObjectSetObject> objects) {
        return new ObjectSetTemplatePhase(name, objects, null);
    }

    public static ObjectSetTemplatePhase sliced(String name, List<String> slices) {
        return new ObjectSetTemplatePhase(name, null, slices);
    }

    public boolean hasSlices() {
        return !slices.isEmpty();
    }
}
