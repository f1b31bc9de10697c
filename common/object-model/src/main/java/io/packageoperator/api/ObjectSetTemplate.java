package io.packageoperator.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectSetTemplate(Metadata metadata, @Valid ObjectSetTemplateSpec spec) {
    public ObjectSetTemplate {
        metadata = metadata == null ? new Metadata(null, null) : metadata;
        spec = spec == null ? ObjectSetTemplateSpec.empty() : spec;
    }

    public ObjectSetTemplate withSpec(ObjectSetTemplateSpec newSpec) {
        return new ObjectSetTemplate(metadata, newSpec);
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Metadata(Map<String, String> labels, Map<String, String> annotations) {
        public Metadata {
            labels = labels == null || labels.isEmpty() ? Map.of() : Map.copyOf(labels);
            annotations = annotations == null || annotations.isEmpty() ? Map.of() : Map.copyOf(annotations);
        }
    }
}
