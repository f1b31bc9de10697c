package io.packageoperator.manager.objectsets.probing;

import com.fasterxml.jackson.databind.JsonNode;
import io.packageoperator.api.ClusterObject;
import java.util.Objects;

/**
 * The field must hold {@code value}. Scalars are compared by their text form, so {@code "3"}
 * matches the number {@code 3}.
 */
public final class FieldValueProbe implements Prober {

  private final String field;
  private final String value;

  public FieldValueProbe(String field, String value) {
    this.field = Objects.requireNonNull(field, "field");
    this.value = value == null ? "" : value;
  }

  @Override
  public ProbeResult probe(ClusterObject object) {
    JsonNode actual = object.field(field);
    if (actual.isMissingNode()) {
      return ProbeResult.failed(FieldsEqualProbe.quoteField(field) + " missing");
    }
    String text = actual.isValueNode() ? actual.asText() : actual.toString();
    if (!value.equals(text)) {
      return ProbeResult.failed(FieldsEqualProbe.quoteField(field) + " == " + ConditionProbe.quote(text)
          + ", want " + ConditionProbe.quote(value));
    }
    return ProbeResult.ok();
  }
}
