package io.packageoperator.manager.objectsets.probing;

import com.fasterxml.jackson.databind.JsonNode;
import io.packageoperator.api.ClusterObject;
import java.util.Objects;

public final class FieldsEqualProbe implements Prober {

  private final String fieldA;
  private final String fieldB;

  public FieldsEqualProbe(String fieldA, String fieldB) {
    this.fieldA = Objects.requireNonNull(fieldA, "fieldA");
    this.fieldB = Objects.requireNonNull(fieldB, "fieldB");
  }

  @Override
  public ProbeResult probe(ClusterObject object) {
    JsonNode a = object.field(fieldA);
    if (a.isMissingNode()) {
      return ProbeResult.failed(quoteField(fieldA) + " missing");
    }
    JsonNode b = object.field(fieldB);
    if (b.isMissingNode()) {
      return ProbeResult.failed(quoteField(fieldB) + " missing");
    }
    if (!a.equals(b)) {
      return ProbeResult.failed(quoteField(fieldA) + " != " + quoteField(fieldB)
          + " (" + a + " != " + b + ")");
    }
    return ProbeResult.ok();
  }

  static String quoteField(String field) {
    return "\"" + (field.startsWith(".") ? field : "." + field) + "\"";
  }
}
