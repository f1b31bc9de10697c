package io.packageoperator.manager.objectsets.probing;

import com.fasterxml.jackson.databind.JsonNode;
import io.packageoperator.api.ClusterObject;
import java.util.Objects;

/**
 * Condition {@code type} must report {@code status}. A condition that carries an
 * {@code observedGeneration} only counts when it matches the object's current generation.
 */
public final class ConditionProbe implements Prober {

  private final String type;
  private final String status;

  public ConditionProbe(String type, String status) {
    this.type = Objects.requireNonNull(type, "type");
    this.status = Objects.requireNonNull(status, "status");
  }

  @Override
  public ProbeResult probe(ClusterObject object) {
    JsonNode conditions = object.status().path("conditions");
    if (!conditions.isArray()) {
      return ProbeResult.failed("missing .status.conditions");
    }
    for (JsonNode condition : conditions) {
      if (!type.equals(condition.path("type").asText())) {
        continue;
      }
      JsonNode observed = condition.path("observedGeneration");
      if (observed.isNumber() && observed.asLong() != object.generation()) {
        return ProbeResult.failed("condition " + quote(type) + " is outdated");
      }
      String actual = condition.path("status").asText();
      if (!status.equals(actual)) {
        return ProbeResult.failed("condition " + quote(type) + " == " + quote(actual)
            + ", want " + quote(status));
      }
      return ProbeResult.ok();
    }
    return ProbeResult.failed("missing condition " + quote(type));
  }

  static String quote(String value) {
    return "\"" + value + "\"";
  }
}
