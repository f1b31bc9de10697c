package io.packageoperator.manager.objectsets.probing;

import io.packageoperator.api.ClusterObject;
import java.util.Objects;

public final class FieldExistsProbe implements Prober {

  private final String field;

  public FieldExistsProbe(String field) {
    this.field = Objects.requireNonNull(field, "field");
  }

  @Override
  public ProbeResult probe(ClusterObject object) {
    if (object.field(field).isMissingNode()) {
      return ProbeResult.failed(FieldsEqualProbe.quoteField(field) + " missing");
    }
    return ProbeResult.ok();
  }
}
