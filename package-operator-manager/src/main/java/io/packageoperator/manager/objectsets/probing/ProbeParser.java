package io.packageoperator.manager.objectsets.probing;

import io.packageoperator.api.ObjectSetProbe;
import io.packageoperator.api.ProbeSpec;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns {@link ObjectSetProbe} specs into one {@link Prober}. Each spec's probes apply only to the
 * objects its selector picks.
 */
public final class ProbeParser {

  private ProbeParser() {
  }

  public static ProbeList parse(List<ObjectSetProbe> specs) {
    List<Prober> probers = new ArrayList<>(specs.size());
    for (ObjectSetProbe spec : specs) {
      List<Prober> probes = new ArrayList<>(spec.probes().size());
      for (ProbeSpec probe : spec.probes()) {
        probes.add(parse(probe));
      }
      Prober prober = new ProbeList(probes);
      ObjectSetProbe.Selector selector = spec.selector();
      if (selector.selector() != null) {
        prober = new LabelSelectorProber(selector.selector(), prober);
      }
      if (selector.kind() != null) {
        prober = new KindSelector(selector.kind(), prober);
      }
      probers.add(prober);
    }
    return new ProbeList(probers);
  }

  static Prober parse(ProbeSpec probe) {
    if (probe.condition() != null) {
      return new ConditionProbe(probe.condition().type(), probe.condition().status());
    }
    if (probe.fieldsEqual() != null) {
      return new FieldsEqualProbe(probe.fieldsEqual().fieldA(), probe.fieldsEqual().fieldB());
    }
    if (probe.fieldValue() != null) {
      return new FieldValueProbe(probe.fieldValue().field(), probe.fieldValue().value());
    }
    if (probe.fieldExists() != null) {
      return new FieldExistsProbe(probe.fieldExists().field());
    }
    if (probe.currentGeneration() != null) {
      return new CurrentGenerationProbe();
    }
    throw new IllegalArgumentException("probe sets none of condition, fieldsEqual, fieldValue, fieldExists"
        + " or currentGeneration");
  }
}
