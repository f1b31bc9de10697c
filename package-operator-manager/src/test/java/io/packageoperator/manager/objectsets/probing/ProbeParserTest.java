package io.packageoperator.manager.objectsets.probing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.GroupKind;
import io.packageoperator.api.GroupVersionKind;
import io.packageoperator.api.LabelSelector;
import io.packageoperator.api.ObjectSetProbe;
import io.packageoperator.api.ProbeSpec;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProbeParserTest {

  private static final GroupVersionKind DEPLOYMENT = new GroupVersionKind("apps", "v1", "Deployment");
  private static final GroupVersionKind CONFIG_MAP = new GroupVersionKind("", "v1", "ConfigMap");

  @Test
  void kindSelectorLimitsProbesToOneKind() {
    ProbeList probes = ProbeParser.parse(List.of(new ObjectSetProbe(
        new ObjectSetProbe.Selector(new GroupKind("apps", "Deployment"), null),
        List.of(ProbeSpec.fieldExists(".status.readyReplicas")))));

    assertThat(probes.probe(ClusterObject.of(CONFIG_MAP, "test", "settings")).success()).isTrue();
    assertThat(probes.probe(ClusterObject.of(DEPLOYMENT, "test", "web")).messages())
        .containsExactly("\".status.readyReplicas\" missing");
  }

  @Test
  void labelSelectorLimitsProbesToMatchingObjects() {
    ProbeList probes = ProbeParser.parse(List.of(new ObjectSetProbe(
        new ObjectSetProbe.Selector(null, LabelSelector.matching("tier", "frontend")),
        List.of(ProbeSpec.fieldExists(".status.ready")))));
    ClusterObject backend = ClusterObject.of(DEPLOYMENT, "test", "api");
    backend.setLabel("tier", "backend");
    ClusterObject frontend = ClusterObject.of(DEPLOYMENT, "test", "web");
    frontend.setLabel("tier", "frontend");

    assertThat(probes.probe(backend).success()).isTrue();
    assertThat(probes.probe(frontend).success()).isFalse();
  }

  @Test
  void everyProbeSpecKindIsUnderstood() {
    assertThat(ProbeParser.parse(ProbeSpec.condition("Available", "True"))).isInstanceOf(ConditionProbe.class);
    assertThat(ProbeParser.parse(ProbeSpec.fieldsEqual(".a", ".b"))).isInstanceOf(FieldsEqualProbe.class);
    assertThat(ProbeParser.parse(ProbeSpec.fieldValue(".a", "x"))).isInstanceOf(FieldValueProbe.class);
    assertThat(ProbeParser.parse(ProbeSpec.fieldExists(".a"))).isInstanceOf(FieldExistsProbe.class);
    assertThat(ProbeParser.parse(ProbeSpec.currentGenerationProbe())).isInstanceOf(CurrentGenerationProbe.class);
  }

  @Test
  void emptyProbeSpecIsRejected() {
    assertThatThrownBy(() -> ProbeParser.parse(new ProbeSpec(null, null, null, null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("probe sets none of");
  }

  @Test
  void noProbesMeansEverythingIsAvailable() {
    ProbeList probes = ProbeParser.parse(List.of());

    assertThat(probes.isEmpty()).isTrue();
    assertThat(probes.probe(ClusterObject.of(DEPLOYMENT, "test", "web")).success()).isTrue();
  }
}
