package io.packageoperator.reconciler;

import static org.assertj.core.api.Assertions.assertThat;

import io.packageoperator.api.Condition;
import io.packageoperator.api.ConditionMapping;
import io.packageoperator.api.ConditionStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class MappedConditionsTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void mapsPrefixedAndConfiguredConditionsOfTheCurrentGeneration() {
    List<Condition> target = new ArrayList<>();
    List<Condition> source = List.of(
        Condition.of("my-prefix/Ready", ConditionStatus.TRUE, "Ok", "", 3),
        Condition.of("Available", ConditionStatus.TRUE, "MinimumReplicas", "", 3),
        Condition.of("Progressing", ConditionStatus.TRUE, "Old", "", 2));

    Set<String> written = MappedConditions.map(target, source, 3,
        List.of(new ConditionMapping("Available", "my-prefix/Available"),
            new ConditionMapping("Progressing", "my-prefix/Progressing")),
        7, NOW);

    assertThat(written).containsExactly("my-prefix/Ready", "my-prefix/Available");
    assertThat(target).extracting(Condition::observedGeneration).containsOnly(7L);
  }

  @Test
  void deletesStaleMappedConditionsOnly() {
    List<Condition> conditions = new ArrayList<>(List.of(
        Condition.of("Available", ConditionStatus.TRUE, "Ok", "", 1),
        Condition.of("a/Keep", ConditionStatus.TRUE, "Ok", "", 1),
        Condition.of("a/Stale", ConditionStatus.TRUE, "Ok", "", 1)));

    assertThat(MappedConditions.deleteMappedExcept(conditions, Set.of("a/Keep"))).isTrue();

    assertThat(conditions).extracting(Condition::type).containsExactly("Available", "a/Keep");
    assertThat(MappedConditions.mapped(conditions)).hasSize(1);
  }
}
