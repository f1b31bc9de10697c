package io.packageoperator.reconciler;

import static org.assertj.core.api.Assertions.assertThat;

import io.packageoperator.api.Condition;
import io.packageoperator.api.ConditionStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConditionsTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instant T1 = Instant.parse("2024-01-01T00:05:00Z");

  @Test
  void transitionTimeOnlyMovesWhenStatusChanges() {
    List<Condition> conditions = new ArrayList<>();

    assertThat(Conditions.set(conditions, available(ConditionStatus.FALSE, "Pending"), T0)).isTrue();
    assertThat(Conditions.set(conditions, available(ConditionStatus.FALSE, "StillPending"), T1)).isTrue();
    assertThat(conditions.get(0).lastTransitionTime()).isEqualTo(T0);
    assertThat(conditions.get(0).reason()).isEqualTo("StillPending");

    assertThat(Conditions.set(conditions, available(ConditionStatus.TRUE, "Ready"), T1)).isTrue();
    assertThat(conditions.get(0).lastTransitionTime()).isEqualTo(T1);
  }

  @Test
  void settingAnIdenticalConditionIsNotAChange() {
    List<Condition> conditions = new ArrayList<>();
    Conditions.set(conditions, available(ConditionStatus.TRUE, "Ready"), T0);

    assertThat(Conditions.set(conditions, available(ConditionStatus.TRUE, "Ready"), T1)).isFalse();
    assertThat(conditions).hasSize(1);
  }

  @Test
  void findRemoveAndIsTrue() {
    List<Condition> conditions = new ArrayList<>();
    Conditions.set(conditions, available(ConditionStatus.TRUE, "Ready"), T0);

    assertThat(Conditions.isTrue(conditions, "Available")).isTrue();
    assertThat(Conditions.find(conditions, "Progressing")).isEmpty();
    assertThat(Conditions.remove(conditions, "Available")).isTrue();
    assertThat(Conditions.remove(conditions, "Available")).isFalse();
    assertThat(Conditions.isTrue(conditions, "Available")).isFalse();
  }

  private static Condition available(ConditionStatus status, String reason) {
    return Condition.of("Available", status, reason, "", 1);
  }
}
