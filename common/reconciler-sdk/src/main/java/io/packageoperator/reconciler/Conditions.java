package io.packageoperator.reconciler;

import io.packageoperator.api.Condition;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers over mutable condition lists. Mutators report whether anything changed so callers can skip
 * status writes.
 */
public final class Conditions {

  private Conditions() {
  }

  /**
   * Adds or replaces the condition of the same type. The transition time moves only when the status
   * changes; an explicit transition time on {@code condition} wins.
   */
  public static boolean set(List<Condition> conditions, Condition condition, Instant now) {
    Objects.requireNonNull(condition, "condition");
    for (int i = 0; i < conditions.size(); i++) {
      Condition existing = conditions.get(i);
      if (!existing.type().equals(condition.type())) {
        continue;
      }
      Instant transition = existing.status() == condition.status()
          ? existing.lastTransitionTime()
          : transitionTime(condition, now);
      Condition updated = condition.withLastTransitionTime(transition);
      if (updated.equals(existing)) {
        return false;
      }
      conditions.set(i, updated);
      return true;
    }
    conditions.add(condition.withLastTransitionTime(transitionTime(condition, now)));
    return true;
  }

  public static boolean remove(List<Condition> conditions, String type) {
    return conditions.removeIf(c -> c.type().equals(type));
  }

  public static Optional<Condition> find(List<Condition> conditions, String type) {
    return conditions.stream().filter(c -> c.type().equals(type)).findFirst();
  }

  public static boolean isTrue(List<Condition> conditions, String type) {
    return find(conditions, type).map(Condition::isTrue).orElse(false);
  }

  private static Instant transitionTime(Condition condition, Instant now) {
    return condition.lastTransitionTime() != null ? condition.lastTransitionTime() : now;
  }
}
