package io.packageoperator.reconciler;

import io.packageoperator.api.Condition;
import io.packageoperator.api.ConditionMapping;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Copies conditions of controlled objects onto their owner. Mapped condition types contain a {@code /}.
 */
public final class MappedConditions {

  private MappedConditions() {
  }

  /**
   * Maps the conditions of a source object into {@code target}. Source conditions reporting an older
   * generation than the source's current one are skipped. Conditions that are already mapped keep
   * their type; others are mapped through {@code mappings}. Returns the destination types written.
   */
  public static Set<String> map(List<Condition> target,
                                List<Condition> source,
                                long sourceGeneration,
                                List<ConditionMapping> mappings,
                                long targetGeneration,
                                Instant now) {
    Set<String> written = new LinkedHashSet<>();
    for (Condition condition : source) {
      if (condition.observedGeneration() != null && condition.observedGeneration() != sourceGeneration) {
        continue;
      }
      List<String> destinations = new ArrayList<>();
      if (condition.isMapped()) {
        destinations.add(condition.type());
      }
      for (ConditionMapping mapping : mappings) {
        if (mapping.sourceType().equals(condition.type())) {
          destinations.add(mapping.destinationType());
        }
      }
      for (String destination : destinations) {
        Conditions.set(target, new Condition(destination, condition.status(), condition.reason(),
            condition.message(), targetGeneration, null), now);
        written.add(destination);
      }
    }
    return written;
  }

  /**
   * Removes mapped conditions whose type is not in {@code keep}. Returns whether anything was removed.
   */
  public static boolean deleteMappedExcept(List<Condition> conditions, Set<String> keep) {
    return conditions.removeIf(c -> c.isMapped() && !keep.contains(c.type()));
  }

  public static boolean deleteMapped(List<Condition> conditions) {
    return deleteMappedExcept(conditions, Set.of());
  }

  public static List<Condition> mapped(List<Condition> conditions) {
    return conditions.stream().filter(Condition::isMapped).toList();
  }
}
