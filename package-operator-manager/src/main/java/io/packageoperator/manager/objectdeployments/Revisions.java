package io.packageoperator.manager.objectdeployments;

import io.packageoperator.api.Condition;
import io.packageoperator.api.ObjectSet;
import io.packageoperator.api.ObjectSetTemplatePhase;
import io.packageoperator.api.ObjectSetTemplateSpec;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.reconciler.Conditions;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Small queries over ObjectSet revisions.
 */
final class Revisions {

  static final Comparator<ObjectSet> BY_REVISION = Comparator
      .comparingLong(Revisions::number)
      .thenComparing(set -> set.metadata().name());

  private Revisions() {
  }

  static long number(ObjectSet set) {
    String annotation = set.metadata().annotations().get(PackageOperatorApi.REVISION_ANNOTATION);
    if (annotation != null) {
      try {
        return Long.parseLong(annotation);
      } catch (NumberFormatException e) {
        return 0L;
      }
    }
    return set.status().revision() == null ? 0L : set.status().revision();
  }

  static boolean isArchived(ObjectSet set) {
    return set.spec().lifecycleState() == ObjectSet.LifecycleState.ARCHIVED;
  }

  static boolean isAvailable(ObjectSet set) {
    return Conditions.isTrue(set.status().conditions(), PackageOperatorApi.CONDITION_AVAILABLE);
  }

  /**
   * A revision whose name was claimed by a pass that did not get to store its template yet.
   */
  static boolean isUnsealed(ObjectSet set, String templateHash) {
    return set.spec().lifecycleState() == ObjectSet.LifecycleState.PAUSED
        && set.spec().phases().isEmpty()
        && templateHash.equals(set.metadata().annotations().get(PackageOperatorApi.TEMPLATE_HASH_ANNOTATION));
  }

  static Set<String> sliceNames(ObjectSetTemplateSpec spec) {
    Set<String> names = new LinkedHashSet<>();
    for (ObjectSetTemplatePhase phase : spec.phases()) {
      names.addAll(phase.slices());
    }
    return names;
  }

  static Set<String> sliceNames(List<ObjectSet> revisions) {
    Set<String> names = new LinkedHashSet<>();
    for (ObjectSet revision : revisions) {
      names.addAll(sliceNames(revision.spec().template()));
    }
    return names;
  }

  static List<Condition> mappedConditions(ObjectSet set) {
    return set.status().conditions().stream().filter(Condition::isMapped).toList();
  }
}
