package io.packageoperator.store;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.OwnerReference;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ownership helpers. An object has at most one controller reference.
 */
public final class OwnerReferences {

    private OwnerReferences() {
    }

    public static Optional<OwnerReference> controllerOf(ClusterObject object) {
        return object.ownerReferences().stream().filter(OwnerReference::controls).findFirst();
    }

    public static boolean isControlledBy(ClusterObject object, String ownerUid) {
        return controllerOf(object).map(ref -> ref.uid().equals(ownerUid)).orElse(false);
    }

    public static boolean isOwnedBy(ClusterObject object, String ownerUid) {
        return object.ownerReferences().stream().anyMatch(ref -> ref.uid().equals(ownerUid));
    }

    /**
     * Makes {@code controller} the controlling owner. A previous controller stays listed as a plain owner.
     */
    public static void setController(ClusterObject object, OwnerReference controller) {
        List<OwnerReference> updated = new ArrayList<>();
        for (OwnerReference existing : object.ownerReferences()) {
            if (existing.uid().equals(controller.uid())) {
                continue;
            }
            if (existing.controls()) {
                updated.add(new OwnerReference(existing.apiVersion(), existing.kind(), existing.name(),
                    existing.uid(), null, existing.blockOwnerDeletion()));
            } else {
                updated.add(existing);
            }
        }
        updated.add(controller);
        object.setOwnerReferences(updated);
    }

    /**
     * Drops every reference to {@code ownerUid}. Returns whether anything changed.
     */
    public static boolean removeOwner(ClusterObject object, String ownerUid) {
        List<OwnerReference> references = object.ownerReferences();
        List<OwnerReference> updated = references.stream()
            .filter(ref -> !ref.uid().equals(ownerUid))
            .toList();
        if (updated.size() == references.size()) {
            return false;
        }
        object.setOwnerReferences(updated);
        return true;
    }
}
