package io.packageoperator.manager.slices;

import io.packageoperator.api.ApiJson;
import io.packageoperator.api.ContentHash;
import io.packageoperator.api.ObjectDeployment;
import io.packageoperator.api.ObjectKey;
import io.packageoperator.api.ObjectMeta;
import io.packageoperator.api.ObjectSetObject;
import io.packageoperator.api.ObjectSetTemplatePhase;
import io.packageoperator.api.ObjectSetTemplateSpec;
import io.packageoperator.api.ObjectSlice;
import io.packageoperator.api.OwnerReference;
import io.packageoperator.api.PackageOperatorApi;
import io.packageoperator.store.AlreadyExistsException;
import io.packageoperator.store.ListOptions;
import io.packageoperator.store.NotFoundException;
import io.packageoperator.store.TypedClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Content-addressed storage of phase objects.
 * <p>
 * Slice names derive from their content, so an existing slice with the computed name must hold the
 * same objects and belong to the same deployment. Stored slices are never modified.
 */
public class SliceStore {

  private static final Logger log = LoggerFactory.getLogger(SliceStore.class);

  private final TypedClient<ObjectSlice> slices;

  public SliceStore(TypedClient<ObjectSlice> slices) {
    this.slices = Objects.requireNonNull(slices, "slices");
  }

  public static String nameFor(String ownerName, List<ObjectSetObject> objects, int salt) {
    return ownerName + "-" + ContentHash.of(objects, salt);
  }

  /**
   * Stores {@code objects} as a slice of {@code deployment}. Returns the stored slice, which may be an
   * identical one created earlier.
   *
   * @throws SliceCollisionException when the name is taken by different content or another owner
   */
  public ObjectSlice create(ObjectDeployment deployment, List<ObjectSetObject> objects, int salt) {
    ObjectMeta owner = deployment.metadata();
    String name = nameFor(owner.name(), objects, salt);
    ObjectMeta metadata = ObjectMeta.named(owner.namespace(), name)
        .withLabels(Map.of(PackageOperatorApi.OBJECT_DEPLOYMENT_LABEL, owner.name()))
        .withOwnerReferences(List.of(OwnerReference.controllerOf(
            PackageOperatorApi.OBJECT_DEPLOYMENT.gvk(), owner.name(), owner.uid())));
    try {
      ObjectSlice created = slices.create(new ObjectSlice(metadata, objects));
      log.info("Created ObjectSlice {} for ObjectDeployment {}", created.metadata().key(), owner.key());
      return created;
    } catch (AlreadyExistsException e) {
      ObjectSlice existing = slices.get(ObjectKey.of(owner.namespace(), name));
      if (ApiJson.sameContent(existing.objects(), objects)
          && owner.name().equals(existing.metadata().labels().get(PackageOperatorApi.OBJECT_DEPLOYMENT_LABEL))) {
        log.debug("ObjectSlice {} already exists with identical content", existing.metadata().key());
        return existing;
      }
      throw new SliceCollisionException(existing.metadata().key());
    }
  }

  public Optional<ObjectSlice> get(String namespace, String name) {
    return slices.find(ObjectKey.of(namespace, name));
  }

  /**
   * Deletes the slice. A slice that is already gone counts as deleted.
   */
  public void delete(String namespace, String name) {
    try {
      slices.delete(ObjectKey.of(namespace, name));
    } catch (NotFoundException e) {
      log.debug("ObjectSlice {}/{} already deleted", namespace, name);
    }
  }

  public List<ObjectSlice> listFor(ObjectDeployment deployment) {
    return slices.list(ListOptions.labelled(deployment.metadata().namespace(),
        Map.of(PackageOperatorApi.OBJECT_DEPLOYMENT_LABEL, deployment.metadata().name())));
  }

  /**
   * Returns the phase's objects: inline objects first, then each referenced slice's objects in
   * reference order.
   *
   * @throws NotFoundException when a referenced slice does not exist
   */
  public List<ObjectSetObject> expand(String namespace, ObjectSetTemplatePhase phase) {
    List<ObjectSetObject> objects = new ArrayList<>(phase.objects());
    for (String sliceName : phase.slices()) {
      objects.addAll(slices.get(ObjectKey.of(namespace, sliceName)).objects());
    }
    return objects;
  }

  /**
   * Returns {@code spec} with every phase expanded inline.
   */
  public ObjectSetTemplateSpec expand(String namespace, ObjectSetTemplateSpec spec) {
    List<ObjectSetTemplatePhase> phases = new ArrayList<>(spec.phases().size());
    for (ObjectSetTemplatePhase phase : spec.phases()) {
      phases.add(phase.hasSlices()
          ? ObjectSetTemplatePhase.inline(phase.name(), expand(namespace, phase))
          : phase);
    }
    return spec.withPhases(phases);
  }
}
