package io.packageoperator.api;

/**
 * Kinds, labels, annotations and finalizers that form the wire contract of the engine.
 */
public final class PackageOperatorApi {

    public static final String GROUP = "package-operator.run";
    public static final String VERSION = "v1alpha1";

    public static final ResourceType<ObjectDeployment> OBJECT_DEPLOYMENT =
        ResourceType.of(new GroupVersionKind(GROUP, VERSION, "ObjectDeployment"), ObjectDeployment.class);
    public static final ResourceType<ObjectSet> OBJECT_SET =
        ResourceType.of(new GroupVersionKind(GROUP, VERSION, "ObjectSet"), ObjectSet.class);
    public static final ResourceType<ObjectSlice> OBJECT_SLICE =
        ResourceType.of(new GroupVersionKind(GROUP, VERSION, "ObjectSlice"), ObjectSlice.class);

    /** Set on every object the dynamic cache may index. */
    public static final String DYNAMIC_CACHE_LABEL = GROUP + "/cache";
    public static final String DYNAMIC_CACHE_LABEL_VALUE = "True";
    /** Guards release of dynamic cache registrations before the owner goes away. */
    public static final String CACHED_FINALIZER = GROUP + "/cached";
    /** Guards reverse-order teardown of the objects owned by an ObjectSet. */
    public static final String TEARDOWN_FINALIZER = GROUP + "/teardown";

    /** Name of the ObjectDeployment an ObjectSlice or ObjectSet belongs to. */
    public static final String OBJECT_DEPLOYMENT_LABEL = GROUP + "/object-deployment";
    public static final String REVISION_ANNOTATION = GROUP + "/revision";
    public static final String TEMPLATE_HASH_ANNOTATION = GROUP + "/template-hash";

    public static final String CONDITION_AVAILABLE = "Available";
    public static final String CONDITION_PROGRESSING = "Progressing";
    public static final String CONDITION_PAUSED = "Paused";
    public static final String CONDITION_ARCHIVED = "Archived";
    public static final String CONDITION_SLICE_COLLISION = "SliceCollision";

    private PackageOperatorApi() {
    }
}
