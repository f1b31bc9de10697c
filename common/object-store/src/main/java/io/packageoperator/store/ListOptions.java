package io.packageoperator.store;

import io.packageoperator.api.ClusterObject;
import io.packageoperator.api.LabelSelector;
import java.util.Map;

/**
 * Restricts list and watch calls to a namespace (empty means all) and a label selector.
 */
public record ListOptions(String namespace, LabelSelector selector) {
    public ListOptions {
        namespace = namespace == null ? "" : namespace;
        selector = selector == null ? LabelSelector.everything() : selector;
    }

    public static ListOptions all() {
        return new ListOptions("", null);
    }

    public static ListOptions inNamespace(String namespace) {
        return new ListOptions(namespace, null);
    }

    public static ListOptions labelled(String namespace, Map<String, String> labels) {
        return new ListOptions(namespace, LabelSelector.matching(labels));
    }

    public ListOptions withSelector(LabelSelector newSelector) {
        return new ListOptions(namespace, newSelector);
    }

    public boolean matches(ClusterObject object) {
        if (!namespace.isEmpty() && !namespace.equals(object.namespace())) {
            return false;
        }
        return selector.matches(object.labels());
    }
}
