package com.platform.changedetector.model;

import com.platform.changedetector.error.InvalidConfigurationException;

/**
 * Identifies a custom resource collection on the API server.
 */
public record ResourceTypeDescriptor(
    String group,
    String version,
    String plural
) {
    
    public ResourceTypeDescriptor {
        if (isBlank(group) || isBlank(version) || isBlank(plural)) {
            throw new InvalidConfigurationException(
                String.format("Resource type requires group, version and plural (got %s/%s/%s)",
                    group, version, plural));
        }
    }
    
    /**
     * Cluster-wide list path, e.g. {@code /apis/kubernetes-client.io/v1/externalsecrets}.
     */
    public String collectionPath() {
        return "/apis/" + group + "/" + version + "/" + plural;
    }
    
    /**
     * Path of a single object. A null namespace yields the cluster-scoped form.
     */
    public String objectPath(String namespace, String name) {
        if (namespace == null || namespace.isEmpty()) {
            return collectionPath() + "/" + name;
        }
        return "/apis/" + group + "/" + version + "/namespaces/" + namespace + "/" + plural + "/" + name;
    }
    
    @Override
    public String toString() {
        return group + "/" + version + "/" + plural;
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
