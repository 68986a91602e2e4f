package com.platform.changedetector.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.changedetector.error.ResourceFetchException;

import java.util.Objects;

/**
 * One object of a watched collection as last fetched.
 *
 * @param uid             stable identifier, unique for the object's lifetime
 * @param resourceVersion opaque token, compared for equality only
 * @param locator         human readable path used in log lines
 * @param object          the full object, passed through unmodified
 */
public record WatchedResource(
    String uid,
    String resourceVersion,
    String locator,
    JsonNode object
) {
    
    public WatchedResource {
        Objects.requireNonNull(uid, "uid");
        Objects.requireNonNull(resourceVersion, "resourceVersion");
        Objects.requireNonNull(object, "object");
        if (locator == null) {
            locator = uid;
        }
    }
    
    /**
     * Map an API object. {@code metadata.uid} and {@code metadata.resourceVersion} are required;
     * the locator is {@code metadata.selfLink} when the server still sends one, otherwise it is
     * derived from the descriptor, namespace and name.
     */
    public static WatchedResource fromJson(JsonNode item, ResourceTypeDescriptor descriptor) {
        JsonNode metadata = item == null ? null : item.path("metadata");
        if (metadata == null || !metadata.isObject()) {
            throw ResourceFetchException.malformed(descriptor.toString(), "Item without metadata");
        }
        
        String uid = textOrNull(metadata, "uid");
        String resourceVersion = textOrNull(metadata, "resourceVersion");
        if (uid == null || resourceVersion == null) {
            throw ResourceFetchException.malformed(descriptor.toString(),
                String.format("Item %s is missing metadata.uid or metadata.resourceVersion",
                    textOrNull(metadata, "name")));
        }
        
        String locator = textOrNull(metadata, "selfLink");
        if (locator == null) {
            String name = textOrNull(metadata, "name");
            locator = name != null
                ? descriptor.objectPath(textOrNull(metadata, "namespace"), name)
                : uid;
        }
        
        return new WatchedResource(uid, resourceVersion, locator, item);
    }
    
    /**
     * Whether this observation carries a different version token than {@code other}.
     */
    public boolean versionDiffersFrom(WatchedResource other) {
        return !resourceVersion.equals(other.resourceVersion());
    }
    
    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
