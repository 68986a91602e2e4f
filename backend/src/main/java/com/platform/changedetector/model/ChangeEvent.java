package com.platform.changedetector.model;

/**
 * Watch-style notification derived from snapshot diffing.
 * For DELETED the resource is the last observed state.
 */
public record ChangeEvent(
    ChangeType type,
    WatchedResource resource
) {
    
    public static ChangeEvent added(WatchedResource resource) {
        return new ChangeEvent(ChangeType.ADDED, resource);
    }
    
    public static ChangeEvent modified(WatchedResource resource) {
        return new ChangeEvent(ChangeType.MODIFIED, resource);
    }
    
    public static ChangeEvent deleted(WatchedResource resource) {
        return new ChangeEvent(ChangeType.DELETED, resource);
    }
    
    public String uid() {
        return resource.uid();
    }
}
