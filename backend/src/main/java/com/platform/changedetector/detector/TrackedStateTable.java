package com.platform.changedetector.detector;

import com.platform.changedetector.model.WatchedResource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Last observed state of every watched resource, keyed by UID.
 * Iterates in first-observation order; replacing an entry keeps its position.
 * Not thread safe: owned by the thread pulling the change stream.
 */
class TrackedStateTable {
    
    private final Map<String, WatchedResource> entries = new LinkedHashMap<>();
    
    Optional<WatchedResource> get(String uid) {
        return Optional.ofNullable(entries.get(uid));
    }
    
    void put(WatchedResource resource) {
        entries.put(resource.uid(), resource);
    }
    
    WatchedResource remove(String uid) {
        return entries.remove(uid);
    }
    
    /**
     * Tracked UIDs that do not appear in {@code snapshot}, in table order.
     */
    List<String> absentFrom(Collection<WatchedResource> snapshot) {
        Set<String> present = new HashSet<>();
        for (WatchedResource resource : snapshot) {
            present.add(resource.uid());
        }
        
        List<String> absent = new ArrayList<>();
        for (String uid : entries.keySet()) {
            if (!present.contains(uid)) {
                absent.add(uid);
            }
        }
        return absent;
    }
    
    Set<String> uids() {
        return Set.copyOf(entries.keySet());
    }
    
    int size() {
        return entries.size();
    }
}
