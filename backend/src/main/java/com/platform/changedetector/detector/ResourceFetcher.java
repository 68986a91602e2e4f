package com.platform.changedetector.detector;

import com.platform.changedetector.model.WatchedResource;

import java.util.List;

/**
 * Returns the complete current collection of one resource type, or throws.
 * No partial result is assumed on failure.
 */
@FunctionalInterface
public interface ResourceFetcher {
    
    List<WatchedResource> fetch() throws Exception;
}
