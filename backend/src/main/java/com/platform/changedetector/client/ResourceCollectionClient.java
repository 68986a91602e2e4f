package com.platform.changedetector.client;

import com.platform.changedetector.error.ResourceFetchException;
import com.platform.changedetector.model.ResourceTypeDescriptor;
import com.platform.changedetector.model.WatchedResource;

import java.util.List;

/**
 * Lists every object of a resource type.
 */
public interface ResourceCollectionClient {
    
    /**
     * Full current collection, in the order the server returns it.
     *
     * @throws ResourceFetchException if the collection could not be listed completely
     */
    List<WatchedResource> list(ResourceTypeDescriptor descriptor);
}
