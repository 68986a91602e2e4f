package com.platform.changedetector.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.changedetector.error.ResourceFetchException;
import com.platform.changedetector.model.ResourceTypeDescriptor;
import com.platform.changedetector.model.WatchedResource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists custom resources across all namespaces through the Kubernetes REST API.
 */
@Slf4j
@Component
public class KubernetesResourceClient implements ResourceCollectionClient {
    
    private final RestTemplate restTemplate;
    
    public KubernetesResourceClient(RestTemplate kubernetesRestTemplate) {
        this.restTemplate = kubernetesRestTemplate;
    }
    
    @Override
    public List<WatchedResource> list(ResourceTypeDescriptor descriptor) {
        String path = descriptor.collectionPath();
        JsonNode body;
        
        try {
            body = restTemplate.getForObject(path, JsonNode.class);
        } catch (RestClientException e) {
            throw ResourceFetchException.unavailable(descriptor.toString(),
                "Failed to list " + path + ": " + e.getMessage(), e);
        }
        
        JsonNode items = body == null ? null : body.get("items");
        if (items == null || !items.isArray()) {
            throw ResourceFetchException.malformed(descriptor.toString(),
                "Response for " + path + " has no items array");
        }
        
        List<WatchedResource> resources = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            resources.add(WatchedResource.fromJson(item, descriptor));
        }
        
        log.debug("Listed {} {} resources", resources.size(), descriptor);
        return resources;
    }
}
