package com.platform.changedetector.config;

import com.platform.changedetector.model.ResourceTypeDescriptor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the change detector.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "changedetector")
public class ChangeDetectorProperties {
    
    /**
     * Whether the change-feed runner polls on startup.
     */
    private boolean enabled = true;
    
    /**
     * Wait between polling cycles.
     */
    @NotNull
    private Duration interval = Duration.ofSeconds(60);
    
    /**
     * Custom resource collection to watch.
     */
    @Valid
    private CustomResource customResource = new CustomResource();
    
    /**
     * Kubernetes API access.
     */
    @Valid
    private Kubernetes kubernetes = new Kubernetes();
    
    public ResourceTypeDescriptor getDescriptor() {
        return new ResourceTypeDescriptor(
            customResource.getGroup(),
            customResource.getVersion(),
            customResource.getPlural()
        );
    }
    
    /**
     * Group, version and plural name of the watched custom resource.
     */
    @Data
    public static class CustomResource {
        
        @NotBlank
        private String group = "kubernetes-client.io";
        
        @NotBlank
        private String version = "v1";
        
        @NotBlank
        private String plural = "externalsecrets";
    }
    
    /**
     * API server endpoint and credentials.
     */
    @Data
    public static class Kubernetes {
        
        /**
         * API server base URL.
         */
        @NotBlank
        private String apiServer = "https://kubernetes.default.svc";
        
        /**
         * Bearer token file; no Authorization header is sent when it does not exist.
         */
        private String tokenPath = "/var/run/secrets/kubernetes.io/serviceaccount/token";
        
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);
    }
}
