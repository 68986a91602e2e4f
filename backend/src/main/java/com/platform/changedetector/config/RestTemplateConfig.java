package com.platform.changedetector.config;

import com.platform.changedetector.client.ServiceAccountTokenInterceptor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Path;

/**
 * REST client used to list custom resources from the API server.
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate kubernetesRestTemplate(RestTemplateBuilder builder, ChangeDetectorProperties properties) {
        ChangeDetectorProperties.Kubernetes kubernetes = properties.getKubernetes();
        
        RestTemplateBuilder configured = builder
            .rootUri(kubernetes.getApiServer())
            .setConnectTimeout(kubernetes.getConnectTimeout())
            .setReadTimeout(kubernetes.getReadTimeout());
        
        if (kubernetes.getTokenPath() != null && !kubernetes.getTokenPath().isBlank()) {
            configured = configured.additionalInterceptors(
                new ServiceAccountTokenInterceptor(Path.of(kubernetes.getTokenPath())));
        }
        
        return configured.build();
    }
}
