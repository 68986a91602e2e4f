package com.platform.changedetector.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Adds the pod's service account token as a bearer token.
 * The file is read on every request so projected tokens can rotate underneath us.
 */
@Slf4j
public class ServiceAccountTokenInterceptor implements ClientHttpRequestInterceptor {
    
    private final Path tokenPath;
    
    public ServiceAccountTokenInterceptor(Path tokenPath) {
        this.tokenPath = tokenPath;
    }
    
    @Override
    public ClientHttpResponse intercept(
            HttpRequest request,
            byte[] body,
            ClientHttpRequestExecution execution) throws IOException {
        
        if (Files.isReadable(tokenPath)) {
            String token = Files.readString(tokenPath, StandardCharsets.UTF_8).trim();
            if (!token.isEmpty()) {
                request.getHeaders().set(HttpHeaders.AUTHORIZATION, "Bearer " + token);
            }
        } else {
            log.trace("No service account token at {}, sending request unauthenticated", tokenPath);
        }
        
        return execution.execute(request, body);
    }
}
