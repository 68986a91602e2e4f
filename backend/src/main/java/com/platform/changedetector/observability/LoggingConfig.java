package com.platform.changedetector.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Logging configuration and MDC helpers for change-feed threads.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    static final String MDC_RESOURCE_TYPE = "resourceType";
    
    @Value("${spring.application.name:resource-change-detector}")
    private String applicationName;
    
    @PostConstruct
    public void init() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.putProperty("application", applicationName);
        }
        
        log.info("Logging configuration initialized for application: {}", applicationName);
    }
    
    /**
     * Tag log lines of the current thread with the watched resource type.
     */
    public static void setResourceTypeContext(String resourceType) {
        MDC.put(MDC_RESOURCE_TYPE, resourceType);
    }
    
    /**
     * Clear resource type context from MDC.
     */
    public static void clearResourceTypeContext() {
        MDC.remove(MDC_RESOURCE_TYPE);
    }
}
