package com.platform.changedetector.error;

/**
 * Raised by a resource client when a collection snapshot cannot be obtained.
 * No partial result accompanies it.
 */
public class ResourceFetchException extends ChangeDetectorException {
    
    private final String resourceType;
    
    public ResourceFetchException(ErrorCode errorCode, String resourceType, String message) {
        super(errorCode, message);
        this.resourceType = resourceType;
    }
    
    public ResourceFetchException(ErrorCode errorCode, String resourceType, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.resourceType = resourceType;
    }
    
    public static ResourceFetchException unavailable(String resourceType, String message, Throwable cause) {
        return new ResourceFetchException(
            ErrorCode.RESOURCE_FETCH_FAILED,
            resourceType,
            message,
            cause
        );
    }
    
    public static ResourceFetchException malformed(String resourceType, String message) {
        return new ResourceFetchException(
            ErrorCode.MALFORMED_RESOURCE_RESPONSE,
            resourceType,
            message
        );
    }
    
    public String getResourceType() {
        return resourceType;
    }
}
