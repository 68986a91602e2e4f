package com.platform.changedetector.error;

/**
 * Standardized error codes for the change detector.
 * 
 * Format: CP-{CATEGORY}{NUMBER}
 * Categories:
 * - 4xx: External system errors (resource API, consumer thread)
 * - 9xx: Internal errors (configuration, unexpected)
 */
public enum ErrorCode {
    
    // ==================== External System Errors (4xx) ====================
    
    RESOURCE_FETCH_FAILED("CP-410", "Failed to fetch resource collection", ErrorCategory.RECOVERABLE),
    MALFORMED_RESOURCE_RESPONSE("CP-411", "Malformed resource collection response", ErrorCategory.RECOVERABLE),
    CHANGE_STREAM_INTERRUPTED("CP-420", "Change stream consumer interrupted", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    CONFIGURATION_ERROR("CP-900", "Configuration error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - the next polling cycle may succeed.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the stream or its consumer cannot continue.
         */
        FATAL
    }
}
