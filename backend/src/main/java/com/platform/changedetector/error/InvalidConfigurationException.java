package com.platform.changedetector.error;

/**
 * Exception for configuration that cannot describe a watchable resource type.
 */
public class InvalidConfigurationException extends ChangeDetectorException {
    
    public InvalidConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }
}
