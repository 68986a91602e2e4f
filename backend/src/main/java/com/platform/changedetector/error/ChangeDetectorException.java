package com.platform.changedetector.error;

/**
 * Base exception for all change detector exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class ChangeDetectorException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected ChangeDetectorException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected ChangeDetectorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ChangeDetectorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
