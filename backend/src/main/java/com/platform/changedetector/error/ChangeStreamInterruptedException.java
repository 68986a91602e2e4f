package com.platform.changedetector.error;

/**
 * Thrown from a change stream when the pulling thread is interrupted while waiting
 * for the next polling cycle. The thread's interrupt flag is left set.
 */
public class ChangeStreamInterruptedException extends ChangeDetectorException {
    
    public ChangeStreamInterruptedException(String streamName, InterruptedException cause) {
        super(ErrorCode.CHANGE_STREAM_INTERRUPTED, "Change stream " + streamName + " interrupted", cause);
    }
}
