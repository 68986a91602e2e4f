package com.platform.changedetector.detector;

import java.time.Duration;

/**
 * Timed wait between polling cycles.
 */
@FunctionalInterface
public interface Sleeper {
    
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
    
    void sleep(Duration duration) throws InterruptedException;
}
