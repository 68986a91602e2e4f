package com.platform.changedetector.detector;

import com.platform.changedetector.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;

/**
 * Opens change streams over collections that only support "list current state".
 */
@Slf4j
@Component
public class ChangeDetector {
    
    static final String DEFAULT_STREAM = "default";
    
    private final MetricsRegistry metricsRegistry;
    private final Sleeper sleeper;
    
    @Autowired
    public ChangeDetector(MetricsRegistry metricsRegistry) {
        this(metricsRegistry, Sleeper.THREAD);
    }
    
    public ChangeDetector(MetricsRegistry metricsRegistry, Sleeper sleeper) {
        this.metricsRegistry = metricsRegistry;
        this.sleeper = sleeper;
    }
    
    /**
     * Open a change stream. Nothing is fetched until the first event is pulled.
     *
     * @param fetcher  returns the full current collection, or throws
     * @param interval wait between the end of one cycle and the next fetch, must be positive
     * @param logger   sink for per-resource change lines and fetch warnings
     */
    public ChangeStream openChangeStream(ResourceFetcher fetcher, Duration interval, Logger logger) {
        return openChangeStream(DEFAULT_STREAM, fetcher, interval, logger);
    }
    
    /**
     * Open a named change stream; the name tags its metrics and status.
     */
    public ChangeStream openChangeStream(String name, ResourceFetcher fetcher, Duration interval, Logger logger) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(logger, "logger");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Polling interval must be positive, got " + interval);
        }
        
        log.info("Opening change stream {} (interval={}ms)", name, interval.toMillis());
        return new ChangeStream(name, fetcher, interval, logger, sleeper, metricsRegistry);
    }
}
