package com.platform.changedetector.observability;

import com.platform.changedetector.model.ChangeType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for change detector metrics.
 * Meters are tagged with the stream name so several watched collections can share one registry.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> gaugeValues;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();
    }

    /**
     * Record an emitted change event.
     */
    public void recordEvent(String stream, ChangeType type) {
        incrementCounter("changedetector.events", "stream", stream, "type", type.name());
    }

    /**
     * Record a successful snapshot fetch.
     */
    public void recordFetchSuccess(String stream, long latencyMs) {
        getCounter("changedetector.fetch.success", stream).increment();
        Timer timer = timers.computeIfAbsent(stream, k ->
            Timer.builder("changedetector.fetch.latency")
                .tag("stream", stream)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));

        timer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Record a failed snapshot fetch.
     */
    public void recordFetchFailure(String stream) {
        getCounter("changedetector.fetch.failure", stream).increment();
        log.debug("Recorded fetch failure for {}", stream);
    }

    /**
     * Update the tracked resource gauge for a stream.
     */
    public void updateTrackedResources(String stream, int count) {
        gaugeValues.computeIfAbsent(stream, k -> {
            AtomicInteger value = new AtomicInteger(0);
            Gauge.builder("changedetector.tracked.resources", value, AtomicInteger::get)
                .tag("stream", stream)
                .description("Resources in the tracked state table")
                .register(meterRegistry);
            return value;
        }).set(count);
    }

    /**
     * Record a handler that threw while processing an event.
     */
    public void recordHandlerFailure(String handler) {
        incrementCounter("changedetector.handler.failures", "handler", handler);
    }

    /**
     * Current tracked resource count, or -1 if the stream never reported.
     */
    public int getTrackedResources(String stream) {
        AtomicInteger value = gaugeValues.get(stream);
        return value != null ? value.get() : -1;
    }

    private void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }

    private Counter getCounter(String name, String stream) {
        String key = name + "." + stream;
        return counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tag("stream", stream)
                .register(meterRegistry));
    }
}
