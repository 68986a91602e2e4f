package com.platform.changedetector.feed;

import com.platform.changedetector.client.ResourceCollectionClient;
import com.platform.changedetector.config.ChangeDetectorProperties;
import com.platform.changedetector.detector.ChangeDetector;
import com.platform.changedetector.detector.ChangeStream;
import com.platform.changedetector.detector.ChangeStreamStatus;
import com.platform.changedetector.error.ChangeStreamInterruptedException;
import com.platform.changedetector.model.ChangeEvent;
import com.platform.changedetector.model.ResourceTypeDescriptor;
import com.platform.changedetector.observability.LoggingConfig;
import com.platform.changedetector.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pulls the change stream for the configured resource type on a dedicated thread
 * and hands every event to the registered handlers.
 *
 * Lifecycle:
 * 1. start() opens the stream and starts the pump thread
 * 2. the pump blocks in the stream between polling cycles
 * 3. stop() interrupts the pump, which ends the stream
 */
@Slf4j
@Component
public class ChangeFeedRunner implements SmartLifecycle {

    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final ChangeDetector changeDetector;
    private final ResourceCollectionClient resourceClient;
    private final ChangeDetectorProperties properties;
    private final List<ChangeEventHandler> handlers;
    private final MetricsRegistry metricsRegistry;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ChangeStream stream;
    private volatile Thread worker;

    public ChangeFeedRunner(
            ChangeDetector changeDetector,
            ResourceCollectionClient resourceClient,
            ChangeDetectorProperties properties,
            List<ChangeEventHandler> handlers,
            MetricsRegistry metricsRegistry) {
        this.changeDetector = changeDetector;
        this.resourceClient = resourceClient;
        this.properties = properties;
        this.handlers = List.copyOf(handlers);
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void start() {
        if (!properties.isEnabled()) {
            log.info("Change feed disabled, not polling");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        ResourceTypeDescriptor descriptor = properties.getDescriptor();
        ChangeStream opened = changeDetector.openChangeStream(
            descriptor.toString(),
            () -> resourceClient.list(descriptor),
            properties.getInterval(),
            LoggerFactory.getLogger(ChangeStream.class.getName() + "." + descriptor.plural())
        );
        stream = opened;

        if (handlers.isEmpty()) {
            log.warn("No change event handlers registered for {}", descriptor);
        }

        Thread thread = new Thread(() -> pump(opened), "change-feed-" + descriptor.plural());
        thread.setDaemon(true);
        worker = thread;
        thread.start();

        log.info("Change feed started for {} (interval={}ms, handlers={})",
            descriptor, properties.getInterval().toMillis(), handlers.size());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        Thread thread = worker;
        if (thread == null) {
            return;
        }

        thread.interrupt();
        try {
            thread.join(STOP_TIMEOUT.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for change feed to stop");
        }

        if (thread.isAlive()) {
            log.warn("Change feed thread {} still busy after {}ms, abandoning it",
                thread.getName(), STOP_TIMEOUT.toMillis());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Status of the active stream, empty when the feed never started.
     */
    public Optional<ChangeStreamStatus> getStatus() {
        ChangeStream current = stream;
        return current != null ? Optional.of(current.status()) : Optional.empty();
    }

    private void pump(ChangeStream changeStream) {
        LoggingConfig.setResourceTypeContext(changeStream.getName());
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                dispatch(changeStream.next());
            }
        } catch (ChangeStreamInterruptedException e) {
            log.debug("Change feed {} interrupted", changeStream.getName());
        } catch (RuntimeException e) {
            log.error("Change feed {} terminated unexpectedly", changeStream.getName(), e);
            running.set(false);
        } finally {
            log.info("Change feed {} stopped", changeStream.getName());
            LoggingConfig.clearResourceTypeContext();
        }
    }

    private void dispatch(ChangeEvent event) {
        for (ChangeEventHandler handler : handlers) {
            try {
                handler.onChange(event);
            } catch (Exception e) {
                log.error("Handler {} failed on {} {}",
                    handler.getName(), event.type(), event.resource().locator(), e);
                metricsRegistry.recordHandlerFailure(handler.getName());
            }
        }
    }
}
