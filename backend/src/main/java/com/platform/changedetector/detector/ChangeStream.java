package com.platform.changedetector.detector;

import com.platform.changedetector.error.ChangeStreamInterruptedException;
import com.platform.changedetector.error.ResourceFetchException;
import com.platform.changedetector.model.ChangeEvent;
import com.platform.changedetector.model.WatchedResource;
import com.platform.changedetector.observability.MetricsRegistry;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Unending, pull-driven sequence of change events synthesized from periodic snapshots.
 * 
 * Each cycle:
 * 1. Fetch the full collection (a failure is logged and the cycle is skipped)
 * 2. Emit DELETED for tracked resources missing from the snapshot, in table order
 * 3. Emit ADDED / MODIFIED for the snapshot, in fetch order
 * 4. Sleep for the polling interval
 * 
 * The tracked table is mutated one step at a time, right before the matching event
 * is returned from {@link #next()}, so a consumer that stops pulling also stops the loop.
 * Instances must be pulled from a single thread; {@link #status()} may be read from any thread.
 */
public class ChangeStream implements Iterator<ChangeEvent> {
    
    private final String name;
    private final ResourceFetcher fetcher;
    private final Duration interval;
    private final Logger logger;
    private final Sleeper sleeper;
    private final MetricsRegistry metricsRegistry;
    private final TrackedStateTable table = new TrackedStateTable();
    
    private Cycle currentCycle;
    private boolean started;
    
    private final AtomicLong completedCycles = new AtomicLong(0);
    private final AtomicLong failedFetches = new AtomicLong(0);
    private volatile int trackedResources;
    private volatile Instant lastSuccessfulFetch;
    private volatile Instant lastFailedFetch;
    
    ChangeStream(
            String name,
            ResourceFetcher fetcher,
            Duration interval,
            Logger logger,
            Sleeper sleeper,
            MetricsRegistry metricsRegistry) {
        this.name = name;
        this.fetcher = fetcher;
        this.interval = interval;
        this.logger = logger;
        this.sleeper = sleeper;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Always true: the sequence has no natural end.
     */
    @Override
    public boolean hasNext() {
        return true;
    }
    
    /**
     * Block until the next change is detected.
     *
     * @throws ChangeStreamInterruptedException if the calling thread is interrupted while
     *         waiting between cycles
     */
    @Override
    public ChangeEvent next() {
        while (true) {
            if (currentCycle != null) {
                Optional<ChangeEvent> event = currentCycle.advance();
                if (event.isPresent()) {
                    metricsRegistry.recordEvent(name, event.get().type());
                    return event.get();
                }
                currentCycle = null;
                completedCycles.incrementAndGet();
            }
            
            if (started) {
                pause();
            }
            started = true;
            currentCycle = beginCycle().orElse(null);
        }
    }
    
    /**
     * Sequential, ordered view of this stream. Terminal operations that need the whole
     * stream never return; use short-circuiting operations such as {@code limit}.
     */
    public Stream<ChangeEvent> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }
    
    public String getName() {
        return name;
    }
    
    /**
     * UIDs currently held in the tracked table. Only meaningful on the pulling thread.
     */
    public Set<String> trackedUids() {
        return table.uids();
    }
    
    public ChangeStreamStatus status() {
        return new ChangeStreamStatus(
            name,
            completedCycles.get(),
            failedFetches.get(),
            trackedResources,
            lastSuccessfulFetch,
            lastFailedFetch
        );
    }
    
    private Optional<Cycle> beginCycle() {
        long startNanos = System.nanoTime();
        List<WatchedResource> snapshot;
        
        try {
            snapshot = List.copyOf(Objects.requireNonNull(fetcher.fetch(), "fetcher returned null"));
        } catch (ResourceFetchException e) {
            logger.warn("Failed to fetch {} [{} {}]",
                e.getResourceType(), e.getErrorCode().getCode(), e.getErrorCode().getCategory(), e);
            return fetchFailed();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.warn("Failed to fetch {}", name, e);
            return fetchFailed();
        }
        
        lastSuccessfulFetch = Instant.now();
        metricsRegistry.recordFetchSuccess(name, (System.nanoTime() - startNanos) / 1_000_000);
        
        return Optional.of(new Cycle(table.absentFrom(snapshot), snapshot));
    }
    
    private Optional<Cycle> fetchFailed() {
        failedFetches.incrementAndGet();
        lastFailedFetch = Instant.now();
        metricsRegistry.recordFetchFailure(name);
        return Optional.empty();
    }
    
    private void pause() {
        try {
            sleeper.sleep(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChangeStreamInterruptedException(name, e);
        }
    }
    
    private void tableChanged() {
        trackedResources = table.size();
        metricsRegistry.updateTrackedResources(name, trackedResources);
    }
    
    /**
     * Remaining diff steps of one successful fetch. Deletions drain first.
     */
    private final class Cycle {
        
        private final Iterator<String> deletions;
        private final Iterator<WatchedResource> observations;
        
        private Cycle(List<String> deletions, List<WatchedResource> observations) {
            this.deletions = deletions.iterator();
            this.observations = observations.iterator();
        }
        
        /**
         * Apply steps until one produces an event; empty once the cycle is exhausted.
         */
        Optional<ChangeEvent> advance() {
            if (deletions.hasNext()) {
                WatchedResource removed = table.remove(deletions.next());
                tableChanged();
                logger.info("deleted {}", removed.locator());
                return Optional.of(ChangeEvent.deleted(removed));
            }
            
            while (observations.hasNext()) {
                WatchedResource observed = observations.next();
                Optional<WatchedResource> tracked = table.get(observed.uid());
                
                if (tracked.isEmpty()) {
                    table.put(observed);
                    tableChanged();
                    logger.info("added {}", observed.locator());
                    return Optional.of(ChangeEvent.added(observed));
                }
                
                if (observed.versionDiffersFrom(tracked.get())) {
                    table.put(observed);
                    logger.info("modified {}", observed.locator());
                    return Optional.of(ChangeEvent.modified(observed));
                }
                
                logger.debug("no change detected for {}", observed.locator());
            }
            
            return Optional.empty();
        }
    }
}
